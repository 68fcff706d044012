package org.hackvm.translator.backend.emit;

import org.hackvm.translator.api.TranslationException;
import org.hackvm.translator.api.TranslatorErrorCode;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The nine VM stack operators and the Hack fragments that implement them.
 */
public enum ArithmeticOperator {
    ADD("add", Kind.BINARY, "D+M"),
    SUB("sub", Kind.BINARY, "M-D"),
    AND("and", Kind.BINARY, "D&M"),
    OR("or", Kind.BINARY, "D|M"),
    NEG("neg", Kind.UNARY, "-M"),
    NOT("not", Kind.UNARY, "!M"),
    EQ("eq", Kind.COMPARISON, "JEQ"),
    GT("gt", Kind.COMPARISON, "JGT"),
    LT("lt", Kind.COMPARISON, "JLT");

    /**
     * The stack shape of an operator.
     */
    public enum Kind {
        /** Pops two values and pushes one result computed in place. */
        BINARY,
        /** Rewrites the top value in place. */
        UNARY,
        /** Pops two values and pushes a boolean. */
        COMPARISON
    }

    private static final Map<String, ArithmeticOperator> BY_TOKEN = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ArithmeticOperator::token, Function.identity()));

    private final String token;
    private final Kind kind;
    private final String fragment;

    ArithmeticOperator(String token, Kind kind, String fragment) {
        this.token = token;
        this.kind = kind;
        this.fragment = fragment;
    }

    /**
     * Looks up an operator by its VM token.
     *
     * @param token The VM token, e.g. {@code add}.
     * @return The operator.
     * @throws TranslationException with {@link TranslatorErrorCode#INVALID_OPERATOR} if the token is unknown.
     */
    public static ArithmeticOperator fromToken(String token) throws TranslationException {
        ArithmeticOperator op = BY_TOKEN.get(token);
        if (op == null) {
            throw new TranslationException(TranslatorErrorCode.INVALID_OPERATOR, "Invalid arithmetic operator '" + token + "'");
        }
        return op;
    }

    public String token() {
        return token;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return The Hack {@code comp} mnemonic for binary and unary operators, the jump mnemonic for comparisons.
     */
    public String fragment() {
        return fragment;
    }
}
