package org.hackvm.translator.frontend.parser;

/**
 * The closed set of VM command classes recognized by the {@link Parser}.
 * <p>
 * Each class declares how many whitespace separated tokens an instruction of that
 * class needs, including the command token itself.
 */
public enum CommandType {
    /** One of the nine stack operators, e.g. {@code add}. */
    ARITHMETIC(1),
    /** {@code push segment index}. */
    PUSH(3),
    /** {@code pop segment index}. */
    POP(3),
    /** A label definition written as {@code (NAME)}. */
    LABEL(1),
    /** {@code goto label}. */
    GOTO(2),
    /** {@code if-goto label}. */
    IF(2),
    /** {@code function name nLocals}. */
    FUNCTION(3),
    /** {@code return}. */
    RETURN(1),
    /** {@code call name nArgs}. */
    CALL(3);

    private final int requiredTokens;

    CommandType(int requiredTokens) {
        this.requiredTokens = requiredTokens;
    }

    public int requiredTokens() {
        return requiredTokens;
    }
}
