package org.hackvm.translator;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.hackvm.translator.backend.emit.ArithmeticOperator;

import java.util.Arrays;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable settings of one translation run, read from the {@code translator} block
 * of the HOCON configuration.
 *
 * <pre>
 * translator {
 *   stack-base = 256
 *   echo-comments = true
 *   halt-label = "END"
 *   output-extension = ".asm"
 * }
 * </pre>
 *
 * @param stackBase The initial value of the stack pointer.
 * @param echoComments Whether each block is preceded by a comment naming its VM instruction.
 * @param haltLabel The label of the terminal loop appended at the end of the program.
 * @param outputExtension The extension that replaces {@code .vm} when no output file is given.
 */
public record TranslatorOptions(int stackBase, boolean echoComments, String haltLabel, String outputExtension) {

    /** The configuration path of the translator block. */
    public static final String CONFIG_PATH = "translator";

    /** The first RAM address above the static segment. */
    public static final int MIN_STACK_BASE = 256;
    public static final int MAX_STACK_BASE = 32767;

    /** A Hack symbol: letters, digits, {@code _ . $ :}, not starting with a digit. */
    private static final Pattern HACK_SYMBOL = Pattern.compile("[A-Za-z_.$:][A-Za-z0-9_.$:]*");

    private static final Set<String> PREDEFINED_SYMBOLS = Set.of(
            "SP", "LCL", "ARG", "THIS", "THAT", "SCREEN", "KBD",
            "R0", "R1", "R2", "R3", "R4", "R5", "R6", "R7",
            "R8", "R9", "R10", "R11", "R12", "R13", "R14", "R15");

    /** The settings used when nothing is configured. */
    public static final TranslatorOptions DEFAULTS = new TranslatorOptions(MIN_STACK_BASE, true, "END", ".asm");

    public TranslatorOptions {
        if (stackBase < MIN_STACK_BASE || stackBase > MAX_STACK_BASE) {
            throw new ConfigException.BadValue(CONFIG_PATH + ".stack-base",
                    String.format("must be between %d and %d, was %d", MIN_STACK_BASE, MAX_STACK_BASE, stackBase));
        }
        validateHaltLabel(haltLabel);
        if (outputExtension == null || outputExtension.isBlank()) {
            throw new ConfigException.BadValue(CONFIG_PATH + ".output-extension", "must not be blank");
        }
    }

    private static void validateHaltLabel(String label) {
        String path = CONFIG_PATH + ".halt-label";
        if (label == null || !HACK_SYMBOL.matcher(label).matches()) {
            throw new ConfigException.BadValue(path, "must be a Hack symbol, was '" + label + "'");
        }
        if (PREDEFINED_SYMBOLS.contains(label)) {
            throw new ConfigException.BadValue(path, "must not be a predefined symbol, was '" + label + "'");
        }
        boolean clashes = Arrays.stream(ArithmeticOperator.values())
                .filter(op -> op.kind() == ArithmeticOperator.Kind.COMPARISON)
                .anyMatch(op -> label.startsWith(op.name() + "_"));
        if (clashes) {
            throw new ConfigException.BadValue(path, "must not use a comparison label prefix, was '" + label + "'");
        }
    }

    /**
     * Reads the options from a configuration. Missing keys fall back to {@link #DEFAULTS}.
     *
     * @param config The root configuration.
     * @return The options.
     * @throws ConfigException if a value has the wrong type or is out of range.
     */
    public static TranslatorOptions fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return DEFAULTS;
        }
        Config c = config.getConfig(CONFIG_PATH);
        return new TranslatorOptions(
                c.hasPath("stack-base") ? c.getInt("stack-base") : DEFAULTS.stackBase(),
                c.hasPath("echo-comments") ? c.getBoolean("echo-comments") : DEFAULTS.echoComments(),
                c.hasPath("halt-label") ? c.getString("halt-label") : DEFAULTS.haltLabel(),
                c.hasPath("output-extension") ? c.getString("output-extension") : DEFAULTS.outputExtension());
    }

    public TranslatorOptions withEchoComments(boolean enabled) {
        return new TranslatorOptions(stackBase, enabled, haltLabel, outputExtension);
    }
}
