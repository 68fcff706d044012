package org.hackvm.translator.frontend.parser;

/**
 * The structured form of one classified VM instruction.
 *
 * @param type The command class.
 * @param arg1 The operator for arithmetic commands, the keyword for {@code return},
 *             the label name for label/goto/if-goto, otherwise the second token.
 * @param arg2 The integer argument of push/pop/function/call, {@code null} for all other commands.
 */
public record ParsedCommand(CommandType type, String arg1, Integer arg2) {

    public boolean hasArg2() {
        return arg2 != null;
    }
}
