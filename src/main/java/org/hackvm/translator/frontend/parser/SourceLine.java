package org.hackvm.translator.frontend.parser;

/**
 * A retained input line: comment removed, whitespace trimmed, never empty.
 *
 * @param lineNumber The 1-based line number in the original input.
 * @param text The instruction text.
 */
public record SourceLine(int lineNumber, String text) {

    private static final String COMMENT_START = "//";

    /**
     * Strips the trailing comment and surrounding whitespace from a raw input line.
     *
     * @param rawLine The line as read from the input.
     * @return The instruction text, empty if nothing remains.
     */
    public static String strip(String rawLine) {
        int comment = rawLine.indexOf(COMMENT_START);
        String code = comment >= 0 ? rawLine.substring(0, comment) : rawLine;
        return code.strip();
    }
}
