package org.hackvm.translator.api;

/**
 * A pure data class representing the position of a VM instruction in its input.
 *
 * @param fileName The logical name of the input (file name or {@code <memory>}).
 * @param lineNumber The 1-based line number in the original input.
 * @param lineContent The instruction text after comment stripping and trimming.
 */
public record SourceInfo(String fileName, int lineNumber, String lineContent) {

    @Override
    public String toString() {
        return String.format("%s:%d (%s)", fileName, lineNumber, lineContent);
    }
}
