package org.hackvm.translator.api;

/**
 * Defines unique, testable error codes for all errors that can occur during translation.
 * This decouples the test logic from the error messages.
 */
public enum TranslatorErrorCode {
    /** The first token of an instruction is not a known command, or a label token is malformed. */
    MALFORMED_INSTRUCTION,
    /** A command has fewer tokens than its command class requires. */
    INSUFFICIENT_TOKENS,
    /** A push/pop names a segment that is not in the segment table. */
    UNKNOWN_SEGMENT,
    /** The arithmetic handler received a token outside the fixed operator set. */
    INVALID_OPERATOR,
    /** {@code advance()} was called with no retained instructions left. */
    EXHAUSTED_INPUT,
    /** The input could not be read or the output could not be written. */
    FILE_IO,
    /** An index is not a non-negative integer or lies outside the segment's range. */
    INVALID_INDEX,
    /** The operation is not defined for the segment, e.g. {@code pop constant}. */
    INVALID_SEGMENT_OPERATION
}
