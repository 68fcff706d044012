package org.hackvm.translator.api;

/**
 * An exception that is thrown when the translation of a VM program fails.
 * <p>
 * Every translation error is terminal: the run stops at the first failing instruction
 * and no output is produced.
 */
public class TranslationException extends Exception {

    private final TranslatorErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new translation exception with the specified error code and detail message.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public TranslationException(TranslatorErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    /**
     * Constructs a new translation exception with the specified error code, detail message and cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public TranslationException(TranslatorErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    /**
     * Constructs a new translation exception located at the given instruction.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The position of the failing instruction, may be null.
     * @param cause The cause, may be null.
     */
    public TranslationException(TranslatorErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(sourceInfo == null ? message : String.format("%s at %s", message, sourceInfo), cause);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * Returns a copy of this exception that is located at the given instruction.
     * The original message and error code are preserved and this exception becomes the cause.
     *
     * @param source The position of the failing instruction.
     * @return A located exception, or {@code this} if it already carries a position.
     */
    public TranslationException at(SourceInfo source) {
        if (this.sourceInfo != null || source == null) {
            return this;
        }
        return new TranslationException(errorCode, getMessage(), source, this);
    }

    public TranslatorErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The position of the failing instruction, or {@code null} if unknown.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
