package org.chasm.compiler.api;

/**
 * An exception that is thrown when an error occurs during the compilation process.
 * Every error is fatal: the first one thrown ends the compilation.
 * <p>
 * It is part of the public API and hides the internal phase types of the compiler.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final String detail;
    private final transient SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with an error code and the position it refers to.
     * @param errorCode The error code.
     * @param detail The detail message, without position.
     * @param sourceInfo The source information, may be null.
     */
    public CompilationException(CompilerErrorCode errorCode, String detail, SourceInfo sourceInfo) {
        super(sourceInfo != null ? String.format("%s at %s", detail, sourceInfo) : detail, null);
        this.errorCode = errorCode;
        this.detail = detail;
        this.sourceInfo = sourceInfo;
    }

    /**
     * Constructs a new compilation exception with an error code and cause.
     * @param errorCode The error code.
     * @param detail The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
        this.detail = detail;
        this.sourceInfo = null;
    }

    /**
     * @return The error code of this failure.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The message without the position suffix.
     */
    public String getDetail() {
        return detail;
    }

    /**
     * @return The source position the error refers to, or null if it has none.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
