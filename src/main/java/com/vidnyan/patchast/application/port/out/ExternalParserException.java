package com.vidnyan.patchast.application.port.out;

/**
 * Failure reported by a {@link PythonParser}: either the parser rejected the
 * source, or the parser itself could not run.
 */
public class ExternalParserException extends RuntimeException {

    private final boolean sourceRejected;

    private ExternalParserException(String message, boolean sourceRejected, Throwable cause) {
        super(message, cause);
        this.sourceRejected = sourceRejected;
    }

    /**
     * The source is malformed; {@code message} is the parser's own.
     */
    public static ExternalParserException rejected(String message) {
        return new ExternalParserException(message, true, null);
    }

    public static ExternalParserException failed(String message) {
        return new ExternalParserException(message, false, null);
    }

    public static ExternalParserException failed(String message, Throwable cause) {
        return new ExternalParserException(message, false, cause);
    }

    public boolean isSourceRejected() {
        return sourceRejected;
    }
}
