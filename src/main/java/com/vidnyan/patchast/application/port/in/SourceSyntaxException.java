package com.vidnyan.patchast.application.port.in;

/**
 * The parser rejected the source. The line number is always 1: normalization
 * may have shifted the parser's own position.
 */
public class SourceSyntaxException extends RuntimeException {

    private final String filename;
    private final int lineno;
    private final String msg;

    public SourceSyntaxException(String filename, String msg, Throwable cause) {
        super(msg + " (" + filename + ", line 1)", cause);
        this.filename = filename;
        this.lineno = 1;
        this.msg = msg;
    }

    public String getFilename() {
        return filename;
    }

    public int getLineno() {
        return lineno;
    }

    /** The parser's message, verbatim. */
    public String getMsg() {
        return msg;
    }
}
