package com.vidnyan.patchast.domain.patch;

/**
 * An expected token could not be found ahead of the scanner cursor.
 * The tree and the source text disagree; the traversal cannot continue.
 */
public class MismatchedTokenException extends RuntimeException {

    private final String token;
    private final int line;
    private final int column;

    public MismatchedTokenException(String token, int line, int column) {
        super("Token <" + token + "> at (" + line + ", " + column + ") cannot be matched");
        this.token = token;
        this.line = line;
        this.column = column;
    }

    public String getToken() {
        return token;
    }

    /** 1-based line of the cursor when matching failed. */
    public int getLine() {
        return line;
    }

    /** 0-based column of the cursor when matching failed. */
    public int getColumn() {
        return column;
    }
}
