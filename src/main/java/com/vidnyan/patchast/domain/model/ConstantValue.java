package com.vidnyan.patchast.domain.model;

/**
 * Value of a {@code Constant} node: its category and the parser's rendering of it.
 * The rendering is not the source spelling ({@code 0x1F} renders as {@code 31}).
 *
 * @param text the string itself for {@code STR} constants, otherwise null
 */
public record ConstantValue(Kind kind, String repr, String text) {

    public enum Kind {
        STR,
        BYTES,
        INT,
        FLOAT,
        COMPLEX,
        BOOL,
        NONE,
        ELLIPSIS
    }

    public boolean isString() {
        return kind == Kind.STR || kind == Kind.BYTES;
    }

    public boolean isNumber() {
        return kind == Kind.INT || kind == Kind.FLOAT || kind == Kind.COMPLEX;
    }

    public static ConstantValue of(Kind kind, String repr) {
        return new ConstantValue(kind, repr, null);
    }

    public static ConstantValue ofString(String text, String repr) {
        return new ConstantValue(Kind.STR, repr, text);
    }
}
