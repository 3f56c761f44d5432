package com.vidnyan.patchast.domain.model;

/**
 * Span of source text covered by a node, as offsets into the normalized source.
 */
public record Region(int start, int end) {

    public Region {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid region (" + start + ", " + end + ")");
        }
    }

    public static Region empty(int offset) {
        return new Region(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(Region other) {
        return other.start >= start && other.end <= end;
    }

    public String text(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return "(" + start + ", " + end + ")";
    }
}
