package com.vidnyan.patchast.domain.patch;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps 1-based line numbers to offsets of line starts.
 */
final class SourceLines {

    private final int length;
    private final int[] starts;

    SourceLines(String source) {
        this.length = source.length();
        List<Integer> found = new ArrayList<>();
        found.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                found.add(i + 1);
            }
        }
        this.starts = found.stream().mapToInt(Integer::intValue).toArray();
    }

    int lineStart(int lineno) {
        if (lineno < 1) {
            return 0;
        }
        if (lineno > starts.length) {
            return length;
        }
        return starts[lineno - 1];
    }

    /**
     * Offset of a (line, column) position, clamped to the source.
     */
    int offsetOf(int lineno, int column) {
        return Math.min(lineStart(lineno) + column, length);
    }
}
