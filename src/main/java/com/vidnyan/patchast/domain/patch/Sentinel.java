package com.vidnyan.patchast.domain.patch;

import java.util.regex.Pattern;

/**
 * Expected elements that stand for a class of spellings rather than fixed text.
 * Each resolves to whichever alternative is found first ahead of the cursor.
 */
public enum Sentinel {
    NUMBER(ScannerPatterns.NUMBER, false),
    /** Bounded by the start of the next pending statement. */
    STRING(ScannerPatterns.STRING, true),
    EMPTY_TUPLE(ScannerPatterns.EMPTY_TUPLE, false),
    /** {@code !=} or the legacy {@code <>}. */
    NOT_EQUAL(ScannerPatterns.NOT_EQUAL, false),
    /** {@code except E as e} or the legacy {@code except E, e}. */
    EXCEPT_AS_OR_COMMA(ScannerPatterns.AS_OR_COMMA, false),
    EXEC_OPEN_PAREN_OR_SPACE(ScannerPatterns.OPEN_PAREN_OR_NOTHING, false),
    EXEC_IN_OR_COMMA(ScannerPatterns.IN_OR_COMMA, false),
    EXEC_CLOSE_PAREN_OR_SPACE(ScannerPatterns.CLOSE_PAREN_OR_NOTHING, false),
    /** {@code with} before the first context manager, a comma before the others. */
    WITH_OR_COMMA(ScannerPatterns.WITH_OR_COMMA, false);

    private final Pattern pattern;
    private final boolean boundedByNextStatement;

    Sentinel(Pattern pattern, boolean boundedByNextStatement) {
        this.pattern = pattern;
        this.boundedByNextStatement = boundedByNextStatement;
    }

    public Pattern pattern() {
        return pattern;
    }

    public boolean isBoundedByNextStatement() {
        return boundedByNextStatement;
    }
}
