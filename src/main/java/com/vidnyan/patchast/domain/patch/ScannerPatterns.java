package com.vidnyan.patchast.domain.patch;

import java.util.regex.Pattern;

/**
 * Patterns for literals whose source spelling cannot be rebuilt from the tree.
 * Compiled once and shared read-only by all traversals.
 */
final class ScannerPatterns {

    private static final String DIGITS = "\\d(?:_?\\d)*";
    private static final String HEX = "0[xX](?:_?[\\da-fA-F])+";
    private static final String OCTAL = "0[oO](?:_?[0-7])+";
    private static final String BINARY = "0[bB](?:_?[01])+";
    private static final String INTEGER = "-?(?:" + HEX + "|" + OCTAL + "|" + BINARY + "|" + DIGITS + ")[lL]?";

    private static final String LONG_STRING = "\"\"\"[^\"\\\\]*(?:(?:\\\\[\\s\\S]|\"(?!\"\"))[^\"\\\\]*)*\"\"\"";
    private static final String SHORT_STRING = "\"[^\"\\\\\\n]*(?:\\\\[\\s\\S][^\"\\\\\\n]*)*\"";

    private static final String PLAIN_PREFIX = "(?<![fF])(?:\\b(?:[rR][bB]|[bB][rR]|[uUbB]?[rR]?))?";
    private static final String FORMATTED_PREFIX = "(?:\\b[rR]?[fF]|[fF][rR]?)";

    static final Pattern NUMBER = Pattern.compile(
            "(?:" + INTEGER + "(?:\\.(?:" + DIGITS + ")?)?|\\." + DIGITS + ")(?:[eE][-+]?" + DIGITS + ")?[jJ]?");

    /** One string literal or several implicitly concatenated ones. */
    static final Pattern STRING = Pattern.compile(concatenated(
            "(?:" + withPrefix(PLAIN_PREFIX) + ")|(?:" + withPrefix(FORMATTED_PREFIX) + ")"));

    static final Pattern NOT_EQUAL = Pattern.compile("<>|!=");
    static final Pattern EMPTY_TUPLE = Pattern.compile("\\(\\s*\\)");
    static final Pattern AS_OR_COMMA = Pattern.compile("as|,");
    static final Pattern OPEN_PAREN_OR_NOTHING = Pattern.compile("\\(|");
    static final Pattern IN_OR_COMMA = Pattern.compile("in|,");
    static final Pattern CLOSE_PAREN_OR_NOTHING = Pattern.compile("\\)|");
    static final Pattern WITH_OR_COMMA = Pattern.compile("with|,");

    private ScannerPatterns() {
    }

    private static String withPrefix(String prefix) {
        return prefix + "(?:" + String.join("|",
                LONG_STRING,
                LONG_STRING.replace('"', '\''),
                SHORT_STRING,
                SHORT_STRING.replace('"', '\'')) + ")";
    }

    private static String concatenated(String single) {
        return "(?:" + single + ")(?:(?:\\s|\\\\\\n|#[^\\n]*\\n)*(?:" + single + "))*";
    }
}
