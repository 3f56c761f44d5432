package com.vidnyan.patchast.domain.patch;

import com.vidnyan.patchast.domain.model.Region;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Forward cursor over an immutable source buffer.
 * Matches that fall inside a line comment are rejected.
 */
public class TokenScanner {

    private final String source;
    private int offset;

    public TokenScanner(String source) {
        this.source = source;
    }

    public String source() {
        return source;
    }

    public int offset() {
        return offset;
    }

    void reset(int offset) {
        this.offset = offset;
    }

    /**
     * Consumes the next occurrence of {@code token} that is not inside a comment.
     *
     * @throws MismatchedTokenException if there is none
     */
    public Region consume(String token) {
        int found;
        while (true) {
            found = source.indexOf(token, offset);
            if (found < 0) {
                throw mismatch(token);
            }
            if (isOutsideComment(found, offset)) {
                break;
            }
            skipComment(token);
        }
        offset = found + token.length();
        return new Region(found, offset);
    }

    /**
     * Consumes the next occurrence of {@code token} without the comment test.
     * Used for pieces of formatted strings, where {@code #} is ordinary text.
     */
    public Region consumeUnchecked(String token) {
        int found = source.indexOf(token, offset);
        if (found < 0) {
            throw mismatch(token);
        }
        offset = found + token.length();
        return new Region(found, offset);
    }

    /**
     * Consumes the next brace that opens a replacement field of a formatted
     * string, stepping over doubled braces.
     */
    public Region consumeFieldOpening() {
        int index = offset;
        while (index < source.length()) {
            if (source.charAt(index) == '{') {
                if (index + 1 < source.length() && source.charAt(index + 1) == '{') {
                    index += 2;
                    continue;
                }
                offset = index + 1;
                return new Region(index, offset);
            }
            index++;
        }
        throw mismatch("{");
    }

    /**
     * Consumes the first match of {@code pattern} that starts before {@code end}
     * and is not inside a comment.
     */
    public Region consumePattern(Pattern pattern, int end) {
        while (true) {
            Matcher matcher = pattern.matcher(source);
            matcher.useTransparentBounds(true);
            matcher.useAnchoringBounds(false);
            matcher.region(offset, Math.max(offset, Math.min(end, source.length())));
            if (!matcher.find()) {
                throw mismatch(pattern.pattern());
            }
            if (isOutsideComment(matcher.start(), offset)) {
                offset = matcher.end();
                return new Region(matcher.start(), matcher.end());
            }
            skipComment(pattern.pattern());
        }
    }

    public Region consumePattern(Pattern pattern) {
        return consumePattern(pattern, source.length());
    }

    /**
     * Consumes everything up to the end of the buffer.
     */
    public Region consumeRest() {
        Region rest = new Region(offset, source.length());
        offset = source.length();
        return rest;
    }

    /**
     * Last occurrence of {@code token} inside {@code [start, end)} that is not
     * inside a comment starting at or after {@code start}.
     */
    public OptionalInt rfindToken(String token, int start, int end) {
        int limit = end;
        while (true) {
            int index = source.lastIndexOf(token, limit - token.length());
            if (index < start || limit - token.length() < start) {
                return OptionalInt.empty();
            }
            if (isOutsideComment(index, start)) {
                return OptionalInt.of(index);
            }
            limit = index;
        }
    }

    /**
     * Text between two offsets; empty when {@code to <= from}.
     */
    public String slice(int from, int to) {
        int begin = Math.max(0, Math.min(from, source.length()));
        int finish = Math.max(0, Math.min(to, source.length()));
        return finish <= begin ? "" : source.substring(begin, finish);
    }

    public String text(Region region) {
        return source.substring(region.start(), region.end());
    }

    /**
     * True unless a {@code #} between {@code start} and {@code position} begins
     * a comment that is still open at {@code position}.
     */
    private boolean isOutsideComment(int position, int start) {
        int comment = lastIndexIn('#', start, position);
        if (comment < 0) {
            return true;
        }
        int newline = lastIndexIn('\n', start, position);
        if (newline < 0) {
            return false;
        }
        return comment < newline;
    }

    private int lastIndexIn(char ch, int start, int end) {
        if (end <= start) {
            return -1;
        }
        int index = source.lastIndexOf(ch, end - 1);
        return index >= start ? index : -1;
    }

    private void skipComment(String token) {
        int newline = source.indexOf('\n', offset + 1);
        if (newline < 0) {
            throw mismatch(token);
        }
        offset = newline;
    }

    private MismatchedTokenException mismatch(String token) {
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new MismatchedTokenException(token, line, offset - lineStart);
    }
}
