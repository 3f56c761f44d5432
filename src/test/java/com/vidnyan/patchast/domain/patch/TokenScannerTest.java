package com.vidnyan.patchast.domain.patch;

import com.vidnyan.patchast.domain.model.Region;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class TokenScannerTest {

    @Test
    void consume_ShouldSkipMatchesInsideComments() {
        // Arrange
        TokenScanner scanner = new TokenScanner("x = (1 #)\n + 2)\n");

        // Act
        Region open = scanner.consume("(");
        Region close = scanner.consume(")");

        // Assert
        assertEquals(new Region(4, 5), open);
        assertEquals(new Region(14, 15), close);
        assertEquals(15, scanner.offset());
    }

    @Test
    void consume_ShouldReportCursorPositionWhenTokenIsMissing() {
        // Arrange
        TokenScanner scanner = new TokenScanner("a\nbc\n");
        scanner.consume("b");

        // Act
        MismatchedTokenException error = assertThrows(MismatchedTokenException.class, () -> scanner.consume("z"));

        // Assert
        assertEquals(2, error.getLine());
        assertEquals(1, error.getColumn());
        assertEquals("Token <z> at (2, 1) cannot be matched", error.getMessage());
    }

    @Test
    void consume_ShouldFailWhenOnlyMatchIsInFinalComment() {
        TokenScanner scanner = new TokenScanner("x # )");

        assertThrows(MismatchedTokenException.class, () -> scanner.consume(")"));
    }

    @Test
    void consumeUnchecked_ShouldMatchInsideComments() {
        TokenScanner scanner = new TokenScanner("# {\n{");

        assertEquals(new Region(2, 3), scanner.consumeUnchecked("{"));
    }

    @Test
    void consumeFieldOpening_ShouldStepOverDoubledBraces() {
        // Arrange
        TokenScanner scanner = new TokenScanner("{{a}} {{{b}");
        TokenScanner escapesOnly = new TokenScanner("{{a}}");

        // Act
        Region opening = scanner.consumeFieldOpening();

        // Assert
        assertEquals(new Region(8, 9), opening);
        assertEquals(9, scanner.offset());
        assertThrows(MismatchedTokenException.class, escapesOnly::consumeFieldOpening);
    }

    @Test
    void consumePattern_ShouldMatchNumberSpellings() {
        // Arrange
        TokenScanner scanner = new TokenScanner("0x1F + 1_000 + 1.5e-3j + .25 + 10. + 0o17 + 0b1010");
        String[] expected = {"0x1F", "1_000", "1.5e-3j", ".25", "10.", "0o17", "0b1010"};

        // Act & Assert
        for (String number : expected) {
            Region region = scanner.consumePattern(Sentinel.NUMBER.pattern());
            assertEquals(number, scanner.text(region));
        }
    }

    @Test
    void consumePattern_ShouldJoinImplicitlyConcatenatedStrings() {
        // Arrange
        String source = "'a'\n  # note\n  \"b\" rb'c' + x";
        TokenScanner scanner = new TokenScanner(source);

        // Act
        Region region = scanner.consumePattern(Sentinel.STRING.pattern());

        // Assert
        assertEquals("'a'\n  # note\n  \"b\" rb'c'", scanner.text(region));
    }

    @Test
    void consumePattern_ShouldMatchTripleQuotedAndFormattedStrings() {
        // Arrange
        TokenScanner scanner = new TokenScanner("\"\"\"one \"two\"\nthree\"\"\" f'{x}' 'it\\'s'");

        // Act & Assert
        assertEquals("\"\"\"one \"two\"\nthree\"\"\" f'{x}' 'it\\'s'",
                scanner.text(scanner.consumePattern(Sentinel.STRING.pattern())));
    }

    @Test
    void consumePattern_ShouldStopAtBound() {
        // Arrange: two separate statements, each a string
        String source = "'a'\n'b'\n";

        // Act
        TokenScanner bounded = new TokenScanner(source);
        TokenScanner unbounded = new TokenScanner(source);

        // Assert
        assertEquals(new Region(0, 3), bounded.consumePattern(Sentinel.STRING.pattern(), 4));
        assertEquals(new Region(0, 7), unbounded.consumePattern(Sentinel.STRING.pattern()));
    }

    @Test
    void consumePattern_ShouldAcceptLegacyNotEqual() {
        TokenScanner scanner = new TokenScanner("a <> b != c");

        assertEquals("<>", scanner.text(scanner.consumePattern(Sentinel.NOT_EQUAL.pattern())));
        assertEquals("!=", scanner.text(scanner.consumePattern(Sentinel.NOT_EQUAL.pattern())));
    }

    @Test
    void rfindToken_ShouldFindLastTokenOutsideComments() {
        // Arrange
        TokenScanner scanner = new TokenScanner("f((a), b)");
        TokenScanner commented = new TokenScanner("x = 1 # (\ny");

        // Act & Assert
        assertEquals(OptionalInt.of(2), scanner.rfindToken("(", 0, 3));
        assertEquals(OptionalInt.empty(), scanner.rfindToken("(", 3, 9));
        assertEquals(OptionalInt.empty(), commented.rfindToken("(", 0, 11));
    }

    @Test
    void consumeRest_ShouldMoveCursorToEnd() {
        TokenScanner scanner = new TokenScanner("pass\n\n");
        scanner.consume("pass");

        assertEquals(new Region(4, 6), scanner.consumeRest());
        assertEquals(6, scanner.offset());
    }

    @Test
    void slice_ShouldBeEmptyForReversedBounds() {
        TokenScanner scanner = new TokenScanner("abc");

        assertEquals("", scanner.slice(2, 1));
        assertEquals("bc", scanner.slice(1, 10));
    }
}
