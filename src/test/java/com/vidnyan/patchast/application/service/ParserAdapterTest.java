package com.vidnyan.patchast.application.service;

import com.vidnyan.patchast.PatchAstProperties;
import com.vidnyan.patchast.application.port.in.SourceSyntaxException;
import com.vidnyan.patchast.application.port.out.ExternalParserException;
import com.vidnyan.patchast.application.port.out.PythonParser;
import com.vidnyan.patchast.domain.model.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.vidnyan.patchast.domain.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class ParserAdapterTest {

    @Test
    void normalize_ShouldRewriteLineEndingsAndAppendNewline() {
        assertEquals("a\nb\nc\n", ParserAdapter.normalize("a\r\nb\rc"));
        assertEquals("\n", ParserAdapter.normalize(""));
        assertEquals("x = 1\n", ParserAdapter.normalize("x = 1\n"));
        assertEquals("a\n\nb\n", ParserAdapter.normalize("a\r\r\nb"));
    }

    @Test
    void normalize_ShouldBeIdempotent() {
        String once = ParserAdapter.normalize("if a:\r\n    pass\r");

        assertEquals(once, ParserAdapter.normalize(once));
    }

    @Test
    void normalize_ShouldDecodeUtf8AndDropByteOrderMark() {
        // Arrange
        byte[] withMark = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'x', ' ', '=', ' ', '1'};
        byte[] accented = "s = 'café'\r\n".getBytes(StandardCharsets.UTF_8);

        // Act & Assert
        assertEquals("x = 1\n", ParserAdapter.normalize(withMark));
        assertEquals("s = 'café'\n", ParserAdapter.normalize(accented));
    }

    @Test
    void parse_ShouldHandNormalizedSourceToParser() {
        // Arrange
        List<String> received = new ArrayList<>();
        SyntaxNode root = module(pass(1, 0));
        PythonParser parser = (source, filename) -> {
            received.add(source);
            received.add(filename);
            return root;
        };
        ParserAdapter adapter = new ParserAdapter(parser, new PatchAstProperties());

        // Act
        ParserAdapter.ParsedSource parsed = adapter.parse("pass\r\n", "job.py");

        // Assert
        assertEquals(List.of("pass\n", "job.py"), received);
        assertEquals("pass\n", parsed.source());
        assertSame(root, parsed.root());
    }

    @Test
    void parse_ShouldReportRejectedSourceAsSyntaxErrorOnFirstLine() {
        // Arrange
        PythonParser parser = (source, filename) -> {
            throw ExternalParserException.rejected("'(' was never closed");
        };
        ParserAdapter adapter = new ParserAdapter(parser, new PatchAstProperties());

        // Act
        SourceSyntaxException error = assertThrows(SourceSyntaxException.class,
                () -> adapter.parse("\n\nx = (\n", null));

        // Assert
        assertEquals("<string>", error.getFilename());
        assertEquals(1, error.getLineno());
        assertEquals("'(' was never closed", error.getMsg());
        assertEquals("'(' was never closed (<string>, line 1)", error.getMessage());
        assertInstanceOf(ExternalParserException.class, error.getCause());
    }

    @Test
    void parse_ShouldPropagateParserFailures() {
        PythonParser parser = (source, filename) -> {
            throw ExternalParserException.failed("Cannot start Python interpreter python3");
        };
        ParserAdapter adapter = new ParserAdapter(parser, new PatchAstProperties());

        ExternalParserException error = assertThrows(ExternalParserException.class,
                () -> adapter.parse("x = 1\n", "a.py"));
        assertFalse(error.isSourceRejected());
    }
}
