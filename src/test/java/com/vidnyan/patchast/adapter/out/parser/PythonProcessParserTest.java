package com.vidnyan.patchast.adapter.out.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.patchast.PatchAstProperties;
import com.vidnyan.patchast.application.port.out.ExternalParserException;
import com.vidnyan.patchast.domain.model.ConstantValue;
import com.vidnyan.patchast.domain.model.NodeKind;
import com.vidnyan.patchast.domain.model.PatchedTree;
import com.vidnyan.patchast.domain.model.SyntaxNode;
import com.vidnyan.patchast.domain.patch.RegionPatcher;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PythonProcessParserTest {

    private static final AtomicInteger STREAM_THREADS = new AtomicInteger();
    private static final ExecutorService STREAM_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        STREAM_THREADS.incrementAndGet();
        Thread thread = new Thread(runnable);
        thread.setDaemon(true);
        return thread;
    });

    @BeforeAll
    static void requirePython() {
        assumeTrue(pythonAvailable(), "python3 is not installed");
    }

    @AfterAll
    static void shutdownExecutor() {
        STREAM_EXECUTOR.shutdownNow();
    }

    @Test
    void parse_ShouldReturnTreeOfValidSource() {
        // Arrange
        PythonProcessParser parser = parser(new PatchAstProperties());

        // Act
        SyntaxNode root = parser.parse("x = 1\n", "x.py");

        // Assert
        SyntaxNode assign = root.nodes("body").get(0);
        assertEquals(NodeKind.ASSIGN, assign.kind());
        assertEquals(ConstantValue.of(ConstantValue.Kind.INT, "1"), assign.node("value").get("value"));
    }

    @Test
    void parse_ShouldMeasureColumnsInUtf16Units() {
        // Arrange: each emoji is two UTF-16 units
        PythonProcessParser parser = parser(new PatchAstProperties());
        String astral = "x = \"\uD83D\uDE00\uD83D\uDE00\uD83D\uDE00\"; y = 'a'\n";

        // Act
        SyntaxNode accented = parser.parse("s = '\u00E9' + t\n", "accents.py");
        SyntaxNode emoji = parser.parse(astral, "emoji.py");

        // Assert
        assertEquals(10, accented.nodes("body").get(0).node("value").node("right").column());
        SyntaxNode text = emoji.nodes("body").get(1).node("value");
        assertEquals(18, text.column());
        PatchedTree tree = RegionPatcher.patch(emoji, astral, false);
        assertEquals("'a'", tree.textOf(text));
    }

    @Test
    void parse_ShouldGiveTreeThatPatchesBareSequencePattern() {
        // Arrange
        PythonProcessParser parser = parser(new PatchAstProperties());
        String source = "match x:\n    case [a], b:\n        pass\n";

        // Act
        SyntaxNode root = parser.parse(source, "match.py");
        PatchedTree tree = RegionPatcher.patch(root, source, true);

        // Assert
        List<SyntaxNode> sequences = tree.findAll(NodeKind.MATCH_SEQUENCE);
        assertEquals(List.of("[a], b", "[a]"), sequences.stream().map(tree::textOf).toList());
        assertEquals(source, tree.renderFromChildren(root));
    }

    @Test
    void parse_ShouldRejectMalformedSource() {
        PythonProcessParser parser = parser(new PatchAstProperties());

        ExternalParserException error = assertThrows(ExternalParserException.class,
                () -> parser.parse("x = (\n", "broken.py"));

        assertTrue(error.isSourceRejected());
        assertTrue(error.getMessage().contains("never closed"), error.getMessage());
    }

    @Test
    void parse_ShouldFailWhenInterpreterIsMissing() {
        PatchAstProperties properties = new PatchAstProperties();
        properties.setPythonExecutable("no-such-python-interpreter");

        ExternalParserException error = assertThrows(ExternalParserException.class,
                () -> parser(properties).parse("x = 1\n", "x.py"));

        assertFalse(error.isSourceRejected());
    }

    @Test
    void parse_ShouldDrainOutputOnGivenExecutor() throws Exception {
        // Arrange
        PythonProcessParser parser = parser(new PatchAstProperties());
        ExecutorService callers = Executors.newFixedThreadPool(4);
        List<Future<SyntaxNode>> results = new ArrayList<>();

        // Act
        try {
            for (int i = 0; i < 8; i++) {
                String source = "value_" + i + " = " + i + "\n";
                results.add(callers.submit(() -> parser.parse(source, "doc.py")));
            }
            for (Future<SyntaxNode> result : results) {
                // Assert
                assertEquals(NodeKind.ASSIGN, result.get(60, TimeUnit.SECONDS).nodes("body").get(0).kind());
            }
        } finally {
            callers.shutdownNow();
        }
        assertTrue(STREAM_THREADS.get() > 0);
    }

    private static PythonProcessParser parser(PatchAstProperties properties) {
        return new PythonProcessParser(properties, new JsonAstReader(new ObjectMapper()), STREAM_EXECUTOR);
    }

    private static boolean pythonAvailable() {
        try {
            Process process = new ProcessBuilder("python3", "--version").start();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (Exception e) {
            return false;
        }
    }
}
