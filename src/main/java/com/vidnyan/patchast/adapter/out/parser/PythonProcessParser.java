package com.vidnyan.patchast.adapter.out.parser;

import com.vidnyan.patchast.PatchAstProperties;
import com.vidnyan.patchast.application.port.out.ExternalParserException;
import com.vidnyan.patchast.application.port.out.PythonParser;
import com.vidnyan.patchast.domain.model.SyntaxNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Python-interpreter-based implementation of PythonParser.
 * Runs the bundled dump script with the source on stdin and reads the JSON
 * tree from stdout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PythonProcessParser implements PythonParser {

    private final PatchAstProperties properties;
    private final JsonAstReader jsonAstReader;
    private final ExecutorService parserStreamExecutor;

    private volatile String script;

    @Override
    public SyntaxNode parse(String source, String filename) {
        long startTime = System.currentTimeMillis();
        List<String> command = List.of(properties.getPythonExecutable(), "-c", script(), filename);

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw ExternalParserException.failed(
                    "Cannot start Python interpreter " + properties.getPythonExecutable(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()),
                parserStreamExecutor);
        CompletableFuture<String> errors = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()),
                parserStreamExecutor);
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(source.getBytes(StandardCharsets.UTF_8));
            }
            long timeoutMs = properties.getParseTimeout().toMillis();
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Parsing {} timed out after {}ms, killing interpreter", filename, timeoutMs);
                process.destroyForcibly();
                throw ExternalParserException.failed("Python parser timed out after " + timeoutMs + "ms");
            }
            String json = output.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (json.isBlank()) {
                throw ExternalParserException.failed("Python parser exited with " + process.exitValue()
                        + ": " + errors.get(timeoutMs, TimeUnit.MILLISECONDS).strip());
            }
            SyntaxNode root = jsonAstReader.readEnvelope(json);
            log.debug("Parsed {} ({} characters) in {}ms", filename, source.length(),
                    System.currentTimeMillis() - startTime);
            return root;
        } catch (IOException e) {
            process.destroyForcibly();
            throw ExternalParserException.failed("Cannot send source to Python parser", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw ExternalParserException.failed("Interrupted while parsing " + filename, e);
        } catch (ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            throw ExternalParserException.failed("Cannot read Python parser output", e);
        }
    }

    private String script() {
        String loaded = script;
        if (loaded == null) {
            try (InputStream in = new ClassPathResource(properties.getDumpScript()).getInputStream()) {
                loaded = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw ExternalParserException.failed("Cannot load " + properties.getDumpScript(), e);
            }
            script = loaded;
        }
        return loaded;
    }

    private static String readFully(InputStream in) {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
