package com.vidnyan.patchast.adapter.in.cli;

import com.vidnyan.patchast.PatchAstProperties;
import com.vidnyan.patchast.application.port.in.PatchSourceUseCase;
import com.vidnyan.patchast.domain.model.Diagnostic;
import com.vidnyan.patchast.domain.model.PatchedTree;
import com.vidnyan.patchast.domain.model.Region;
import com.vidnyan.patchast.domain.model.SyntaxNode;
import com.vidnyan.patchast.domain.walker.AstWalker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI Runner for patching a single Python file.
 * Runs when patchast.source.path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatchCliRunner implements CommandLineRunner {

    private static final int SNIPPET_LENGTH = 60;

    private final PatchSourceUseCase patchSourceUseCase;
    private final PatchAstProperties properties;
    private final ConfigurableApplicationContext context;

    @Value("${patchast.source.path:}")
    private String sourcePath;

    @Override
    public void run(String... args) throws Exception {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set patchast.source.path property.");
            return;
        }

        try {
            Path path = Path.of(sourcePath);
            log.info("Patching: {}", path);
            PatchedTree tree = patchSourceUseCase.patch(Files.readAllBytes(path), path.getFileName().toString(),
                    properties.isCollectChildren());
            printOutline(tree);
            if (tree.hasChildren()) {
                boolean exact = tree.renderFromChildren(tree.root()).equals(tree.source());
                log.info("Round trip from sorted children: {}", exact ? "exact" : "MISMATCH");
            }
            for (Diagnostic diagnostic : tree.diagnostics()) {
                log.warn("{} [{}] {}", diagnostic.kind(), diagnostic.nodeType(), diagnostic.message());
            }
            log.info("Patching complete!");
        } finally {
            SpringApplication.exit(context, () -> 0);
        }
    }

    private void printOutline(PatchedTree tree) {
        log.info("───────────────────────────────────────────────────────────────");
        for (SyntaxNode statement : AstWalker.childrenOf(tree.root())) {
            Region region = tree.regionOf(statement);
            log.info(" {} {} line {}: {}", statement.typeName(), region, statement.line(),
                    snippet(tree.textOf(statement)));
        }
        log.info("───────────────────────────────────────────────────────────────");
    }

    private String snippet(String text) {
        int newline = text.indexOf('\n');
        String firstLine = newline < 0 ? text : text.substring(0, newline) + " ...";
        if (firstLine.length() <= SNIPPET_LENGTH) {
            return firstLine;
        }
        return firstLine.substring(0, SNIPPET_LENGTH - 3) + "...";
    }
}
