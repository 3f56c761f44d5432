package com.vidnyan.patchast.application.service;

import com.vidnyan.patchast.PatchAstProperties;
import com.vidnyan.patchast.application.port.in.PatchSourceUseCase;
import com.vidnyan.patchast.domain.model.PatchedTree;
import com.vidnyan.patchast.domain.model.SyntaxNode;
import com.vidnyan.patchast.domain.patch.RegionPatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Parses sources and runs one region patcher per document.
 * Holds no per-document state and may serve concurrent callers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatchingService implements PatchSourceUseCase {

    private final ParserAdapter parserAdapter;
    private final PatchAstProperties properties;

    @Override
    public PatchedTree patch(String source, boolean collectChildren) {
        return patch(source, properties.getDefaultFilename(), collectChildren);
    }

    @Override
    public PatchedTree patch(String source, String filename, boolean collectChildren) {
        ParserAdapter.ParsedSource parsed = parserAdapter.parse(source, filename);
        return patchNormalized(parsed.root(), parsed.source(), collectChildren);
    }

    @Override
    public PatchedTree patch(byte[] source, String filename, boolean collectChildren) {
        ParserAdapter.ParsedSource parsed = parserAdapter.parse(source, filename);
        return patchNormalized(parsed.root(), parsed.source(), collectChildren);
    }

    @Override
    public PatchedTree patchTree(SyntaxNode root, String source, boolean collectChildren) {
        return patchNormalized(root, ParserAdapter.normalize(source), collectChildren);
    }

    private PatchedTree patchNormalized(SyntaxNode root, String source, boolean collectChildren) {
        Instant startTime = Instant.now();
        PatchedTree tree = RegionPatcher.patch(root, source, collectChildren);
        log.debug("Patched {} characters in {}ms", source.length(),
                Duration.between(startTime, Instant.now()).toMillis());
        if (!tree.diagnostics().isEmpty()) {
            log.info("Patching finished with {} diagnostics", tree.diagnostics().size());
        }
        return tree;
    }
}
