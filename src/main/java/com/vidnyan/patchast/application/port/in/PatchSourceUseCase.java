package com.vidnyan.patchast.application.port.in;

import com.vidnyan.patchast.domain.model.PatchedTree;
import com.vidnyan.patchast.domain.model.SyntaxNode;

/**
 * Primary use case: align a Python syntax tree with the exact source text of
 * every node.
 */
public interface PatchSourceUseCase {

    /**
     * Parse and patch source text under the configured default filename.
     * @throws SourceSyntaxException if the parser rejects the source
     */
    PatchedTree patch(String source, boolean collectChildren);

    /**
     * Parse and patch source text.
     * @param filename used in parse errors only
     * @param collectChildren also record every node's sorted children
     * @throws SourceSyntaxException if the parser rejects the source
     */
    PatchedTree patch(String source, String filename, boolean collectChildren);

    /**
     * Parse and patch UTF-8 encoded source.
     */
    PatchedTree patch(byte[] source, String filename, boolean collectChildren);

    /**
     * Patch a tree the caller already parsed from {@code source}.
     */
    PatchedTree patchTree(SyntaxNode root, String source, boolean collectChildren);
}
