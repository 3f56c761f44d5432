package com.vidnyan.patchast.domain.model;

/**
 * One entry of a node's sorted children: a nested node or a piece of literal text.
 */
public sealed interface Fragment permits Fragment.NodeFragment, Fragment.TextFragment {

    record NodeFragment(SyntaxNode node) implements Fragment {
    }

    /**
     * Token, whitespace or comment text copied verbatim from the source.
     */
    record TextFragment(String text) implements Fragment {
    }

    static Fragment of(SyntaxNode node) {
        return new NodeFragment(node);
    }

    static Fragment of(String text) {
        return new TextFragment(text);
    }
}
