package com.vidnyan.patchast.domain.patch;

import com.vidnyan.patchast.domain.model.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered expected elements of one node plus how to treat its boundaries.
 * Null nodes and tokens are skipped, so optional fields can be added unchecked.
 */
final class Spelling {

    private final List<Expected> elements = new ArrayList<>();
    private boolean eatParens;
    private boolean eatSpaces;
    private boolean insideString;

    Spelling node(SyntaxNode node) {
        if (node != null) {
            elements.add(new Expected.Child(node));
        }
        return this;
    }

    Spelling nodes(List<SyntaxNode> nodes) {
        nodes.forEach(this::node);
        return this;
    }

    Spelling token(String text) {
        if (text != null) {
            elements.add(new Expected.Token(text));
        }
        return this;
    }

    Spelling tokens(List<String> texts) {
        texts.forEach(this::token);
        return this;
    }

    Spelling tokens(String... texts) {
        return tokens(List.of(texts));
    }

    Spelling sentinel(Sentinel sentinel) {
        elements.add(new Expected.Ambiguous(sentinel));
        return this;
    }

    /**
     * A node, or an identifier token for fields that older trees store as text.
     */
    Spelling item(Object value) {
        if (value instanceof SyntaxNode node) {
            return node(node);
        }
        return token(value == null ? null : value.toString());
    }

    /**
     * Items separated by {@code separator}.
     */
    Spelling joined(List<?> items, String separator) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                token(separator);
            }
            item(items.get(i));
        }
        return this;
    }

    /** Absorb one pair of parentheses around the node when present. */
    Spelling eatParens() {
        this.eatParens = true;
        return this;
    }

    /** Extend the region over the whole buffer; used for roots. */
    Spelling eatSpaces() {
        this.eatSpaces = true;
        return this;
    }

    /**
     * Tokens lie inside a formatted string: {@code #} is ordinary text there and
     * doubled braces are escapes, not replacement fields.
     */
    Spelling insideString() {
        this.insideString = true;
        return this;
    }

    List<Expected> elements() {
        return elements;
    }

    boolean isEatParens() {
        return eatParens;
    }

    boolean isEatSpaces() {
        return eatSpaces;
    }

    boolean isInsideString() {
        return insideString;
    }
}
