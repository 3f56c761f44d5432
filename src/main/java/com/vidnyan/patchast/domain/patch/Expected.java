package com.vidnyan.patchast.domain.patch;

import com.vidnyan.patchast.domain.model.SyntaxNode;

/**
 * One element of a node's expected spelling.
 */
sealed interface Expected permits Expected.Child, Expected.Token, Expected.Ambiguous {

    record Child(SyntaxNode node) implements Expected {
    }

    record Token(String text) implements Expected {
    }

    record Ambiguous(Sentinel sentinel) implements Expected {
    }
}
