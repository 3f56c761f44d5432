package com.vidnyan.patchast.domain.walker;

import com.vidnyan.patchast.domain.model.NodeKind;
import com.vidnyan.patchast.domain.model.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Kind-agnostic traversal of syntax trees.
 */
public final class AstWalker {

    private AstWalker() {
    }

    /**
     * Directly nested nodes in field declaration order, list-valued fields expanded.
     * A module yields its statements.
     */
    public static List<SyntaxNode> childrenOf(SyntaxNode node) {
        if (node.is(NodeKind.MODULE)) {
            return node.nodes("body").stream().filter(child -> child != null).toList();
        }
        List<SyntaxNode> result = new ArrayList<>();
        for (Object value : node.fields().values()) {
            if (value instanceof SyntaxNode child) {
                result.add(child);
            } else if (value instanceof List<?> list) {
                for (Object entry : list) {
                    if (entry instanceof SyntaxNode child) {
                        result.add(child);
                    }
                }
            }
        }
        return result;
    }

    /**
     * Calls the visitor's handler for the node's kind, or walks the children
     * when none is registered.
     */
    public static void walk(SyntaxNode node, KindVisitor visitor) {
        Optional<Consumer<SyntaxNode>> handler = visitor.handlerFor(node.kind());
        if (handler.isPresent()) {
            handler.get().accept(node);
            return;
        }
        for (SyntaxNode child : childrenOf(node)) {
            walk(child, visitor);
        }
    }

    /**
     * Calls {@code callback} on the node; with {@code recursive} set, descends
     * into children only while the callback returns false.
     */
    public static void visitWithEarlyExit(SyntaxNode node, Predicate<SyntaxNode> callback, boolean recursive) {
        boolean handled = callback.test(node);
        if (recursive && !handled) {
            for (SyntaxNode child : childrenOf(node)) {
                visitWithEarlyExit(child, callback, true);
            }
        }
    }
}
