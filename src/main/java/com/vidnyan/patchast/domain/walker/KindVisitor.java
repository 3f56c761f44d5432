package com.vidnyan.patchast.domain.walker;

import com.vidnyan.patchast.domain.model.NodeKind;
import com.vidnyan.patchast.domain.model.SyntaxNode;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Dispatch table from node kind to handler, used by {@link AstWalker#walk}.
 */
public class KindVisitor {

    private final Map<NodeKind, Consumer<SyntaxNode>> handlers = new EnumMap<>(NodeKind.class);

    public KindVisitor register(NodeKind kind, Consumer<SyntaxNode> handler) {
        handlers.put(kind, handler);
        return this;
    }

    public Optional<Consumer<SyntaxNode>> handlerFor(NodeKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }
}
