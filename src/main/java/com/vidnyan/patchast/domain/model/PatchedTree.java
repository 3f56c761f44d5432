package com.vidnyan.patchast.domain.model;

import com.vidnyan.patchast.domain.walker.AstWalker;
import com.vidnyan.patchast.domain.walker.KindVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A syntax tree together with the region of every patched node and, when
 * requested, every node's sorted children.
 */
public final class PatchedTree {

    private final SyntaxNode root;
    private final String source;
    private final Map<SyntaxNode, Region> regions;
    private final Map<SyntaxNode, List<Fragment>> children;
    private final List<Diagnostic> diagnostics;

    /**
     * @param regions identity map of node regions
     * @param children identity map of sorted children, or null when they were not collected
     */
    public PatchedTree(SyntaxNode root, String source, Map<SyntaxNode, Region> regions,
                       Map<SyntaxNode, List<Fragment>> children, List<Diagnostic> diagnostics) {
        this.root = root;
        this.source = source;
        this.regions = Collections.unmodifiableMap(regions);
        this.children = children == null ? null : Collections.unmodifiableMap(children);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public SyntaxNode root() {
        return root;
    }

    /**
     * The normalized source all regions refer to.
     */
    public String source() {
        return source;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public boolean hasChildren() {
        return children != null;
    }

    public boolean isPatched(SyntaxNode node) {
        return regions.containsKey(node);
    }

    public Optional<Region> findRegion(SyntaxNode node) {
        return Optional.ofNullable(regions.get(node));
    }

    public Region regionOf(SyntaxNode node) {
        Region region = regions.get(node);
        if (region == null) {
            throw new IllegalArgumentException("Node <" + node + "> has no region");
        }
        return region;
    }

    /**
     * Source text covered by the node's region.
     */
    public String textOf(SyntaxNode node) {
        return regionOf(node).text(source);
    }

    public List<Fragment> sortedChildren(SyntaxNode node) {
        requireChildren();
        List<Fragment> fragments = children.get(node);
        if (fragments == null) {
            throw new IllegalArgumentException("Node <" + node + "> has no sorted children");
        }
        return fragments;
    }

    /**
     * Rebuilds the source of a subtree by concatenating its fragments depth-first.
     */
    public String renderFromChildren(SyntaxNode node) {
        StringBuilder result = new StringBuilder();
        render(node, result);
        return result.toString();
    }

    private void render(SyntaxNode node, StringBuilder result) {
        for (Fragment fragment : sortedChildren(node)) {
            if (fragment instanceof Fragment.NodeFragment nested) {
                render(nested.node(), result);
            } else if (fragment instanceof Fragment.TextFragment text) {
                result.append(text.text());
            }
        }
    }

    /**
     * All nodes of the given kind in depth-first order.
     */
    public List<SyntaxNode> findAll(NodeKind kind) {
        List<SyntaxNode> found = new ArrayList<>();
        KindVisitor visitor = new KindVisitor();
        visitor.register(kind, node -> {
            found.add(node);
            AstWalker.childrenOf(node).forEach(child -> AstWalker.walk(child, visitor));
        });
        AstWalker.walk(root, visitor);
        return found;
    }

    private void requireChildren() {
        if (children == null) {
            throw new IllegalStateException("Tree was patched without sorted children");
        }
    }
}
