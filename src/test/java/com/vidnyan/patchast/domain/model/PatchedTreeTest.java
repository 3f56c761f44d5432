package com.vidnyan.patchast.domain.model;

import com.vidnyan.patchast.domain.patch.RegionPatcher;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.patchast.domain.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class PatchedTreeTest {

    @Test
    void regionOf_ShouldRejectUnpatchedNodes() {
        PatchedTree tree = RegionPatcher.patch(module(expr(name("a", 1, 0))), "a\n", false);

        assertThrows(IllegalArgumentException.class, () -> tree.regionOf(name("a", 1, 0)));
        assertTrue(tree.findRegion(name("a", 1, 0)).isEmpty());
    }

    @Test
    void sortedChildren_ShouldRequireCollectedChildren() {
        SyntaxNode root = module(expr(name("a", 1, 0)));
        PatchedTree tree = RegionPatcher.patch(root, "a\n", false);

        assertThrows(IllegalStateException.class, () -> tree.sortedChildren(root));
        assertThrows(IllegalStateException.class, () -> tree.renderFromChildren(root));
    }

    @Test
    void findAll_ShouldReturnNestedNodesDepthFirst() {
        // Arrange: f(g(x))
        SyntaxNode g = name("g", 1, 2);
        SyntaxNode inner = call(g, List.of(name("x", 1, 4)), List.of());
        SyntaxNode outer = call(name("f", 1, 0), List.of(inner), List.of());
        PatchedTree tree = RegionPatcher.patch(module(expr(outer)), "f(g(x))\n", true);

        // Act
        List<SyntaxNode> calls = tree.findAll(NodeKind.CALL);

        // Assert
        assertEquals(List.of(outer, inner), calls);
        assertEquals("g(x)", tree.textOf(inner));
        assertEquals(Fragment.of(g), tree.sortedChildren(inner).get(0));
        assertEquals(Fragment.of("("), tree.sortedChildren(inner).get(2));
    }

    @Test
    void region_ShouldRejectInvertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> new Region(3, 2));
        assertTrue(new Region(0, 5).contains(new Region(1, 5)));
        assertFalse(new Region(1, 5).contains(new Region(0, 2)));
    }

    @Test
    void operator_ShouldSplitTwoWordOperators() {
        assertEquals(List.of("is", "not"), Operator.fromTag("IsNot").tokens());
        assertEquals(List.of("**"), Operator.fromTag("Pow").tokens());
        assertThrows(IllegalArgumentException.class, () -> Operator.fromTag("Spaceship"));
    }

    @Test
    void nodeKind_ShouldMapUnknownTypeNames() {
        assertEquals(NodeKind.MATCH_CASE, NodeKind.fromTypeName("match_case"));
        assertEquals(NodeKind.UNKNOWN, NodeKind.fromTypeName("TypeAlias"));
        assertEquals("TypeAlias", SyntaxNode.builder("TypeAlias").build().typeName());
        assertTrue(NodeKind.TRY_STAR.isStatement());
        assertFalse(NodeKind.EXCEPT_HANDLER.isStatement());
    }
}
