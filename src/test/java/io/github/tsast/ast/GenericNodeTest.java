package io.github.tsast.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

public class GenericNodeTest {

    private static Range range(int start, int end) {
        return new Range(new Position(0, start, start), new Position(0, end, end));
    }

    @Test
    void testChildrenAdoptParent() {
        var name = new GenericNode(NodeType.IDENTIFIER, "test", range(9, 13));
        var params = new GenericNode(NodeType.PARAMETER, "()", range(13, 15));
        var function = new GenericNode(NodeType.FUNCTION, "function test() {}", range(0, 18), List.of(name, params));

        assertSame(function, name.getParent());
        assertSame(function, params.getParent());
        assertNull(function.getParent());
        assertTrue(function.isRoot());
        assertFalse(name.isRoot());
        assertEquals(List.of(name, params), function.getChildren());
        assertEquals(2, function.getChildCount());
        assertSame(params, function.getChild(1));
    }

    @Test
    void testChildrenAreUnmodifiable() {
        var leaf = new GenericNode(NodeType.LITERAL, "42", range(0, 2));
        var parent = new GenericNode(NodeType.UNKNOWN, "42", range(0, 2), List.of(leaf));

        assertThrows(UnsupportedOperationException.class, () -> parent.getChildren().clear());
        assertThrows(UnsupportedOperationException.class, () -> leaf.getChildren().add(parent));
    }

    @Test
    void testNodeCannotBelongToTwoParents() {
        var shared = new GenericNode(NodeType.IDENTIFIER, "x", range(0, 1));
        new GenericNode(NodeType.UNKNOWN, "x", range(0, 1), List.of(shared));

        assertThrows(
                IllegalArgumentException.class,
                () -> new GenericNode(NodeType.UNKNOWN, "x", range(0, 1), List.of(shared)));
    }

    @Test
    void testFindFirstChild() {
        var keyword = new GenericNode(NodeType.UNKNOWN, "class", range(0, 5));
        var first = new GenericNode(NodeType.IDENTIFIER, "A", range(6, 7));
        var second = new GenericNode(NodeType.IDENTIFIER, "B", range(8, 9));
        var node = new GenericNode(NodeType.UNKNOWN, "class A B", range(0, 9), List.of(keyword, first, second));

        assertSame(first, node.findFirstChild(NodeType.IDENTIFIER).orElseThrow());
        assertTrue(node.findFirstChild(NodeType.PROPERTY).isEmpty());
    }

    @Test
    void testRangeRejectsEndBeforeStart() {
        assertThrows(IllegalArgumentException.class, () -> range(5, 4));
        assertThrows(IllegalArgumentException.class, () -> new Position(-1, 0, 0));
    }

    @Test
    void testRangeContainment() {
        var outer = range(0, 10);

        assertTrue(outer.contains(range(0, 10)));
        assertTrue(outer.contains(range(3, 7)));
        assertTrue(outer.contains(range(10, 10)));
        assertFalse(outer.contains(range(5, 11)));
        assertEquals(4, range(3, 7).length());
    }
}
