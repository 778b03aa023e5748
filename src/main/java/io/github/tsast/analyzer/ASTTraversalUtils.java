package io.github.tsast.analyzer;

import io.github.tsast.ast.GenericNode;
import io.github.tsast.ast.NodeType;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/** Recursive search helpers over {@link GenericNode} trees. */
public final class ASTTraversalUtils {

    private ASTTraversalUtils() {}

    /**
     * Depth-first, pre-order walk. When {@code visitor} returns false the children of that node are skipped; siblings
     * and the rest of the tree are still visited. A null root visits nothing.
     */
    public static void visit(@Nullable GenericNode node, Predicate<GenericNode> visitor) {
        if (node == null) {
            return;
        }
        if (!visitor.test(node)) {
            return;
        }
        for (var child : node.getChildren()) {
            visit(child, visitor);
        }
    }

    /** Recursively finds the first node matching the given predicate, in pre-order. */
    public static @Nullable GenericNode findNodeRecursive(
            @Nullable GenericNode rootNode, Predicate<GenericNode> predicate) {
        if (rootNode == null) {
            return null;
        }

        if (predicate.test(rootNode)) {
            return rootNode;
        }

        for (var child : rootNode.getChildren()) {
            var result = findNodeRecursive(child, predicate);
            if (result != null) {
                return result;
            }
        }

        return null;
    }

    /** Recursively finds all nodes matching the given predicate; the predicate never prunes the walk. */
    public static List<GenericNode> findAllNodesRecursive(
            @Nullable GenericNode rootNode, Predicate<GenericNode> predicate) {
        var results = new ArrayList<GenericNode>();
        visit(rootNode, node -> {
            if (predicate.test(node)) {
                results.add(node);
            }
            return true;
        });
        return results;
    }

    public static List<GenericNode> findAllNodesByType(@Nullable GenericNode rootNode, NodeType nodeType) {
        return findAllNodesRecursive(rootNode, node -> node.getType() == nodeType);
    }
}
