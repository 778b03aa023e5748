package io.github.tsast.analyzer;

import io.github.tsast.ast.GenericNode;
import io.github.tsast.ast.NodeType;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/** Queries over one parsed tree. Holds no state beyond the root, so it is as shareable as the tree itself. */
public class Analyzer {
    private final @Nullable GenericNode root;

    public Analyzer(@Nullable GenericNode root) {
        this.root = root;
    }

    public @Nullable GenericNode getRoot() {
        return root;
    }

    /**
     * Visits every node depth-first in pre-order. Returning false from {@code visitor} skips that node's subtree
     * only.
     */
    public void visit(Predicate<GenericNode> visitor) {
        ASTTraversalUtils.visit(root, visitor);
    }

    public List<GenericNode> findNodes(Predicate<GenericNode> predicate) {
        return ASTTraversalUtils.findAllNodesRecursive(root, predicate);
    }

    public int countNodes(Predicate<GenericNode> predicate) {
        int[] count = {0};
        visit(node -> {
            if (predicate.test(node)) {
                count[0]++;
            }
            return true;
        });
        return count[0];
    }

    public List<GenericNode> findNodesByType(NodeType nodeType) {
        return ASTTraversalUtils.findAllNodesByType(root, nodeType);
    }

    public int countNodesByType(NodeType nodeType) {
        return countNodes(node -> node.getType() == nodeType);
    }

    /** Function declarations and arrow functions, in source order. */
    public List<GenericNode> findFunctions() {
        return findNodes(node -> node.getType() == NodeType.FUNCTION || node.getType() == NodeType.ARROW_FUNCTION);
    }

    public List<GenericNode> findMethods() {
        return findNodesByType(NodeType.METHOD);
    }

    public List<GenericNode> findInterfaces() {
        return findNodesByType(NodeType.INTERFACE);
    }

    public List<GenericNode> findTypeAliases() {
        return findNodesByType(NodeType.TYPE_ALIAS);
    }

    public List<GenericNode> findExpressions() {
        return findNodesByType(NodeType.EXPRESSION);
    }

    public List<GenericNode> findIdentifiers() {
        return findNodesByType(NodeType.IDENTIFIER);
    }

    public List<GenericNode> findLiterals() {
        return findNodesByType(NodeType.LITERAL);
    }
}
