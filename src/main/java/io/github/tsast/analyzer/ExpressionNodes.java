package io.github.tsast.analyzer;

import io.github.tsast.ast.GenericNode;
import io.github.tsast.ast.NodeType;
import org.jetbrains.annotations.Nullable;

/** Accessors for identifier and literal nodes. */
public final class ExpressionNodes {

    private ExpressionNodes() {}

    public static String getIdentifierName(@Nullable GenericNode node) {
        if (node == null || node.getType() != NodeType.IDENTIFIER) {
            return "";
        }
        return node.getText();
    }

    /** The literal exactly as written, quotes included. */
    public static String getLiteralValue(@Nullable GenericNode node) {
        if (node == null || node.getType() != NodeType.LITERAL) {
            return "";
        }
        return node.getText();
    }
}
