package io.github.tsast.analyzer;

import io.github.tsast.ast.GenericNode;
import io.github.tsast.ast.NodeType;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Text-based facts about function, arrow-function and method nodes. All methods accept null and answer false, zero or
 * the empty string for it.
 */
public final class FunctionNodes {

    /** How far above an arrow function to look for the name it is bound to. */
    static final int MAX_ARROW_NAME_DEPTH = 10;

    /** Ancestors checked for an {@code export} prefix: declarator, declaration, export statement. */
    static final int MAX_EXPORT_ANCESTOR_LEVELS = 3;

    private static final List<String> METHOD_MODIFIERS = List.of(
            "public ", "private ", "protected ", "static ", "override ", "readonly ", "abstract ", "async ", "get ",
            "set ");

    private FunctionNodes() {}

    public static boolean isAsync(@Nullable GenericNode node) {
        if (node == null || !node.getType().isFunctionLike()) {
            return false;
        }
        return node.getText().contains("async ");
    }

    /**
     * True when the node's own text, or that of one of its nearest three ancestors, starts with {@code export }. Three
     * levels reach the export statement around {@code export const name = () => {}}; exports further up, and separate
     * {@code export { name }} clauses, are not seen.
     */
    public static boolean isExported(@Nullable GenericNode node) {
        if (node == null) {
            return false;
        }
        if (startsWithExport(node)) {
            return true;
        }
        var current = node.getParent();
        for (int level = 0; level < MAX_EXPORT_ANCESTOR_LEVELS && current != null; level++) {
            if (startsWithExport(current)) {
                return true;
            }
            current = current.getParent();
        }
        return false;
    }

    public static boolean isGenerator(@Nullable GenericNode node) {
        if (node == null || node.getType() != NodeType.FUNCTION) {
            return false;
        }
        return node.getText().contains("function*");
    }

    /**
     * The declared name of a function or method, or for an arrow function the name it is bound to. Empty when none can
     * be recovered.
     */
    public static String getFunctionName(@Nullable GenericNode node) {
        if (node == null) {
            return "";
        }
        return switch (node.getType()) {
            case FUNCTION -> identifierChildText(node);
            case METHOD -> {
                var name = identifierChildText(node);
                yield name.isEmpty() ? methodNameFromText(node.getText()) : name;
            }
            case ARROW_FUNCTION -> arrowFunctionName(node);
            default -> "";
        };
    }

    public static boolean hasParameters(@Nullable GenericNode node) {
        return node != null && node.findFirstChild(NodeType.PARAMETER).isPresent();
    }

    /**
     * Counts parameter nodes anywhere below {@code node}. The parenthesised list carries the same tag as its members and
     * is told apart by its leading {@code (}.
     */
    public static int countParameters(@Nullable GenericNode node) {
        if (node == null) {
            return 0;
        }
        int[] count = {0};
        ASTTraversalUtils.visit(node, n -> {
            if (n.getType() == NodeType.PARAMETER) {
                var text = n.getText().strip();
                if (!text.isEmpty() && !text.startsWith("(")) {
                    count[0]++;
                }
            }
            return true;
        });
        return count[0];
    }

    /**
     * Arrow functions carry no name of their own. Walk up from the arrow function and, at each ancestor, take the first
     * identifier child whose text appears in the ancestor's text before the arrow function's text.
     *
     * <p>For {@code const obj = { method: () => 42 }} this yields {@code obj}: property keys are not identifiers.
     */
    private static String arrowFunctionName(GenericNode arrowFunction) {
        var arrowText = arrowFunction.getText();
        var current = arrowFunction.getParent();
        for (int depth = 0; depth < MAX_ARROW_NAME_DEPTH && current != null; depth++) {
            var ancestorText = current.getText();
            int arrowPos = ancestorText.indexOf(arrowText);
            for (var child : current.getChildren()) {
                if (child.getType() != NodeType.IDENTIFIER) {
                    continue;
                }
                int identifierPos = ancestorText.indexOf(child.getText());
                if (identifierPos != -1 && arrowPos != -1 && identifierPos < arrowPos) {
                    return child.getText();
                }
            }
            current = current.getParent();
        }
        return "";
    }

    /** {@code [modifiers] [*]name(...)}: method names are property identifiers, so read them off the text. */
    static String methodNameFromText(String methodText) {
        var text = methodText.strip();
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (var modifier : METHOD_MODIFIERS) {
                if (text.startsWith(modifier)) {
                    text = text.substring(modifier.length()).strip();
                    stripped = true;
                }
            }
        }
        if (text.startsWith("*")) {
            text = text.substring(1).strip();
        }

        int end = text.length();
        for (char delimiter : new char[] {'(', '<'}) {
            int index = text.indexOf(delimiter);
            if (index >= 0 && index < end) {
                end = index;
            }
        }
        return text.substring(0, end).strip();
    }

    private static String identifierChildText(GenericNode node) {
        return node.findFirstChild(NodeType.IDENTIFIER).map(GenericNode::getText).orElse("");
    }

    private static boolean startsWithExport(GenericNode node) {
        return node.getText().strip().startsWith("export ");
    }
}
