package io.github.tsast.analyzer;

import io.github.tsast.ast.GenericNode;
import io.github.tsast.ast.NodeType;
import org.jetbrains.annotations.Nullable;

/** Approximate, text-based facts about interfaces, type aliases and property signatures. */
public final class TypeNodes {

    private TypeNodes() {}

    public static String getInterfaceName(@Nullable GenericNode node) {
        if (node == null || node.getType() != NodeType.INTERFACE) {
            return "";
        }
        return declaredName(node, "interface ");
    }

    public static String getTypeAliasName(@Nullable GenericNode node) {
        if (node == null || node.getType() != NodeType.TYPE_ALIAS) {
            return "";
        }
        return declaredName(node, "type ");
    }

    public static boolean hasExtends(@Nullable GenericNode node) {
        if (node == null || node.getType() != NodeType.INTERFACE) {
            return false;
        }
        return node.getText().contains(" extends ");
    }

    public static boolean isReadonly(@Nullable GenericNode node) {
        return node != null && node.getText().contains("readonly ");
    }

    public static boolean isOptionalProperty(@Nullable GenericNode node) {
        return node != null && node.getText().contains("?:");
    }

    /** Property signatures among the direct children only; call it on an interface or object type body. */
    public static int countProperties(@Nullable GenericNode node) {
        if (node == null) {
            return 0;
        }
        int count = 0;
        for (var child : node.getChildren()) {
            if (child.getType() == NodeType.PROPERTY) {
                count++;
            }
        }
        return count;
    }

    /**
     * Whether an interface or type alias mentions both angle brackets anywhere in its text. This also answers true for
     * {@code type F = (a: number) => Promise<void>}.
     */
    public static boolean isGenericType(@Nullable GenericNode node) {
        if (node == null) {
            return false;
        }
        var type = node.getType();
        if (type != NodeType.INTERFACE && type != NodeType.TYPE_ALIAS) {
            return false;
        }
        var text = node.getText();
        return text.contains("<") && text.contains(">");
    }

    // interface and type alias names are type identifiers, so the text fallback is the usual path
    private static String declaredName(GenericNode node, String keyword) {
        var identifier = node.findFirstChild(NodeType.IDENTIFIER);
        if (identifier.isPresent()) {
            return identifier.get().getText();
        }

        var text = node.getText().strip();
        int start = text.indexOf(keyword);
        if (start < 0) {
            return "";
        }
        var rest = text.substring(start + keyword.length()).stripLeading();
        int end = 0;
        while (end < rest.length() && Character.isJavaIdentifierPart(rest.charAt(end))) {
            end++;
        }
        return rest.substring(0, end);
    }
}
