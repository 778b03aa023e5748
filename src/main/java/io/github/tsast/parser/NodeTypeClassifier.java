package io.github.tsast.parser;

import static io.github.tsast.parser.TypeScriptTreeSitterNodeTypes.*;

import io.github.tsast.ast.NodeType;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Maps raw tree-sitter node types onto the {@link NodeType} taxonomy. The mapping is a fixed table followed by a set of
 * expression node types; everything else is {@link NodeType#UNKNOWN}.
 */
public final class NodeTypeClassifier {

    private static final Map<String, NodeType> DIRECT_MAPPINGS = Map.ofEntries(
            Map.entry(FUNCTION_DECLARATION, NodeType.FUNCTION),
            Map.entry(ARROW_FUNCTION, NodeType.ARROW_FUNCTION),
            Map.entry(METHOD_DEFINITION, NodeType.METHOD),
            Map.entry(INTERFACE_DECLARATION, NodeType.INTERFACE),
            Map.entry(TYPE_ALIAS_DECLARATION, NodeType.TYPE_ALIAS),
            Map.entry(IDENTIFIER, NodeType.IDENTIFIER),
            Map.entry(PROPERTY_SIGNATURE, NodeType.PROPERTY),
            Map.entry(FORMAL_PARAMETERS, NodeType.PARAMETER),
            Map.entry(REQUIRED_PARAMETER, NodeType.PARAMETER),
            Map.entry(OPTIONAL_PARAMETER, NodeType.PARAMETER),
            Map.entry(STRING, NodeType.LITERAL),
            Map.entry(NUMBER, NodeType.LITERAL),
            Map.entry(TRUE, NodeType.LITERAL),
            Map.entry(FALSE, NodeType.LITERAL),
            Map.entry(NULL, NodeType.LITERAL),
            Map.entry(UNDEFINED, NodeType.LITERAL));

    private static final Set<String> EXPRESSION_TYPES = Set.of(
            BINARY_EXPRESSION,
            UNARY_EXPRESSION,
            CALL_EXPRESSION,
            MEMBER_EXPRESSION,
            ASSIGNMENT_EXPRESSION,
            TERNARY_EXPRESSION,
            NEW_EXPRESSION,
            AWAIT_EXPRESSION);

    private NodeTypeClassifier() {}

    /** Never fails; unmapped and null types are {@link NodeType#UNKNOWN}. */
    public static NodeType classify(@Nullable String treeSitterType) {
        if (treeSitterType == null) {
            return NodeType.UNKNOWN;
        }
        var direct = DIRECT_MAPPINGS.get(treeSitterType);
        if (direct != null) {
            return direct;
        }
        return isExpressionType(treeSitterType) ? NodeType.EXPRESSION : NodeType.UNKNOWN;
    }

    public static boolean isExpressionType(@Nullable String treeSitterType) {
        return treeSitterType != null && EXPRESSION_TYPES.contains(treeSitterType);
    }
}
