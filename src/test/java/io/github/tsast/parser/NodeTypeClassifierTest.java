package io.github.tsast.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.github.tsast.ast.NodeType;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class NodeTypeClassifierTest {

    @Test
    void testDirectMappings() {
        var expected = Map.ofEntries(
                Map.entry("function_declaration", NodeType.FUNCTION),
                Map.entry("arrow_function", NodeType.ARROW_FUNCTION),
                Map.entry("method_definition", NodeType.METHOD),
                Map.entry("interface_declaration", NodeType.INTERFACE),
                Map.entry("type_alias_declaration", NodeType.TYPE_ALIAS),
                Map.entry("identifier", NodeType.IDENTIFIER),
                Map.entry("property_signature", NodeType.PROPERTY),
                Map.entry("formal_parameters", NodeType.PARAMETER),
                Map.entry("required_parameter", NodeType.PARAMETER),
                Map.entry("optional_parameter", NodeType.PARAMETER),
                Map.entry("string", NodeType.LITERAL),
                Map.entry("number", NodeType.LITERAL),
                Map.entry("true", NodeType.LITERAL),
                Map.entry("false", NodeType.LITERAL),
                Map.entry("null", NodeType.LITERAL),
                Map.entry("undefined", NodeType.LITERAL));

        expected.forEach((raw, type) -> assertEquals(type, NodeTypeClassifier.classify(raw), raw));
    }

    @Test
    void testExpressionTypes() {
        for (var raw : new String[] {
            "binary_expression",
            "unary_expression",
            "call_expression",
            "member_expression",
            "assignment_expression",
            "ternary_expression",
            "new_expression",
            "await_expression"
        }) {
            assertEquals(NodeType.EXPRESSION, NodeTypeClassifier.classify(raw), raw);
            assertTrue(NodeTypeClassifier.isExpressionType(raw), raw);
        }
        // not every *_expression is in the expression set
        assertEquals(NodeType.UNKNOWN, NodeTypeClassifier.classify("parenthesized_expression"));
        assertFalse(NodeTypeClassifier.isExpressionType("identifier"));
    }

    @Test
    void testUnmappedTypesAreUnknown() {
        assertEquals(NodeType.UNKNOWN, NodeTypeClassifier.classify("class_declaration"));
        assertEquals(NodeType.UNKNOWN, NodeTypeClassifier.classify("type_identifier"));
        assertEquals(NodeType.UNKNOWN, NodeTypeClassifier.classify("ERROR"));
        assertEquals(NodeType.UNKNOWN, NodeTypeClassifier.classify(""));
        assertEquals(NodeType.UNKNOWN, NodeTypeClassifier.classify(null));
        assertFalse(NodeTypeClassifier.isExpressionType(null));
    }

    @Test
    void testClassificationIsStable() {
        for (var raw : new String[] {"arrow_function", "call_expression", "program", "Identifier"}) {
            var first = NodeTypeClassifier.classify(raw);
            for (int i = 0; i < 5; i++) {
                assertEquals(first, NodeTypeClassifier.classify(raw), raw);
            }
        }
        // lookups are case-sensitive
        assertEquals(NodeType.UNKNOWN, NodeTypeClassifier.classify("Identifier"));
    }
}
