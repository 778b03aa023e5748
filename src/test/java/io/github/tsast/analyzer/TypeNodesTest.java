package io.github.tsast.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import io.github.tsast.ast.GenericNode;
import io.github.tsast.ast.NodeType;
import io.github.tsast.parser.TypeScriptParser;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class TypeNodesTest {
    private static TypeScriptParser parser;
    private static Analyzer types;

    @BeforeAll
    static void setup() throws Exception {
        parser = new TypeScriptParser();
        types = new Analyzer(parser.parseFile(Path.of("src/test/resources/testcode-ts/types.ts")));
    }

    @AfterAll
    static void teardown() {
        parser.close();
    }

    private static GenericNode interfaceNamed(String name) {
        return types.findInterfaces().stream()
                .filter(node -> TypeNodes.getInterfaceName(node).equals(name))
                .findFirst()
                .orElseThrow();
    }

    private static GenericNode aliasNamed(String name) {
        return types.findTypeAliases().stream()
                .filter(node -> TypeNodes.getTypeAliasName(node).equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testInterfaceNames() {
        var names = types.findInterfaces().stream().map(TypeNodes::getInterfaceName).toList();

        assertEquals(List.of("Person", "User", "Config", "Calculator", "Employee", "Container", "PublicAPI"), names);
    }

    @Test
    void testTypeAliasNames() {
        var names = types.findTypeAliases().stream().map(TypeNodes::getTypeAliasName).toList();

        assertEquals(
                List.of(
                        "ID",
                        "Point",
                        "BinaryOp",
                        "Status",
                        "Named",
                        "Aged",
                        "NamedAndAged",
                        "Result",
                        "Callback",
                        "EventName",
                        "EventHandler"),
                names);
    }

    @Test
    void testExtends() {
        assertTrue(TypeNodes.hasExtends(interfaceNamed("Employee")));
        assertFalse(TypeNodes.hasExtends(interfaceNamed("Person")));
        assertFalse(TypeNodes.hasExtends(interfaceNamed("Container")));
        assertFalse(TypeNodes.hasExtends(null));
    }

    @Test
    void testGenericTypes() {
        assertTrue(TypeNodes.isGenericType(interfaceNamed("Container")));
        assertFalse(TypeNodes.isGenericType(interfaceNamed("Person")));
        assertTrue(TypeNodes.isGenericType(aliasNamed("Result")));
        assertTrue(TypeNodes.isGenericType(aliasNamed("Callback")));
        assertFalse(TypeNodes.isGenericType(aliasNamed("ID")));
        // "=>" alone does not make a type generic
        assertFalse(TypeNodes.isGenericType(aliasNamed("BinaryOp")));
        assertFalse(TypeNodes.isGenericType(types.getRoot()));
    }

    @Test
    void testPropertyModifiers() {
        var config = new Analyzer(interfaceNamed("Config")).findNodesByType(NodeType.PROPERTY);
        assertEquals(3, config.size());
        assertEquals(2, config.stream().filter(TypeNodes::isReadonly).count());

        var user = new Analyzer(interfaceNamed("User")).findNodesByType(NodeType.PROPERTY);
        assertEquals(4, user.size());
        assertEquals(
                List.of(false, false, true, true),
                user.stream().map(TypeNodes::isOptionalProperty).toList());
    }

    @Test
    void testCountPropertiesCountsDirectChildren() {
        var config = interfaceNamed("Config");
        var properties = new Analyzer(config).findNodesByType(NodeType.PROPERTY);

        assertEquals(3, TypeNodes.countProperties(properties.get(0).getParent()));
        // properties sit in the body, not directly under the declaration
        assertEquals(0, TypeNodes.countProperties(config));
        assertEquals(0, TypeNodes.countProperties(null));
    }

    @Test
    void testMethodSignaturesAreNotProperties() {
        var calculator = new Analyzer(interfaceNamed("Calculator"));

        assertEquals(0, calculator.countNodesByType(NodeType.PROPERTY));
    }

    @Test
    void testNamesRequireMatchingType() throws Exception {
        var root = parser.parse("let x = 1;");

        assertEquals("", TypeNodes.getInterfaceName(root));
        assertEquals("", TypeNodes.getTypeAliasName(root));
        assertEquals("", TypeNodes.getInterfaceName(null));
    }
}
