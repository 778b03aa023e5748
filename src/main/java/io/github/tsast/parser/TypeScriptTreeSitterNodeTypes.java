package io.github.tsast.parser;

/** TreeSitter node type names of the TypeScript grammar that the classifier cares about. */
public final class TypeScriptTreeSitterNodeTypes {

    // ===== FUNCTION-LIKE =====
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String ARROW_FUNCTION = "arrow_function";
    public static final String METHOD_DEFINITION = "method_definition";

    // ===== TYPE DECLARATIONS =====
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String TYPE_ALIAS_DECLARATION = "type_alias_declaration";
    public static final String PROPERTY_SIGNATURE = "property_signature";

    // ===== PARAMETERS =====
    /** The parenthesised list; it is tagged like its members and filtered out when counting. */
    public static final String FORMAL_PARAMETERS = "formal_parameters";
    public static final String REQUIRED_PARAMETER = "required_parameter";
    public static final String OPTIONAL_PARAMETER = "optional_parameter";

    // ===== NAMES AND LITERALS =====
    public static final String IDENTIFIER = "identifier";
    public static final String STRING = "string";
    public static final String NUMBER = "number";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String NULL = "null";
    public static final String UNDEFINED = "undefined";

    // ===== EXPRESSIONS =====
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String UNARY_EXPRESSION = "unary_expression";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String MEMBER_EXPRESSION = "member_expression";
    public static final String ASSIGNMENT_EXPRESSION = "assignment_expression";
    public static final String TERNARY_EXPRESSION = "ternary_expression";
    public static final String NEW_EXPRESSION = "new_expression";
    public static final String AWAIT_EXPRESSION = "await_expression";

    private TypeScriptTreeSitterNodeTypes() {}
}
