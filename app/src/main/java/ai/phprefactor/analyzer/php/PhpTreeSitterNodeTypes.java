package ai.phprefactor.analyzer.php;

/** Constants for PHP TreeSitter node type names. */
public final class PhpTreeSitterNodeTypes {

    public static final String PROGRAM = "program";
    public static final String ERROR = "ERROR";

    // Namespaces and imports
    public static final String NAMESPACE_DEFINITION = "namespace_definition";
    public static final String NAMESPACE_NAME = "namespace_name";
    public static final String NAMESPACE_USE_DECLARATION = "namespace_use_declaration";
    public static final String NAMESPACE_USE_CLAUSE = "namespace_use_clause";
    public static final String NAMESPACE_USE_GROUP = "namespace_use_group";
    public static final String NAMESPACE_USE_GROUP_CLAUSE = "namespace_use_group_clause";
    public static final String NAMESPACE_ALIASING_CLAUSE = "namespace_aliasing_clause";

    // Class-like declarations
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String TRAIT_DECLARATION = "trait_declaration";
    public static final String ENUM_DECLARATION = "enum_declaration";
    public static final String BASE_CLAUSE = "base_clause";
    public static final String CLASS_INTERFACE_CLAUSE = "class_interface_clause";

    // Function-like declarations
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String ANONYMOUS_FUNCTION = "anonymous_function";
    public static final String ANONYMOUS_FUNCTION_CREATION_EXPRESSION = "anonymous_function_creation_expression";
    public static final String ARROW_FUNCTION = "arrow_function";
    public static final String FORMAL_PARAMETERS = "formal_parameters";
    public static final String SIMPLE_PARAMETER = "simple_parameter";
    public static final String VARIADIC_PARAMETER = "variadic_parameter";
    public static final String PROPERTY_PROMOTION_PARAMETER = "property_promotion_parameter";

    // Field-like declarations
    public static final String PROPERTY_DECLARATION = "property_declaration";
    public static final String PROPERTY_ELEMENT = "property_element";

    // Statements
    public static final String COMPOUND_STATEMENT = "compound_statement";

    // Expressions
    public static final String OBJECT_CREATION_EXPRESSION = "object_creation_expression";
    public static final String MEMBER_CALL_EXPRESSION = "member_call_expression";
    public static final String NULLSAFE_MEMBER_CALL_EXPRESSION = "nullsafe_member_call_expression";
    public static final String MEMBER_ACCESS_EXPRESSION = "member_access_expression";
    public static final String NULLSAFE_MEMBER_ACCESS_EXPRESSION = "nullsafe_member_access_expression";
    public static final String SCOPED_CALL_EXPRESSION = "scoped_call_expression";
    public static final String CLASS_CONSTANT_ACCESS_EXPRESSION = "class_constant_access_expression";
    public static final String SCOPED_PROPERTY_ACCESS_EXPRESSION = "scoped_property_access_expression";
    public static final String ASSIGNMENT_EXPRESSION = "assignment_expression";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String VARIABLE_NAME = "variable_name";
    public static final String ARGUMENTS = "arguments";

    // Names and types
    public static final String NAME = "name";
    public static final String QUALIFIED_NAME = "qualified_name";
    public static final String RELATIVE_SCOPE = "relative_scope";
    public static final String PRIMITIVE_TYPE = "primitive_type";

    private PhpTreeSitterNodeTypes() {}
}
