package ai.codemap.analyzer.javascript;

import ai.codemap.analyzer.treesitter.CommonTreeSitterNodeTypes;

/** Constants for JavaScript TreeSitter node type names. */
public final class JavaScriptTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String CLASS_DECLARATION = CommonTreeSitterNodeTypes.CLASS_DECLARATION;
    public static final String METHOD_DEFINITION = CommonTreeSitterNodeTypes.METHOD_DEFINITION;
    public static final String DECORATOR = CommonTreeSitterNodeTypes.DECORATOR;
    public static final String IMPORT_STATEMENT = CommonTreeSitterNodeTypes.IMPORT_STATEMENT;
    public static final String IF_STATEMENT = CommonTreeSitterNodeTypes.IF_STATEMENT;
    public static final String TRY_STATEMENT = CommonTreeSitterNodeTypes.TRY_STATEMENT;
    public static final String STRING = CommonTreeSitterNodeTypes.STRING;
    public static final String IDENTIFIER = CommonTreeSitterNodeTypes.IDENTIFIER;
    public static final String COMMENT = CommonTreeSitterNodeTypes.COMMENT;

    // ===== JAVASCRIPT-SPECIFIC TYPES =====
    // Class-like declarations
    public static final String CLASS = "class";
    public static final String CLASS_HERITAGE = "class_heritage";

    // Function-like declarations
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String GENERATOR_FUNCTION_DECLARATION = "generator_function_declaration";
    public static final String ARROW_FUNCTION = "arrow_function";
    public static final String FUNCTION_EXPRESSION = "function_expression";
    public static final String GENERATOR_FUNCTION = "generator_function";
    public static final String YIELD_EXPRESSION = "yield_expression";

    // Statements
    public static final String EXPORT_STATEMENT = "export_statement";
    public static final String SWITCH_STATEMENT = "switch_statement";
    public static final String TERNARY_EXPRESSION = "ternary_expression";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";
    public static final String AWAIT_EXPRESSION = "await_expression";

    // Imports and exports
    public static final String IMPORT_CLAUSE = "import_clause";
    public static final String NAMESPACE_IMPORT = "namespace_import";
    public static final String NAMED_IMPORTS = "named_imports";
    public static final String IMPORT_SPECIFIER = "import_specifier";
    public static final String EXPORT_CLAUSE = "export_clause";
    public static final String EXPORT_SPECIFIER = "export_specifier";
    public static final String NAMESPACE_EXPORT = "namespace_export";
    public static final String IMPORT = "import";

    // Expressions
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String TEMPLATE_STRING = "template_string";
    public static final String TEMPLATE_SUBSTITUTION = "template_substitution";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String OBJECT_PATTERN = "object_pattern";
    public static final String SHORTHAND_PROPERTY_IDENTIFIER_PATTERN = "shorthand_property_identifier_pattern";
    public static final String PAIR_PATTERN = "pair_pattern";

    // Fields
    public static final String FIELD_SOURCE = "source";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_ALIAS = "alias";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_ARGUMENTS = "arguments";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_KEY = "key";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_OPERATOR = "operator";

    private JavaScriptTreeSitterNodeTypes() {}
}
