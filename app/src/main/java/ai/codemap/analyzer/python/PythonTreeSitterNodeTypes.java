package ai.codemap.analyzer.python;

import ai.codemap.analyzer.treesitter.CommonTreeSitterNodeTypes;

/** Constants for Python TreeSitter node type names. */
public final class PythonTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    public static final String DECORATOR = CommonTreeSitterNodeTypes.DECORATOR;
    public static final String IMPORT_STATEMENT = CommonTreeSitterNodeTypes.IMPORT_STATEMENT;
    public static final String IF_STATEMENT = CommonTreeSitterNodeTypes.IF_STATEMENT;
    public static final String TRY_STATEMENT = CommonTreeSitterNodeTypes.TRY_STATEMENT;
    public static final String STRING = CommonTreeSitterNodeTypes.STRING;
    public static final String IDENTIFIER = CommonTreeSitterNodeTypes.IDENTIFIER;
    public static final String COMMENT = CommonTreeSitterNodeTypes.COMMENT;

    // ===== PYTHON-SPECIFIC TYPES =====
    // Declarations
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String LAMBDA = "lambda";
    public static final String DECORATED_DEFINITION = "decorated_definition";

    // Body
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String YIELD = "yield";

    // Imports
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String RELATIVE_IMPORT = "relative_import";
    public static final String IMPORT_PREFIX = "import_prefix";
    public static final String WILDCARD_IMPORT = "wildcard_import";

    // Expressions
    public static final String CALL = "call";
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String KEYWORD_ARGUMENT = "keyword_argument";
    public static final String CONCATENATED_STRING = "concatenated_string";
    public static final String BINARY_OPERATOR = "binary_operator";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String INTERPOLATION = "interpolation";
    public static final String CONDITIONAL_EXPRESSION = "conditional_expression";

    // Fields
    public static final String FIELD_NAME = "name";
    public static final String FIELD_ALIAS = "alias";
    public static final String FIELD_MODULE_NAME = "module_name";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_ARGUMENTS = "arguments";
    public static final String FIELD_SUPERCLASSES = "superclasses";

    private PythonTreeSitterNodeTypes() {}
}
