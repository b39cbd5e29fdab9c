package ai.codemap.analyzer.treesitter;

/** Tree-sitter node type names shared by more than one of the bundled grammars. */
public final class CommonTreeSitterNodeTypes {

    // ===== CLASS-LIKE DECLARATIONS =====
    /** Class declaration (Java, JavaScript) */
    public static final String CLASS_DECLARATION = "class_declaration";

    // ===== FUNCTION-LIKE DECLARATIONS =====
    /** Method definition inside a JavaScript class body or object literal */
    public static final String METHOD_DEFINITION = "method_definition";

    // ===== DECORATORS =====
    /** Decorator (Python, JavaScript) */
    public static final String DECORATOR = "decorator";

    // ===== IMPORTS =====
    /** ES module import (JavaScript) and plain import (Python) */
    public static final String IMPORT_STATEMENT = "import_statement";

    // ===== CONTROL FLOW =====
    public static final String IF_STATEMENT = "if_statement";
    public static final String TRY_STATEMENT = "try_statement";

    // ===== LITERALS =====
    public static final String STRING = "string";
    public static final String IDENTIFIER = "identifier";

    // ===== MISC =====
    public static final String COMMENT = "comment";
    public static final String ERROR = "ERROR";

    private CommonTreeSitterNodeTypes() {}
}
