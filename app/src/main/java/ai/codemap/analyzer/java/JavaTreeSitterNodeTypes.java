package ai.codemap.analyzer.java;

import ai.codemap.analyzer.treesitter.CommonTreeSitterNodeTypes;

/** Constants for Java TreeSitter node type names. */
public final class JavaTreeSitterNodeTypes {

    // ===== COMMON TYPES (imported from CommonTreeSitterNodeTypes) =====
    // Class-like declarations
    public static final String CLASS_DECLARATION = CommonTreeSitterNodeTypes.CLASS_DECLARATION;

    // ===== JAVA-SPECIFIC TYPES =====
    // Class-like declarations
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String ENUM_DECLARATION = "enum_declaration";
    public static final String RECORD_DECLARATION = "record_declaration";
    public static final String ANNOTATION_TYPE_DECLARATION = "annotation_type_declaration";

    // Method-like declarations
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String CONSTRUCTOR_DECLARATION = "constructor_declaration";
    public static final String COMPACT_CONSTRUCTOR_DECLARATION = "compact_constructor_declaration";
    public static final String LAMBDA_EXPRESSION = "lambda_expression";

    // Modifiers
    public static final String MODIFIERS = "modifiers";
    public static final String MARKER_ANNOTATION = "marker_annotation";
    public static final String ANNOTATION = "annotation";
    public static final String STATIC = "static";

    // Supertypes
    public static final String SUPERCLASS = "superclass";
    public static final String SUPER_INTERFACES = "super_interfaces";
    public static final String EXTENDS_INTERFACES = "extends_interfaces";
    public static final String TYPE_LIST = "type_list";

    // Imports
    public static final String IMPORT_DECLARATION = "import_declaration";
    public static final String SCOPED_IDENTIFIER = "scoped_identifier";
    public static final String IDENTIFIER = CommonTreeSitterNodeTypes.IDENTIFIER;
    public static final String ASTERISK = "asterisk";

    // Comments
    public static final String BLOCK_COMMENT = "block_comment";
    public static final String LINE_COMMENT = "line_comment";

    private JavaTreeSitterNodeTypes() {}
}
