package ai.codemap.analyzer;

public enum DiagnosticKind {
    /** The whole file could not be parsed; the file map is empty. */
    UNPARSEABLE_FILE,
    /** A declaration was malformed and skipped. */
    DECLARATION_ANOMALY,
    /** A parser error region outside any declaration header. */
    SYNTAX_ERROR,
    /** An import statement that could not be read or normalized. */
    IMPORT_ANOMALY
}
