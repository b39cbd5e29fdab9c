package ai.codemap.analyzer;

/** Orthogonal flags attached to a {@link SymbolRecord}. Any combination may occur. */
public enum SymbolModifier {
    ASYNC,
    GENERATOR,
    DECORATED,
    STATIC,
    CLASS_BOUND
}
