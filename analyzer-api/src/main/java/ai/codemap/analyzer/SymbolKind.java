package ai.codemap.analyzer;

/** Normalized declaration kinds, independent of the source language. */
public enum SymbolKind {
    FUNCTION,
    METHOD,
    CLASS_METHOD,
    STATIC_METHOD,
    LAMBDA,
    CLASS,
    CONSTRUCTOR;

    /** Kinds that must be enclosed by a {@link #CLASS} record. */
    public boolean isClassMember() {
        return this == METHOD || this == CLASS_METHOD || this == STATIC_METHOD || this == CONSTRUCTOR;
    }

    public boolean isFunctionLike() {
        return this != CLASS;
    }
}
