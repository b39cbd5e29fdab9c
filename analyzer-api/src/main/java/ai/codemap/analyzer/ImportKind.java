package ai.codemap.analyzer;

/** Syntactic shape of an import-equivalent statement. */
public enum ImportKind {
    DIRECT,
    ALIASED,
    RELATIVE,
    WILDCARD,
    CONDITIONAL,
    DYNAMIC,
    SELECTIVE_MULTIPLE;

    /** Kinds whose records always carry at least one target. */
    public boolean requiresTargets() {
        return this == DIRECT || this == ALIASED || this == RELATIVE || this == SELECTIVE_MULTIPLE;
    }
}
