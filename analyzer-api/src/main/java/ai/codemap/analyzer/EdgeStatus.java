package ai.codemap.analyzer;

/** How a dependency edge's target was determined. */
public enum EdgeStatus {
    /** The import was linked to a file of the analyzed project. */
    RESOLVED,
    /** The module belongs to the language's standard library. */
    STANDARD_LIBRARY,
    /** The module reference is well-formed but no matching file exists. */
    NOT_FOUND,
    /** The import target is computed at runtime. */
    UNRESOLVED,
    /** The module resolver reported an error. */
    RESOLUTION_FAILED;

    public boolean pointsToUnknown() {
        return this != RESOLVED;
    }
}
