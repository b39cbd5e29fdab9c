package ai.codemap.analyzer.syntax;

import java.util.List;
import java.util.Optional;

/** How a language maps module references onto project files. Paths are project-relative and use {@code /}. */
public interface ModuleLayout {

    /**
     * Rewrites a relative module reference against the importing file's location.
     *
     * @return the normalized module, or empty if the reference climbs above the project root
     */
    Optional<String> normalizeRelative(String fromFile, String writtenModule, int relativeDepth);

    /**
     * Candidate file paths for a module, most specific first.
     *
     * @param rootAnchored true if {@code module} was already normalized against the project root
     */
    List<String> candidatePaths(String fromFile, String module, boolean rootAnchored);

    boolean isStandardLibrary(String module);
}
