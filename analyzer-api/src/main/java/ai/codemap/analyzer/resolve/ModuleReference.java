package ai.codemap.analyzer.resolve;

import java.util.List;
import java.util.Objects;

/**
 * A module to look up on behalf of an importing file.
 *
 * @param languageId language of the importing file
 * @param module normalized module path
 * @param rootAnchored true if the module was normalized against the project root (a relative import)
 * @param candidatePaths project-relative file paths that could hold the module, most specific first
 */
public record ModuleReference(String languageId, String module, boolean rootAnchored, List<String> candidatePaths) {

    public ModuleReference {
        Objects.requireNonNull(languageId, "languageId");
        Objects.requireNonNull(module, "module");
        candidatePaths = List.copyOf(candidatePaths);
    }
}
