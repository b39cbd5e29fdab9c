package ai.codemap.analyzer.javascript;

import ai.codemap.analyzer.syntax.ModuleLayout;
import ai.codemap.util.ProjectPaths;
import ai.codemap.util.ResourceLists;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Path-style specifiers. Relative ones resolve against the importing file's directory, trying the extensions Node
 * would try; bare specifiers name packages outside the project and have no candidates.
 */
final class JavaScriptModuleLayout implements ModuleLayout {
    static final String STDLIB_RESOURCE = "stdlib/javascript.txt";
    static final String NODE_PREFIX = "node:";

    private static final List<String> EXTENSIONS = List.of(".js", ".mjs", ".cjs", ".jsx");
    private static final List<String> INDEX_FILES = List.of("index.js", "index.mjs");

    private final Set<String> builtins;

    JavaScriptModuleLayout(Set<String> extraStandardLibrary) {
        var modules = new HashSet<>(ResourceLists.load(STDLIB_RESOURCE));
        modules.addAll(extraStandardLibrary);
        this.builtins = Set.copyOf(modules);
    }

    @Override
    public Optional<String> normalizeRelative(String fromFile, String writtenModule, int relativeDepth) {
        return ProjectPaths.normalize(ProjectPaths.directorySegments(fromFile), writtenModule);
    }

    @Override
    public List<String> candidatePaths(String fromFile, String module, boolean rootAnchored) {
        if (!rootAnchored) {
            return List.of();
        }
        var candidates = new LinkedHashSet<String>();
        if (!module.isEmpty()) {
            candidates.add(module);
            for (var ext : EXTENSIONS) {
                candidates.add(module + ext);
            }
        }
        for (var index : INDEX_FILES) {
            candidates.add(ProjectPaths.join(module, index));
        }
        return List.copyOf(candidates);
    }

    @Override
    public boolean isStandardLibrary(String module) {
        if (module.startsWith(NODE_PREFIX)) {
            return true;
        }
        int slash = module.indexOf('/');
        return builtins.contains(slash < 0 ? module : module.substring(0, slash));
    }
}
