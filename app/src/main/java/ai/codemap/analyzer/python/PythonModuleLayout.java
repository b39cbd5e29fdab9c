package ai.codemap.analyzer.python;

import ai.codemap.analyzer.syntax.ModuleLayout;
import ai.codemap.util.ProjectPaths;
import ai.codemap.util.ResourceLists;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Dotted module paths over a directory tree: {@code a.b} is {@code a/b.py} or the package {@code a/b/__init__.py}.
 * Absolute imports are looked up next to the importing file first, then from the project root.
 */
final class PythonModuleLayout implements ModuleLayout {
    static final String STDLIB_RESOURCE = "stdlib/python.txt";

    private static final Splitter DOT = Splitter.on('.').omitEmptyStrings();
    private static final Joiner DOT_JOINER = Joiner.on('.');

    private final Set<String> standardLibrary;

    PythonModuleLayout(Set<String> extraStandardLibrary) {
        var modules = new HashSet<>(ResourceLists.load(STDLIB_RESOURCE));
        modules.addAll(extraStandardLibrary);
        this.standardLibrary = Set.copyOf(modules);
    }

    /**
     * One leading dot is the importing file's package; each further dot climbs one package. {@code from . import x}
     * in a top-level file keeps the written form, as there is no package name to give it.
     */
    @Override
    public Optional<String> normalizeRelative(String fromFile, String writtenModule, int relativeDepth) {
        var packages = ProjectPaths.directorySegments(fromFile);
        int up = relativeDepth - 1;
        if (up > packages.size()) {
            return Optional.empty();
        }
        var parts = new ArrayList<>(packages.subList(0, packages.size() - up));
        parts.addAll(DOT.splitToList(writtenModule.substring(Math.min(relativeDepth, writtenModule.length()))));
        if (parts.isEmpty()) {
            return Optional.of(writtenModule);
        }
        return Optional.of(DOT_JOINER.join(parts));
    }

    @Override
    public List<String> candidatePaths(String fromFile, String module, boolean rootAnchored) {
        if (module.isEmpty() || module.startsWith(".")) {
            return List.of();
        }
        var rel = String.join("/", DOT.splitToList(module));
        var candidates = new LinkedHashSet<String>();
        if (!rootAnchored) {
            var dir = ProjectPaths.directoryOf(fromFile);
            candidates.add(ProjectPaths.join(dir, rel) + ".py");
            candidates.add(ProjectPaths.join(dir, rel) + "/__init__.py");
        }
        candidates.add(rel + ".py");
        candidates.add(rel + "/__init__.py");
        candidates.add(rel + ".pyi");
        return List.copyOf(candidates);
    }

    @Override
    public boolean isStandardLibrary(String module) {
        if (module.startsWith(".")) {
            return false;
        }
        int dot = module.indexOf('.');
        return standardLibrary.contains(dot < 0 ? module : module.substring(0, dot));
    }
}
