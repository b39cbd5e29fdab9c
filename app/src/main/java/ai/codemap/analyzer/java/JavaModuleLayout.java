package ai.codemap.analyzer.java;

import ai.codemap.analyzer.syntax.ModuleLayout;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fully qualified type names. {@code a.b.C} lives in {@code a/b/C.java}; a nested type {@code a.b.C.D} in the file
 * of its outermost type, so shorter prefixes are tried too.
 */
final class JavaModuleLayout implements ModuleLayout {
    private static final Splitter DOT = Splitter.on('.').omitEmptyStrings();

    private static final List<String> PLATFORM_PREFIXES =
            List.of("java.", "javax.", "jdk.", "sun.", "com.sun.", "org.w3c.dom.", "org.xml.sax.");

    private final Set<String> extraStandardLibrary;

    JavaModuleLayout(Set<String> extraStandardLibrary) {
        this.extraStandardLibrary = Set.copyOf(extraStandardLibrary);
    }

    /** Java has no relative imports. */
    @Override
    public Optional<String> normalizeRelative(String fromFile, String writtenModule, int relativeDepth) {
        return Optional.of(writtenModule);
    }

    @Override
    public List<String> candidatePaths(String fromFile, String module, boolean rootAnchored) {
        var segments = DOT.splitToList(module);
        var candidates = new ArrayList<String>();
        for (int n = segments.size(); n >= 1; n--) {
            candidates.add(String.join("/", segments.subList(0, n)) + ".java");
        }
        return candidates;
    }

    @Override
    public boolean isStandardLibrary(String module) {
        for (var prefix : PLATFORM_PREFIXES) {
            if (module.startsWith(prefix)) {
                return true;
            }
        }
        return extraStandardLibrary.stream().anyMatch(p -> module.equals(p) || module.startsWith(p + "."));
    }
}
