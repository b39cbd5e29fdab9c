package ai.codemap.analyzer.syntax;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Table of decorator names that reclassify a method: class-bound markers (the {@code classmethod} family) and static
 * markers (the {@code staticmethod} family). Names are compared after {@link #normalize(String)}.
 */
public record MarkerDecorators(Set<String> classMethodMarkers, Set<String> staticMethodMarkers) {

    public static final MarkerDecorators NONE = new MarkerDecorators(Set.of(), Set.of());

    public enum Role {
        CLASS_METHOD,
        STATIC_METHOD
    }

    public MarkerDecorators {
        classMethodMarkers = Set.copyOf(classMethodMarkers);
        staticMethodMarkers = Set.copyOf(staticMethodMarkers);
    }

    /**
     * Rejects a table in which one name carries both roles.
     *
     * @throws IllegalArgumentException naming the conflicting markers
     */
    public void checkDisjoint(String languageId) {
        var overlap = new TreeSet<>(classMethodMarkers);
        overlap.retainAll(staticMethodMarkers);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException(String.format(
                    Locale.ROOT,
                    "Marker decorators for %s are configured as both class-method and static-method markers: %s",
                    languageId,
                    overlap));
        }
    }

    public Optional<Role> roleOf(String decoratorText) {
        var name = normalize(decoratorText);
        if (classMethodMarkers.contains(name)) {
            return Optional.of(Role.CLASS_METHOD);
        }
        if (staticMethodMarkers.contains(name)) {
            return Optional.of(Role.STATIC_METHOD);
        }
        return Optional.empty();
    }

    /** {@code "@ functools.wraps(f)"} becomes {@code "functools.wraps"}. */
    public static String normalize(String decoratorText) {
        var name = decoratorText.strip();
        if (name.startsWith("@")) {
            name = name.substring(1);
        }
        int paren = name.indexOf('(');
        if (paren >= 0) {
            name = name.substring(0, paren);
        }
        var sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
