package ai.codemap.util;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Helpers for project-relative, {@code /}-separated paths. */
public final class ProjectPaths {
    private static final Splitter SLASH = Splitter.on('/').omitEmptyStrings();
    private static final Joiner SLASH_JOINER = Joiner.on('/');

    private ProjectPaths() {}

    /**
     * Validates and canonicalizes a project-relative path: backslashes become {@code /}, leading {@code ./} is
     * dropped.
     *
     * @throws IllegalArgumentException for absolute paths or paths that leave the project
     */
    public static String canonical(String path) {
        var p = path.replace('\\', '/');
        if (p.startsWith("/") || (p.length() > 1 && p.charAt(1) == ':')) {
            throw new IllegalArgumentException("path must be relative to the project root: " + path);
        }
        return normalize(List.of(), p)
                .orElseThrow(() -> new IllegalArgumentException("path leaves the project root: " + path));
    }

    /** Directory segments of a file path, e.g. {@code [a, b]} for {@code a/b/c.py}. */
    public static List<String> directorySegments(String filePath) {
        var segments = new ArrayList<>(SLASH.splitToList(filePath));
        if (!segments.isEmpty()) {
            segments.remove(segments.size() - 1);
        }
        return segments;
    }

    public static String directoryOf(String filePath) {
        return SLASH_JOINER.join(directorySegments(filePath));
    }

    /**
     * Joins {@code relative} onto {@code baseSegments}, resolving {@code .} and {@code ..}.
     *
     * @return empty if {@code ..} climbs above the first base segment
     */
    public static Optional<String> normalize(List<String> baseSegments, String relative) {
        var out = new ArrayList<>(baseSegments);
        for (var seg : SLASH.split(relative)) {
            if (seg.equals(".")) {
                continue;
            }
            if (seg.equals("..")) {
                if (out.isEmpty()) {
                    return Optional.empty();
                }
                out.remove(out.size() - 1);
            } else {
                out.add(seg);
            }
        }
        return Optional.of(SLASH_JOINER.join(out));
    }

    public static String join(String dir, String rest) {
        if (dir.isEmpty()) {
            return rest;
        }
        if (rest.isEmpty()) {
            return dir;
        }
        return dir + "/" + rest;
    }

    /** Extension without the dot, lower-cased; empty if the file name has none. */
    public static String extension(String filePath) {
        int slash = filePath.lastIndexOf('/');
        int dot = filePath.lastIndexOf('.');
        if (dot <= slash + 1) {
            return "";
        }
        return filePath.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
