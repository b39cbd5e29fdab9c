package ai.codemap.analyzer;

import ai.codemap.util.ProjectPaths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** One input of an analysis run: a project-relative path and the file's text. */
public record SourceFile(String path, String text) {

    public SourceFile {
        path = ProjectPaths.canonical(Objects.requireNonNull(path, "path"));
        Objects.requireNonNull(text, "text");
    }

    /** Reads {@code root/relPath} as UTF-8. */
    public static SourceFile read(Path root, Path relPath) throws IOException {
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("relPath must be relative: " + relPath);
        }
        var text = Files.readString(root.resolve(relPath), StandardCharsets.UTF_8);
        return new SourceFile(relPath.toString().replace('\\', '/'), text);
    }

    public String extension() {
        return ProjectPaths.extension(path);
    }
}
