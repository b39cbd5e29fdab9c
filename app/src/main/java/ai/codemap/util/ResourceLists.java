package ai.codemap.util;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Set;

/** Loads newline-separated word lists bundled on the classpath. Blank lines and {@code #} comments are skipped. */
public final class ResourceLists {
    private static final Splitter LINES = Splitter.on('\n').trimResults().omitEmptyStrings();

    private ResourceLists() {}

    public static Set<String> load(String path) {
        try (InputStream in = ResourceLists.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) throw new IOException("Resource not found: " + path);
            var result = new LinkedHashSet<String>();
            for (var line : LINES.split(new String(in.readAllBytes(), StandardCharsets.UTF_8))) {
                if (!line.startsWith("#")) {
                    result.add(line);
                }
            }
            return Set.copyOf(result);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
