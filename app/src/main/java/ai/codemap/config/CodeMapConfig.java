package ai.codemap.config;

import ai.codemap.analyzer.syntax.MarkerDecorators;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Engine settings. Defaults ship as {@value #DEFAULTS_RESOURCE} on the classpath; a user file may override any subset
 * of the top-level keys. Unknown keys are ignored.
 *
 * @param analysisThreads worker threads for per-file analysis; 0 means one per available processor
 * @param maxFileBytes files larger than this are reported as unparseable
 * @param foldLiteralDynamicImports treat dynamic imports of literal-foldable strings as static imports
 * @param classMethodMarkers decorator names that make a method class-bound
 * @param staticMethodMarkers decorator names that make a method static
 * @param extraStandardLibraryModules additional standard-library module roots, keyed by language id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeMapConfig(
        int analysisThreads,
        long maxFileBytes,
        boolean foldLiteralDynamicImports,
        List<String> classMethodMarkers,
        List<String> staticMethodMarkers,
        Map<String, List<String>> extraStandardLibraryModules) {
    private static final Logger log = LogManager.getLogger(CodeMapConfig.class);

    public static final String DEFAULTS_RESOURCE = "codemap-defaults.json";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public CodeMapConfig {
        if (analysisThreads < 0) {
            throw new IllegalArgumentException("analysisThreads must be >= 0, was " + analysisThreads);
        }
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes must be > 0, was " + maxFileBytes);
        }
        classMethodMarkers = classMethodMarkers == null ? List.of() : List.copyOf(classMethodMarkers);
        staticMethodMarkers = staticMethodMarkers == null ? List.of() : List.copyOf(staticMethodMarkers);
        extraStandardLibraryModules =
                extraStandardLibraryModules == null ? Map.of() : Map.copyOf(extraStandardLibraryModules);
        new MarkerDecorators(Set.copyOf(classMethodMarkers), Set.copyOf(staticMethodMarkers))
                .checkDisjoint("configuration");
    }

    /** The bundled defaults. */
    public static CodeMapConfig defaults() {
        try {
            return objectMapper.treeToValue(loadDefaultsTree(), CodeMapConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Defaults overridden by the JSON file at {@code overrides}.
     *
     * @throws IOException if the file cannot be read or is not a JSON object
     * @throws IllegalArgumentException if the merged settings are invalid
     */
    public static CodeMapConfig load(Path overrides) throws IOException {
        log.debug("Loading configuration overrides from {}", overrides);
        return fromJson(Files.readString(overrides));
    }

    /** Defaults overridden by the given JSON object text. */
    public static CodeMapConfig fromJson(String json) throws IOException {
        var tree = objectMapper.readTree(json);
        if (!(tree instanceof ObjectNode userNode)) {
            throw new IOException("configuration must be a JSON object");
        }
        var merged = loadDefaultsTree();
        merged.setAll(userNode);
        try {
            return objectMapper.treeToValue(merged, CodeMapConfig.class);
        } catch (IOException e) {
            var cause = rootCause(e);
            if (cause instanceof IllegalArgumentException iae) {
                throw iae;
            }
            throw e;
        }
    }

    private static ObjectNode loadDefaultsTree() throws IOException {
        try (InputStream in = CodeMapConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new IOException("Resource not found: " + DEFAULTS_RESOURCE);
            var tree = objectMapper.readTree(in);
            if (!(tree instanceof ObjectNode objectNode)) {
                throw new IOException(DEFAULTS_RESOURCE + " must be a JSON object");
            }
            return objectNode;
        }
    }

    private static Throwable rootCause(Throwable t) {
        var current = t;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    @JsonIgnore
    public MarkerDecorators markerDecorators() {
        return new MarkerDecorators(Set.copyOf(classMethodMarkers), Set.copyOf(staticMethodMarkers));
    }

    public Set<String> extraStandardLibraryModules(String languageId) {
        var extra = extraStandardLibraryModules.get(languageId);
        return extra == null ? Set.of() : Set.copyOf(extra);
    }

    public CodeMapConfig withAnalysisThreads(int threads) {
        return new CodeMapConfig(
                threads,
                maxFileBytes,
                foldLiteralDynamicImports,
                classMethodMarkers,
                staticMethodMarkers,
                extraStandardLibraryModules);
    }

    public CodeMapConfig withMarkers(List<String> classMethod, List<String> staticMethod) {
        return new CodeMapConfig(
                analysisThreads, maxFileBytes, foldLiteralDynamicImports, classMethod, staticMethod,
                extraStandardLibraryModules);
    }

    public CodeMapConfig withFoldLiteralDynamicImports(boolean fold) {
        return new CodeMapConfig(
                analysisThreads, maxFileBytes, fold, classMethodMarkers, staticMethodMarkers,
                extraStandardLibraryModules);
    }

    public CodeMapConfig withMaxFileBytes(long bytes) {
        return new CodeMapConfig(
                analysisThreads, bytes, foldLiteralDynamicImports, classMethodMarkers, staticMethodMarkers,
                extraStandardLibraryModules);
    }

    @Override
    public String toString() {
        return "CodeMapConfig[threads=" + analysisThreads + ", maxFileBytes=" + maxFileBytes + ", fold="
                + foldLiteralDynamicImports + "]";
    }
}
