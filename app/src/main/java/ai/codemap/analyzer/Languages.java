package ai.codemap.analyzer;

import ai.codemap.analyzer.java.JavaGrammarAdapter;
import ai.codemap.analyzer.javascript.JavaScriptGrammarAdapter;
import ai.codemap.analyzer.python.PythonGrammarAdapter;
import ai.codemap.analyzer.syntax.GrammarAdapter;
import ai.codemap.config.CodeMapConfig;
import ai.codemap.util.ProjectPaths;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Registry of the grammar adapters available to a run, looked up by language id or file extension. */
public final class Languages {
    private static final Logger log = LogManager.getLogger(Languages.class);

    private final Map<String, GrammarAdapter> byId;
    private final Map<String, GrammarAdapter> byExtension;

    private Languages(Map<String, GrammarAdapter> byId, Map<String, GrammarAdapter> byExtension) {
        this.byId = Collections.unmodifiableMap(byId);
        this.byExtension = Collections.unmodifiableMap(byExtension);
    }

    /** Python, JavaScript and Java, configured from {@code config}. */
    public static Languages defaults(CodeMapConfig config) {
        return builder()
                .register(new PythonGrammarAdapter(config))
                .register(new JavaScriptGrammarAdapter(config))
                .register(new JavaGrammarAdapter(config))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<GrammarAdapter> byId(String languageId) {
        return Optional.ofNullable(byId.get(languageId));
    }

    public Optional<GrammarAdapter> forFile(String filePath) {
        return Optional.ofNullable(byExtension.get(ProjectPaths.extension(filePath)));
    }

    public Collection<GrammarAdapter> all() {
        return byId.values();
    }

    public static final class Builder {
        private final Map<String, GrammarAdapter> byId = new LinkedHashMap<>();
        private final Map<String, GrammarAdapter> byExtension = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Adds an adapter after validating its marker decorator table.
         *
         * @throws IllegalArgumentException if a marker name carries both roles, or the language id or one of the
         *     extensions is already taken
         */
        public Builder register(GrammarAdapter adapter) {
            Objects.requireNonNull(adapter, "adapter");
            var id = adapter.languageId();
            adapter.syntaxProfile().markers().checkDisjoint(id);
            if (byId.containsKey(id)) {
                throw new IllegalArgumentException("Language already registered: " + id);
            }
            for (var ext : adapter.fileExtensions()) {
                var key = ext.toLowerCase(Locale.ROOT);
                var existing = byExtension.get(key);
                if (existing != null) {
                    throw new IllegalArgumentException(String.format(
                            Locale.ROOT, "Extension .%s claimed by both %s and %s", key, existing.languageId(), id));
                }
            }
            byId.put(id, adapter);
            for (var ext : adapter.fileExtensions()) {
                byExtension.put(ext.toLowerCase(Locale.ROOT), adapter);
            }
            log.debug("Registered {} for extensions {}", id, adapter.fileExtensions());
            return this;
        }

        public Languages build() {
            return new Languages(new LinkedHashMap<>(byId), new LinkedHashMap<>(byExtension));
        }
    }
}
