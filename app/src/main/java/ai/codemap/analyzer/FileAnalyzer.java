package ai.codemap.analyzer;

import ai.codemap.analyzer.syntax.GrammarAdapter;
import ai.codemap.analyzer.syntax.ParseOutcome;
import ai.codemap.util.ProjectPaths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs symbol extraction and import resolution over one file and merges the results into a {@link FileMap}. Holds
 * no per-file state and may be shared between threads.
 */
public final class FileAnalyzer {
    private static final Logger log = LogManager.getLogger(FileAnalyzer.class);

    private final GrammarAdapter adapter;
    private final SymbolExtractor extractor;
    private final ImportResolver resolver;

    public FileAnalyzer(GrammarAdapter adapter, boolean foldLiteralDynamicImports) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.extractor = new SymbolExtractor(adapter);
        this.resolver = new ImportResolver(adapter, foldLiteralDynamicImports);
    }

    public GrammarAdapter adapter() {
        return adapter;
    }

    /** Parses {@code sourceText} with the adapter and analyzes the result. */
    public FileMap analyze(String filePath, String sourceText) {
        Objects.requireNonNull(sourceText, "sourceText");
        return analyze(filePath, adapter.parse(sourceText));
    }

    /**
     * Analyzes an already parsed file. A {@link ParseOutcome.ParseError}, or an unexpected failure while walking the
     * tree, yields an empty map carrying a single {@link DiagnosticKind#UNPARSEABLE_FILE} diagnostic.
     */
    public FileMap analyze(String filePath, ParseOutcome outcome) {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(outcome, "outcome");
        var path = ProjectPaths.canonical(filePath);
        var language = adapter.languageId();

        if (outcome instanceof ParseOutcome.ParseError error) {
            log.debug("Unparseable {} file {}: {}", language, path, error.message());
            return FileMap.unparseable(path, language, error.message());
        }

        var tree = ((ParseOutcome.Parsed) outcome).tree();
        try {
            var extraction = extractor.extract(tree);
            var resolution = resolver.resolve(path, tree, extraction.symbols());
            var diagnostics = new ArrayList<>(extraction.diagnostics());
            diagnostics.addAll(resolution.diagnostics());
            diagnostics.sort(
                    Comparator.comparing(Diagnostic::span, Comparator.nullsFirst(Comparator.naturalOrder())));
            if (!diagnostics.isEmpty()) {
                log.debug("{} diagnostics for {}", diagnostics.size(), path);
            }
            return new FileMap(path, language, extraction.symbols(), resolution.imports(), diagnostics);
        } catch (RuntimeException e) {
            log.error("Unexpected failure analyzing {}", path, e);
            return FileMap.unparseable(path, language, "analysis failed: " + e);
        }
    }
}
