package ai.codemap.analyzer;

import ai.codemap.analyzer.resolve.ModuleResolver;
import ai.codemap.config.CodeMapConfig;
import ai.codemap.resolve.IndexedModuleResolver;
import ai.codemap.util.ExecutorServiceUtil;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Runs a whole analysis: picks a grammar per file, analyzes files in parallel, feeds the results to a
 * {@link ProjectGraphBuilder} as they complete and links the graph.
 *
 * <p>The graph does not depend on completion order. Files with no registered grammar are skipped; a file whose
 * analysis task fails is reported as unparseable.
 */
public final class CodeMapAnalyzer {
    private static final Logger log = LogManager.getLogger(CodeMapAnalyzer.class);

    /** Lifecycle callbacks. May be invoked from worker threads. */
    public interface Listener {
        Listener NONE = new Listener() {};

        default void onStart(int total) {}

        default void onFileSkipped(String filePath) {}

        default void onFileAnalyzed(FileMap fileMap, int completed, int total) {}

        /** Called exactly once per successful run, after linking. */
        default void onComplete(ProjectGraph graph) {}
    }

    private final Languages languages;
    private final CodeMapConfig config;
    private final Map<String, FileAnalyzer> analyzers = new LinkedHashMap<>();

    public CodeMapAnalyzer(Languages languages, CodeMapConfig config) {
        this.languages = Objects.requireNonNull(languages, "languages");
        this.config = Objects.requireNonNull(config, "config");
        for (var adapter : languages.all()) {
            analyzers.put(adapter.languageId(), new FileAnalyzer(adapter, config.foldLiteralDynamicImports()));
        }
    }

    public static CodeMapAnalyzer withDefaults(CodeMapConfig config) {
        return new CodeMapAnalyzer(Languages.defaults(config), config);
    }

    /** Analyzes the files and links imports against the analyzed files themselves. */
    public ProjectGraph analyze(Collection<SourceFile> files) throws InterruptedException {
        return analyze(files, null, Listener.NONE);
    }

    /**
     * @param resolver module lookup; when null, imports are resolved against the set of analyzed files
     * @throws InterruptedException if interrupted while waiting for workers; in-flight results are discarded
     */
    public ProjectGraph analyze(Collection<SourceFile> files, @Nullable ModuleResolver resolver, Listener listener)
            throws InterruptedException {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(listener, "listener");

        var supported = new ArrayList<SourceFile>(files.size());
        for (var file : files) {
            if (languages.forFile(file.path()).isPresent()) {
                supported.add(file);
            } else {
                log.debug("No grammar for {}, skipping", file.path());
                listener.onFileSkipped(file.path());
            }
        }
        supported.sort(Comparator.comparing(SourceFile::path));
        listener.onStart(supported.size());

        var builder = new ProjectGraphBuilder(languages);
        int parallelism = Math.min(
                ExecutorServiceUtil.effectiveParallelism(config.analysisThreads()), Math.max(1, supported.size()));
        var executor = ExecutorServiceUtil.newFixedThreadExecutor(parallelism, "codemap-analyzer-");
        try {
            CompletionService<FileMap> completionService = new ExecutorCompletionService<>(executor);
            var futureFiles = new IdentityHashMap<Future<FileMap>, SourceFile>();
            for (var file : supported) {
                var analyzer = analyzerFor(file);
                futureFiles.put(completionService.submit(() -> analyzer.analyze(file.path(), file.text())), file);
            }

            for (int completed = 1; completed <= supported.size(); completed++) {
                var future = completionService.take();
                var file = futureFiles.get(future);
                FileMap fileMap;
                try {
                    fileMap = future.get();
                } catch (ExecutionException e) {
                    log.error("Analysis task for {} failed", file.path(), e.getCause());
                    fileMap = FileMap.unparseable(
                            file.path(), analyzerFor(file).adapter().languageId(), "analysis failed: " + e.getCause());
                }
                builder.add(fileMap);
                listener.onFileAnalyzed(fileMap, completed, supported.size());
            }
        } finally {
            executor.shutdownNow();
        }

        var effectiveResolver = resolver != null ? resolver : new IndexedModuleResolver(builder.knownFiles());
        ProjectGraph graph;
        try {
            graph = builder.build(effectiveResolver).get();
        } catch (ExecutionException e) {
            // resolver failures are already edges
            throw new IllegalStateException("Linking the project graph failed", e.getCause());
        }
        log.info("Analyzed {} files into {}", supported.size(), graph);
        listener.onComplete(graph);
        return graph;
    }

    private FileAnalyzer analyzerFor(SourceFile file) {
        var adapter = languages.forFile(file.path()).orElseThrow();
        return analyzers.get(adapter.languageId());
    }

    /** Analyzes a single file with the registered grammar for its extension. */
    public FileMap analyzeFile(SourceFile file) {
        var adapter = languages.forFile(file.path())
                .orElseThrow(() -> new IllegalArgumentException("No grammar for " + file.path()));
        return analyzers.get(adapter.languageId()).analyze(file.path(), file.text());
    }
}
