package ai.codemap.analyzer;

import ai.codemap.analyzer.resolve.ModuleReference;
import ai.codemap.analyzer.resolve.ModuleResolution;
import ai.codemap.analyzer.resolve.ModuleResolver;
import ai.codemap.analyzer.syntax.ModuleLayout;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects {@link FileMap}s of one analysis run and links their imports into a {@link ProjectGraph}.
 *
 * <p>File maps may arrive in any order and from any thread; linking waits for {@link #build(ModuleResolver)}, so an
 * import can be satisfied by a file discovered after the importing one. Every import yields exactly one edge: to the
 * file it resolves to, or to {@link ProjectGraph#UNKNOWN_NODE} with a status saying why.
 */
public final class ProjectGraphBuilder {
    private static final Logger log = LogManager.getLogger(ProjectGraphBuilder.class);

    private final Languages languages;
    private final Map<String, FileMap> files = new TreeMap<>();

    public ProjectGraphBuilder(Languages languages) {
        this.languages = Objects.requireNonNull(languages, "languages");
    }

    /** Adds a file map; a later map for the same path replaces the earlier one. */
    public synchronized void add(FileMap fileMap) {
        Objects.requireNonNull(fileMap, "fileMap");
        var previous = files.put(fileMap.filePath(), fileMap);
        if (previous != null) {
            log.warn("Replacing earlier analysis of {}", fileMap.filePath());
        }
    }

    public synchronized Set<String> knownFiles() {
        return Set.copyOf(files.keySet());
    }

    public synchronized int size() {
        return files.size();
    }

    /**
     * Links every import of the files added so far. Resolution may complete asynchronously; the returned future
     * completes once every lookup has.
     */
    public CompletableFuture<ProjectGraph> build(ModuleResolver resolver) {
        Objects.requireNonNull(resolver, "resolver");
        Map<String, FileMap> snapshot;
        synchronized (this) {
            snapshot = new TreeMap<>(files);
        }

        var pending = new ArrayList<CompletableFuture<DependencyEdge>>();
        for (var fileMap : snapshot.values()) {
            for (var importRecord : fileMap.imports()) {
                pending.add(link(fileMap, importRecord, resolver));
            }
        }
        log.debug("Linking {} imports across {} files", pending.size(), snapshot.size());

        return CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new)).thenApply(ignored -> {
            List<DependencyEdge> edges = pending.stream().map(CompletableFuture::join).toList();
            var graph = new ProjectGraph(snapshot, edges);
            log.debug(
                    "Built {} with {} edges to unknown targets", graph, graph.unknownEdges().size());
            return graph;
        });
    }

    private CompletableFuture<DependencyEdge> link(FileMap fileMap, ImportRecord importRecord, ModuleResolver resolver) {
        var from = fileMap.filePath();
        if (importRecord.isUnresolved()) {
            return CompletableFuture.completedFuture(
                    DependencyEdge.unknown(from, importRecord, EdgeStatus.UNRESOLVED));
        }

        var layout = languages.byId(fileMap.language()).map(a -> a.moduleLayout());
        if (layout.isEmpty()) {
            log.warn("No grammar registered for language {} of {}", fileMap.language(), from);
            return CompletableFuture.completedFuture(
                    DependencyEdge.unknown(from, importRecord, EdgeStatus.NOT_FOUND));
        }

        var reference = referenceFor(fileMap, importRecord, layout.get());
        if (reference.isEmpty()) {
            return CompletableFuture.completedFuture(
                    DependencyEdge.unknown(from, importRecord, EdgeStatus.NOT_FOUND));
        }
        if (!reference.get().rootAnchored() && layout.get().isStandardLibrary(reference.get().module())) {
            return CompletableFuture.completedFuture(
                    DependencyEdge.unknown(from, importRecord, EdgeStatus.STANDARD_LIBRARY));
        }

        CompletionStage<ModuleResolution> stage;
        try {
            stage = Objects.requireNonNull(resolver.resolve(from, reference.get()), "resolver returned no stage");
        } catch (RuntimeException e) {
            log.warn("Module resolver threw for '{}' from {}", reference.get().module(), from, e);
            return CompletableFuture.completedFuture(
                    DependencyEdge.unknown(from, importRecord, EdgeStatus.RESOLUTION_FAILED));
        }
        return stage.toCompletableFuture()
                .thenApply(resolution -> toEdge(from, importRecord, resolution))
                .exceptionally(ex -> {
                    log.warn("Resolving '{}' from {} failed", reference.get().module(), from, ex);
                    return DependencyEdge.unknown(from, importRecord, EdgeStatus.RESOLUTION_FAILED);
                });
    }

    /**
     * The module to look up. Wildcard imports keep the module as written in the record, guarded ones included, so
     * relative ones are normalized here.
     */
    private static Optional<ModuleReference> referenceFor(
            FileMap fileMap, ImportRecord importRecord, ModuleLayout layout) {
        var module = importRecord.resolvedModule();
        boolean relative = importRecord.relativeDepth() > 0;
        if (relative && importRecord.isWildcard()) {
            var normalized =
                    layout.normalizeRelative(fileMap.filePath(), importRecord.writtenModule(), importRecord.relativeDepth());
            if (normalized.isEmpty()) {
                return Optional.empty();
            }
            module = normalized.get();
        }
        var candidates = layout.candidatePaths(fileMap.filePath(), module, relative);
        return Optional.of(new ModuleReference(fileMap.language(), module, relative, candidates));
    }

    private static DependencyEdge toEdge(String from, ImportRecord importRecord, ModuleResolution resolution) {
        if (resolution instanceof ModuleResolution.Found found) {
            return DependencyEdge.resolved(from, importRecord, found.filePath());
        }
        if (resolution instanceof ModuleResolution.Failed failed) {
            log.debug("Resolution of '{}' from {} failed: {}", importRecord.resolvedModule(), from, failed.reason());
            return DependencyEdge.unknown(from, importRecord, EdgeStatus.RESOLUTION_FAILED);
        }
        return DependencyEdge.unknown(from, importRecord, EdgeStatus.NOT_FOUND);
    }
}
