package ai.codemap.analyzer;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The result of one analysis run: every input file's {@link FileMap} keyed by path, plus the dependency edges derived
 * from their imports. Imports that could not be linked to a project file point at {@link #UNKNOWN_NODE}; none are
 * dropped. Cycles are allowed.
 */
public final class ProjectGraph {

    /** Sentinel node for external, missing or runtime-computed dependency targets. */
    public static final String UNKNOWN_NODE = "<external/unknown>";

    private final SortedMap<String, FileMap> files;
    private final List<DependencyEdge> edges;

    public ProjectGraph(Map<String, FileMap> files, List<DependencyEdge> edges) {
        this.files = Collections.unmodifiableSortedMap(new TreeMap<>(files));
        this.edges = List.copyOf(edges);
        for (var edge : this.edges) {
            if (!this.files.containsKey(edge.fromFile())) {
                throw new IllegalArgumentException("edge from unknown file " + edge.fromFile());
            }
        }
    }

    @JsonProperty("files")
    public SortedMap<String, FileMap> files() {
        return files;
    }

    @JsonProperty("edges")
    public List<DependencyEdge> edges() {
        return edges;
    }

    public Optional<FileMap> fileMap(String filePath) {
        return Optional.ofNullable(files.get(filePath));
    }

    public List<DependencyEdge> edgesFrom(String filePath) {
        return edges.stream().filter(e -> e.fromFile().equals(filePath)).toList();
    }

    public List<DependencyEdge> edgesInto(String filePath) {
        return edges.stream().filter(e -> e.target().equals(filePath)).toList();
    }

    /** Project files that {@code filePath} imports, excluding the unknown node. */
    public SortedSet<String> dependenciesOf(String filePath) {
        return edgesFrom(filePath).stream()
                .filter(e -> !e.isUnknown())
                .map(DependencyEdge::target)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /** Project files that import {@code filePath}. */
    public SortedSet<String> dependentsOf(String filePath) {
        return edgesInto(filePath).stream()
                .map(DependencyEdge::fromFile)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public List<DependencyEdge> unknownEdges() {
        return edges.stream().filter(DependencyEdge::isUnknown).toList();
    }

    public List<DependencyEdge> edgesWithStatus(EdgeStatus status) {
        return edges.stream().filter(e -> e.status() == status).toList();
    }

    @Override
    public String toString() {
        return "ProjectGraph[files=" + files.size() + ", edges=" + edges.size() + "]";
    }
}
