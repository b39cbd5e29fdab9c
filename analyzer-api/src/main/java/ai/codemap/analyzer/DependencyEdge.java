package ai.codemap.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/**
 * A directed edge from an importing file to the file it depends on, or to {@link ProjectGraph#UNKNOWN_NODE}.
 */
public record DependencyEdge(String fromFile, ImportRecord importRecord, String target, EdgeStatus status) {

    public DependencyEdge {
        Objects.requireNonNull(fromFile, "fromFile");
        Objects.requireNonNull(importRecord, "importRecord");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(status, "status");
        if (status.pointsToUnknown() != ProjectGraph.UNKNOWN_NODE.equals(target)) {
            throw new IllegalArgumentException("edge status " + status + " does not match target " + target);
        }
    }

    public static DependencyEdge resolved(String fromFile, ImportRecord importRecord, String targetFile) {
        return new DependencyEdge(fromFile, importRecord, targetFile, EdgeStatus.RESOLVED);
    }

    public static DependencyEdge unknown(String fromFile, ImportRecord importRecord, EdgeStatus status) {
        return new DependencyEdge(fromFile, importRecord, ProjectGraph.UNKNOWN_NODE, status);
    }

    @JsonIgnore
    public boolean isUnknown() {
        return status.pointsToUnknown();
    }
}
