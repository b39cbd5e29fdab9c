package ai.codemap.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One import-equivalent statement of a source file.
 *
 * <p>{@code resolvedModule} is the best-effort normalized module path, or {@link #UNRESOLVED} when the target is
 * computed at runtime. {@code writtenModule} keeps the module reference as it appears in the source.
 */
public record ImportRecord(
        String rawStatement,
        ImportKind kind,
        List<ImportTarget> targets,
        String writtenModule,
        String resolvedModule,
        int relativeDepth,
        @Nullable Integer scope,
        boolean guarded,
        SourceSpan span) {

    /** Sentinel module for imports whose target cannot be determined statically. */
    public static final String UNRESOLVED = "<unresolved>";

    public ImportRecord {
        Objects.requireNonNull(rawStatement, "rawStatement");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(writtenModule, "writtenModule");
        Objects.requireNonNull(resolvedModule, "resolvedModule");
        Objects.requireNonNull(span, "span");
        targets = List.copyOf(targets);
        if (relativeDepth < 0) {
            throw new IllegalArgumentException("relativeDepth must be >= 0");
        }
        if (kind.requiresTargets() && targets.isEmpty()) {
            throw new IllegalArgumentException(kind + " import must have at least one target: " + rawStatement);
        }
        if (kind == ImportKind.WILDCARD && !(targets.size() == 1 && targets.get(0).isWildcard())) {
            throw new IllegalArgumentException("wildcard import must have exactly one '*' target: " + rawStatement);
        }
    }

    @JsonIgnore
    public boolean isUnresolved() {
        return UNRESOLVED.equals(resolvedModule);
    }

    @JsonIgnore
    public boolean isWildcard() {
        return targets.stream().anyMatch(ImportTarget::isWildcard);
    }
}
