package ai.codemap.analyzer;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** One imported name and the local name it is bound to. */
public record ImportTarget(String importedName, @Nullable String localAlias, boolean isWildcard) {

    public static final ImportTarget WILDCARD = new ImportTarget("*", null, true);

    public ImportTarget {
        Objects.requireNonNull(importedName, "importedName");
        if (isWildcard && !"*".equals(importedName)) {
            throw new IllegalArgumentException("wildcard target must be named '*'");
        }
    }

    public static ImportTarget of(String importedName) {
        return new ImportTarget(importedName, null, false);
    }

    public static ImportTarget aliased(String importedName, @Nullable String localAlias) {
        return new ImportTarget(importedName, localAlias, false);
    }

    /** The name this target binds in the importing scope. */
    public String boundName() {
        return localAlias != null ? localAlias : importedName;
    }
}
