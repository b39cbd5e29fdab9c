package ai.codemap.analyzer.syntax;

import ai.codemap.analyzer.ImportTarget;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Language-neutral reading of one import statement, before classification and normalization.
 *
 * @param module the module reference as written, or null when it is computed at runtime
 * @param relativeDepth number of explicit parent-scope markers in the written module
 * @param targets imported names, in source order
 * @param aliased whether any target was renamed with an explicit alias clause
 * @param reExport whether the statement also re-exports what it imports
 */
public record ImportShape(
        @Nullable String module, int relativeDepth, List<ImportTarget> targets, boolean aliased, boolean reExport) {

    public ImportShape {
        targets = List.copyOf(targets);
        if (relativeDepth < 0) {
            throw new IllegalArgumentException("relativeDepth must be >= 0");
        }
    }

    public static ImportShape of(String module, int relativeDepth, List<ImportTarget> targets, boolean aliased) {
        return new ImportShape(module, relativeDepth, targets, aliased, false);
    }

    public static ImportShape reExport(String module, int relativeDepth, List<ImportTarget> targets, boolean aliased) {
        return new ImportShape(module, relativeDepth, targets, aliased, true);
    }

    /** An import whose module name is not a literal at the import site. */
    public static ImportShape dynamic(List<ImportTarget> targets) {
        return new ImportShape(null, 0, targets, false, false);
    }

    public boolean isDynamic() {
        return module == null;
    }

    public boolean isWildcard() {
        return targets.stream().anyMatch(ImportTarget::isWildcard);
    }
}
