package ai.codemap.resolve;

import ai.codemap.analyzer.resolve.ModuleReference;
import ai.codemap.analyzer.resolve.ModuleResolution;
import ai.codemap.analyzer.resolve.ModuleResolver;
import java.util.Collection;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves modules against a fixed set of project files, without touching the filesystem.
 *
 * <p>Candidates are tried in order as exact paths first. For references that are not anchored at the project root, a
 * candidate may also match the tail of a path below a source directory ({@code src/pkg/mod.py} for {@code pkg/mod.py});
 * the shortest such path wins, then the lexicographically smallest.
 */
public final class IndexedModuleResolver implements ModuleResolver {
    private static final Logger log = LogManager.getLogger(IndexedModuleResolver.class);

    private static final Comparator<String> SHORTEST_FIRST =
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private final Set<String> files;

    public IndexedModuleResolver(Collection<String> projectFiles) {
        this.files = new TreeSet<>(projectFiles);
    }

    @Override
    public CompletionStage<ModuleResolution> resolve(String fromFile, ModuleReference reference) {
        return CompletableFuture.completedFuture(lookup(fromFile, reference));
    }

    ModuleResolution lookup(String fromFile, ModuleReference reference) {
        for (var candidate : reference.candidatePaths()) {
            if (files.contains(candidate)) {
                return ModuleResolution.found(candidate);
            }
        }
        if (reference.rootAnchored()) {
            return ModuleResolution.notFound();
        }
        for (var candidate : reference.candidatePaths()) {
            var suffix = "/" + candidate;
            var match = files.stream().filter(f -> f.endsWith(suffix)).min(SHORTEST_FIRST);
            if (match.isPresent()) {
                log.trace("Module '{}' from {} matched {} by suffix", reference.module(), fromFile, match.get());
                return ModuleResolution.found(match.get());
            }
        }
        return ModuleResolution.notFound();
    }
}
