package ai.codemap.resolve;

import ai.codemap.analyzer.resolve.ModuleReference;
import ai.codemap.analyzer.resolve.ModuleResolution;
import ai.codemap.analyzer.resolve.ModuleResolver;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves modules by probing candidate files below a project root, on the given executor. Each candidate is tried
 * under every source root in order; paths that would leave the project root are ignored.
 */
public final class FileSystemModuleResolver implements ModuleResolver {
    private static final Logger log = LogManager.getLogger(FileSystemModuleResolver.class);

    private final Path projectRoot;
    private final List<String> sourceRoots;
    private final Executor executor;

    /**
     * @param sourceRoots project-relative directories holding sources; {@code ""} is the project root itself
     */
    public FileSystemModuleResolver(Path projectRoot, List<String> sourceRoots, Executor executor) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.sourceRoots = sourceRoots.isEmpty() ? List.of("") : List.copyOf(sourceRoots);
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public FileSystemModuleResolver(Path projectRoot, Executor executor) {
        this(projectRoot, List.of(""), executor);
    }

    @Override
    public CompletionStage<ModuleResolution> resolve(String fromFile, ModuleReference reference) {
        return CompletableFuture.supplyAsync(() -> probe(reference), executor);
    }

    private ModuleResolution probe(ModuleReference reference) {
        var roots = reference.rootAnchored() ? List.of("") : sourceRoots;
        try {
            for (var root : roots) {
                var base = root.isEmpty() ? projectRoot : projectRoot.resolve(root);
                for (var candidate : reference.candidatePaths()) {
                    var path = base.resolve(candidate).normalize();
                    if (!path.startsWith(projectRoot)) {
                        continue;
                    }
                    if (Files.isRegularFile(path)) {
                        return ModuleResolution.found(projectRoot.relativize(path).toString().replace('\\', '/'));
                    }
                }
            }
        } catch (InvalidPathException e) {
            log.debug("Invalid candidate path for module '{}': {}", reference.module(), e.getMessage());
            return ModuleResolution.failed("invalid path: " + e.getMessage());
        } catch (SecurityException e) {
            log.warn("Access denied while resolving module '{}'", reference.module(), e);
            return ModuleResolution.failed("access denied: " + e.getMessage());
        }
        return ModuleResolution.notFound();
    }
}
