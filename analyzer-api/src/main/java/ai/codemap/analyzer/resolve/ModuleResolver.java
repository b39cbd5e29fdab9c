package ai.codemap.analyzer.resolve;

import java.util.concurrent.CompletionStage;

/**
 * Maps module references to project files. Implementations may block or complete asynchronously; callers never
 * assume a completed stage. A lookup that goes wrong completes with {@link ModuleResolution.Failed} or
 * exceptionally, never by throwing from {@code resolve}.
 */
@FunctionalInterface
public interface ModuleResolver {

    CompletionStage<ModuleResolution> resolve(String fromFile, ModuleReference reference);
}
