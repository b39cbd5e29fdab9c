package ai.codemap.analyzer.resolve;

import java.util.Objects;

/** Outcome of looking up a {@link ModuleReference}. */
public sealed interface ModuleResolution
        permits ModuleResolution.Found, ModuleResolution.NotFound, ModuleResolution.Failed {

    record Found(String filePath) implements ModuleResolution {
        public Found {
            Objects.requireNonNull(filePath, "filePath");
        }
    }

    record NotFound() implements ModuleResolution {}

    record Failed(String reason) implements ModuleResolution {
        public Failed {
            Objects.requireNonNull(reason, "reason");
        }
    }

    static ModuleResolution found(String filePath) {
        return new Found(filePath);
    }

    static ModuleResolution notFound() {
        return new NotFound();
    }

    static ModuleResolution failed(String reason) {
        return new Failed(reason);
    }
}
