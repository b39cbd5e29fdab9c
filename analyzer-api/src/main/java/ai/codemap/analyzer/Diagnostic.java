package ai.codemap.analyzer;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** A non-fatal anomaly encountered while analyzing one file. */
public record Diagnostic(DiagnosticKind kind, String message, @Nullable SourceSpan span) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static Diagnostic of(DiagnosticKind kind, String message, SourceSpan span) {
        return new Diagnostic(kind, message, span);
    }

    public static Diagnostic fileLevel(DiagnosticKind kind, String message) {
        return new Diagnostic(kind, message, null);
    }
}
