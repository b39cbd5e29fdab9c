package ai.codemap.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Analysis result for one source file: its symbol arena, its import records and the anomalies met along the way.
 * Instances are immutable once built.
 */
public record FileMap(
        String filePath,
        String language,
        List<SymbolRecord> symbols,
        List<ImportRecord> imports,
        List<Diagnostic> parseDiagnostics) {

    public FileMap {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(language, "language");
        symbols = List.copyOf(symbols);
        imports = List.copyOf(imports);
        parseDiagnostics = List.copyOf(parseDiagnostics);
        for (int i = 0; i < symbols.size(); i++) {
            if (symbols.get(i).id() != i) {
                throw new IllegalArgumentException(
                        "symbol ids must match arena positions in " + filePath + ": " + symbols.get(i));
            }
        }
    }

    /** An empty map for a file the parser could not handle at all. */
    public static FileMap unparseable(String filePath, String language, String reason) {
        return new FileMap(
                filePath,
                language,
                List.of(),
                List.of(),
                List.of(Diagnostic.fileLevel(DiagnosticKind.UNPARSEABLE_FILE, reason)));
    }

    @JsonIgnore
    public boolean isUnparseable() {
        return parseDiagnostics.stream().anyMatch(d -> d.kind() == DiagnosticKind.UNPARSEABLE_FILE);
    }

    public SymbolRecord symbol(int id) {
        return symbols.get(id);
    }

    public Optional<SymbolRecord> enclosingScopeOf(SymbolRecord symbol) {
        var scope = symbol.enclosingScope();
        return scope == null ? Optional.empty() : Optional.of(symbols.get(scope));
    }

    public Optional<SymbolRecord> scopeOf(ImportRecord importRecord) {
        var scope = importRecord.scope();
        return scope == null ? Optional.empty() : Optional.of(symbols.get(scope));
    }

    public List<SymbolRecord> childrenOf(SymbolRecord parent) {
        return symbols.stream()
                .filter(s -> s.enclosingScope() != null && s.enclosingScope() == parent.id())
                .toList();
    }

    @JsonIgnore
    public List<SymbolRecord> topLevelSymbols() {
        return symbols.stream().filter(SymbolRecord::isTopLevel).toList();
    }

    public List<SymbolRecord> symbolsOfKind(SymbolKind kind) {
        return symbols.stream().filter(s -> s.kind() == kind).toList();
    }

    public List<Diagnostic> diagnosticsOfKind(DiagnosticKind kind) {
        return parseDiagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
