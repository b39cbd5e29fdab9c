package ai.codemap.analyzer;

import ai.codemap.analyzer.syntax.GrammarAdapter;
import ai.codemap.analyzer.syntax.ImportShape;
import ai.codemap.analyzer.syntax.SyntaxNode;
import ai.codemap.analyzer.syntax.SyntaxProfile;
import ai.codemap.analyzer.syntax.SyntaxTree;
import ai.codemap.util.TextCanonicalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Finds every import-equivalent statement of one syntax tree, wherever it is nested, and turns it into an
 * {@link ImportRecord}.
 *
 * <p>Classification is purely syntactic. When several shapes apply, the first of this list wins: dynamic, conditional
 * (guarded), wildcard, grouped re-export, relative, aliased, selective-multiple, direct.
 */
public final class ImportResolver {
    private static final Logger log = LogManager.getLogger(ImportResolver.class);

    public record Resolution(List<ImportRecord> imports, List<Diagnostic> diagnostics) {
        public Resolution {
            imports = List.copyOf(imports);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    private final GrammarAdapter adapter;
    private final SyntaxProfile profile;
    private final boolean foldLiterals;

    public ImportResolver(GrammarAdapter adapter, boolean foldLiteralDynamicImports) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.profile = adapter.syntaxProfile();
        this.foldLiterals = foldLiteralDynamicImports;
    }

    /**
     * @param filePath project-relative path of the file, used to normalize relative imports
     * @param symbols the file's extracted symbols, used to attribute each import to its enclosing scope
     */
    public Resolution resolve(String filePath, SyntaxTree tree, List<SymbolRecord> symbols) {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(tree, "tree");
        var imports = new ArrayList<ImportRecord>();
        var diagnostics = new ArrayList<Diagnostic>();
        visit(filePath, tree.root(), symbols, imports, diagnostics);
        log.trace("Resolved {} imports in {}", imports.size(), filePath);
        return new Resolution(imports, diagnostics);
    }

    private void visit(
            String filePath,
            SyntaxNode node,
            List<SymbolRecord> symbols,
            List<ImportRecord> imports,
            List<Diagnostic> diagnostics) {
        if (profile.isImportCandidate(node)) {
            var shapes = adapter.importReader().read(node, foldLiterals);
            if (!shapes.isEmpty()) {
                var scope = scopeOf(node, symbols);
                boolean guarded = isGuarded(node);
                for (var shape : shapes) {
                    imports.add(toRecord(filePath, node, shape, scope, guarded, diagnostics));
                }
                return;
            }
            if (profile.importKinds().contains(node.kind()) && node.hasError()) {
                diagnostics.add(Diagnostic.of(
                        DiagnosticKind.IMPORT_ANOMALY,
                        "unreadable import statement '" + SymbolExtractor.snippet(node) + "'",
                        node.span()));
            }
        }
        for (var child : node.namedChildren()) {
            visit(filePath, child, symbols, imports, diagnostics);
        }
    }

    private ImportRecord toRecord(
            String filePath,
            SyntaxNode node,
            ImportShape shape,
            @Nullable Integer scope,
            boolean guarded,
            List<Diagnostic> diagnostics) {
        var kind = classify(shape, guarded);
        var raw = node.text().strip();

        if (shape.isDynamic()) {
            return new ImportRecord(
                    raw,
                    kind,
                    shape.targets(),
                    ImportRecord.UNRESOLVED,
                    ImportRecord.UNRESOLVED,
                    0,
                    scope,
                    guarded,
                    node.span());
        }

        var written = Objects.requireNonNull(shape.module());
        var resolved = written;
        // wildcard imports keep the module as written
        if (!shape.isWildcard() && shape.relativeDepth() > 0) {
            var normalized = adapter.moduleLayout().normalizeRelative(filePath, written, shape.relativeDepth());
            if (normalized.isPresent()) {
                resolved = normalized.get();
            } else {
                log.warn("Relative import '{}' in {} goes above project root", written, filePath);
                diagnostics.add(Diagnostic.of(
                        DiagnosticKind.IMPORT_ANOMALY,
                        "relative import '" + written + "' goes above the project root",
                        node.span()));
            }
        }
        return new ImportRecord(
                raw, kind, shape.targets(), written, resolved, shape.relativeDepth(), scope, guarded, node.span());
    }

    static ImportKind classify(ImportShape shape, boolean guarded) {
        if (shape.isDynamic()) {
            return ImportKind.DYNAMIC;
        }
        if (guarded) {
            return ImportKind.CONDITIONAL;
        }
        if (shape.isWildcard()) {
            return ImportKind.WILDCARD;
        }
        boolean multiple = shape.targets().size() > 1;
        if (shape.reExport() && multiple) {
            return ImportKind.SELECTIVE_MULTIPLE;
        }
        if (shape.relativeDepth() > 0) {
            return ImportKind.RELATIVE;
        }
        if (shape.aliased()) {
            return ImportKind.ALIASED;
        }
        if (multiple) {
            return ImportKind.SELECTIVE_MULTIPLE;
        }
        return ImportKind.DIRECT;
    }

    /** Id of the innermost symbol whose span contains the node, or null at file level. */
    private static @Nullable Integer scopeOf(SyntaxNode node, List<SymbolRecord> symbols) {
        var span = node.span();
        Integer scope = null;
        // pre-order: later containing records are nested inside earlier ones
        for (var symbol : symbols) {
            if (symbol.span().startByte() > span.startByte()) {
                break;
            }
            if (symbol.span().contains(span)) {
                scope = symbol.id();
            }
        }
        return scope;
    }

    /** True if a guard construct lies between the node and its enclosing declaration or the file root. */
    private boolean isGuarded(SyntaxNode node) {
        if (profile.guardKinds().isEmpty()) {
            return false;
        }
        var current = node.parent();
        while (current.isPresent()) {
            var ancestor = current.get();
            if (profile.isDeclaration(ancestor)) {
                return false;
            }
            if (profile.guardKinds().contains(ancestor.kind())) {
                log.trace("Import '{}' guarded by {}", TextCanonicalizer.collapseWhitespace(node.text()), ancestor.kind());
                return true;
            }
            current = ancestor.parent();
        }
        return false;
    }
}
