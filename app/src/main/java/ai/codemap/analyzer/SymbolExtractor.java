package ai.codemap.analyzer;

import ai.codemap.analyzer.syntax.GrammarAdapter;
import ai.codemap.analyzer.syntax.MarkerDecorators;
import ai.codemap.analyzer.syntax.SyntaxNode;
import ai.codemap.analyzer.syntax.SyntaxProfile;
import ai.codemap.analyzer.syntax.SyntaxTree;
import ai.codemap.util.TextCanonicalizer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Walks one syntax tree in pre-order and emits a {@link SymbolRecord} for every declaration-like node, classified
 * through the adapter's {@link SyntaxProfile}.
 *
 * <p>A declaration with a missing name or an error inside its header produces no record; its subtree is skipped and a
 * {@link DiagnosticKind#DECLARATION_ANOMALY} is reported instead. Error regions elsewhere are reported as
 * {@link DiagnosticKind#SYNTAX_ERROR} and still searched for well-formed declarations.
 */
public final class SymbolExtractor {
    private static final Logger log = LogManager.getLogger(SymbolExtractor.class);

    private static final int SNIPPET_LENGTH = 40;

    public record Extraction(List<SymbolRecord> symbols, List<Diagnostic> diagnostics) {
        public Extraction {
            symbols = List.copyOf(symbols);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    private final GrammarAdapter adapter;
    private final SyntaxProfile profile;

    public SymbolExtractor(GrammarAdapter adapter) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.profile = adapter.syntaxProfile();
    }

    public Extraction extract(SyntaxTree tree) {
        Objects.requireNonNull(tree, "tree");
        var pass = new Pass();
        pass.visit(tree.root(), null, null);
        log.trace("Extracted {} symbols from {} tree", pass.symbols.size(), tree.languageId());
        return new Extraction(pass.symbols, pass.diagnostics);
    }

    /** State of a single extraction. */
    private final class Pass {
        final List<SymbolRecord> symbols = new ArrayList<>();
        final List<Diagnostic> diagnostics = new ArrayList<>();

        /**
         * @param nearest innermost enclosing record of any kind
         * @param named innermost enclosing record that is not a lambda
         */
        void visit(SyntaxNode node, @Nullable SymbolRecord nearest, @Nullable SymbolRecord named) {
            if (node.isError()) {
                diagnostics.add(Diagnostic.of(
                        DiagnosticKind.SYNTAX_ERROR, "syntax error near '" + snippet(node) + "'", node.span()));
            }

            var nextNearest = nearest;
            var nextNamed = named;
            if (profile.isDeclaration(node)) {
                var declared = declare(node, nearest, named);
                if (declared.isEmpty()) {
                    return;
                }
                nextNearest = declared.get();
                if (nextNearest.kind() != SymbolKind.LAMBDA) {
                    nextNamed = nextNearest;
                }
            }
            for (var child : node.namedChildren()) {
                visit(child, nextNearest, nextNamed);
            }
        }

        private Optional<SymbolRecord> declare(
                SyntaxNode node, @Nullable SymbolRecord nearest, @Nullable SymbolRecord named) {
            var headerProblem = headerProblem(node);
            if (headerProblem != null) {
                return anomaly(node, headerProblem);
            }

            boolean lambda = profile.isLambda(node);
            var declaredName = nameOf(node);
            String name;
            if (declaredName.isPresent()) {
                name = declaredName.get();
            } else if (lambda) {
                name = syntheticName("lambda", node);
            } else if (profile.anonymousClassKinds().contains(node.kind())) {
                name = syntheticName("class", node);
            } else {
                return anomaly(node, "declaration has no name");
            }

            var decorators = decoratorsOf(node);
            var modifiers = EnumSet.noneOf(SymbolModifier.class);
            var roles = decorators.stream()
                    .map(d -> profile.markers().roleOf(d))
                    .flatMap(Optional::stream)
                    .collect(Collectors.toSet());
            if (decorators.stream().anyMatch(d -> profile.markers().roleOf(d).isEmpty())) {
                modifiers.add(SymbolModifier.DECORATED);
            }
            boolean staticKeyword = hasStaticKeyword(node);
            if (staticKeyword) {
                modifiers.add(SymbolModifier.STATIC);
            }

            SymbolKind kind;
            Integer enclosing;
            if (lambda) {
                kind = SymbolKind.LAMBDA;
                enclosing = named == null ? null : named.id();
            } else if (profile.isClass(node)) {
                kind = SymbolKind.CLASS;
                enclosing = nearest == null ? null : nearest.id();
            } else {
                kind = classifyFunction(node, name, nearest, roles, staticKeyword);
                enclosing = nearest == null ? null : nearest.id();
            }
            if (kind == SymbolKind.CLASS_METHOD) {
                modifiers.add(SymbolModifier.CLASS_BOUND);
            } else if (kind == SymbolKind.STATIC_METHOD) {
                modifiers.add(SymbolModifier.STATIC);
            }

            if (kind != SymbolKind.CLASS) {
                if (hasAsyncQualifier(node)) {
                    modifiers.add(SymbolModifier.ASYNC);
                }
                if (isGenerator(node)) {
                    modifiers.add(SymbolModifier.GENERATOR);
                }
            }

            var record = new SymbolRecord(
                    symbols.size(),
                    name,
                    kind,
                    modifiers,
                    enclosing,
                    decorators,
                    adapter.readDocComment(node).orElse(null),
                    signatureOf(node),
                    kind == SymbolKind.CLASS ? adapter.readBases(node) : List.of(),
                    node.span());
            symbols.add(record);
            log.trace("{} {} at {}", kind, name, node.span());
            return Optional.of(record);
        }

        private Optional<SymbolRecord> anomaly(SyntaxNode node, String problem) {
            var message = problem + " in " + node.kind() + " '" + snippet(node) + "'";
            log.debug("Skipping malformed declaration at {}: {}", node.span(), message);
            diagnostics.add(Diagnostic.of(DiagnosticKind.DECLARATION_ANOMALY, message, node.span()));
            return Optional.empty();
        }
    }

    private SymbolKind classifyFunction(
            SyntaxNode node,
            String name,
            @Nullable SymbolRecord nearest,
            Set<MarkerDecorators.Role> roles,
            boolean staticKeyword) {
        if (nearest == null || nearest.kind() != SymbolKind.CLASS) {
            return SymbolKind.FUNCTION;
        }
        if (profile.constructorKinds().contains(node.kind())
                || profile.constructorNames().contains(name)) {
            return SymbolKind.CONSTRUCTOR;
        }
        if (roles.contains(MarkerDecorators.Role.CLASS_METHOD)) {
            return SymbolKind.CLASS_METHOD;
        }
        if (roles.contains(MarkerDecorators.Role.STATIC_METHOD) || staticKeyword) {
            return SymbolKind.STATIC_METHOD;
        }
        return SymbolKind.METHOD;
    }

    /** Describes an error or missing node among the declaration's children other than its body, or null. */
    private @Nullable String headerProblem(SyntaxNode node) {
        var body = node.field(profile.bodyField());
        for (var child : node.children()) {
            if (body.isPresent() && sameNode(child, body.get())) {
                continue;
            }
            if (child.isMissing()) {
                return "missing '" + child.kind() + "'";
            }
            if (child.isError() || child.hasError()) {
                return "syntax error";
            }
        }
        return null;
    }

    private static boolean sameNode(SyntaxNode a, SyntaxNode b) {
        return a.span().equals(b.span()) && a.kind().equals(b.kind());
    }

    private Optional<String> nameOf(SyntaxNode node) {
        return node.field(profile.nameField()).map(n -> n.text().strip()).filter(s -> !s.isEmpty());
    }

    private static String syntheticName(String prefix, SyntaxNode node) {
        var span = node.span();
        return "<" + prefix + ">@" + span.startLine() + ":" + span.startColumn();
    }

    /** Decorator texts from a wrapping node, from the declaration itself and from its modifiers, in source order. */
    private List<String> decoratorsOf(SyntaxNode node) {
        var result = new ArrayList<String>();
        node.parent()
                .filter(p -> profile.decoratorWrapperKinds().contains(p.kind()))
                .ifPresent(wrapper -> addDecorators(wrapper, result));
        for (var child : node.children()) {
            if (profile.decoratorKinds().contains(child.kind())) {
                result.add(child.text().strip());
            } else if (!profile.modifiersKind().isEmpty() && child.is(profile.modifiersKind())) {
                addDecorators(child, result);
            }
        }
        return result;
    }

    private void addDecorators(SyntaxNode container, List<String> into) {
        for (var child : container.children()) {
            if (profile.decoratorKinds().contains(child.kind())) {
                into.add(child.text().strip());
            }
        }
    }

    private boolean hasStaticKeyword(SyntaxNode node) {
        if (profile.staticKeywords().isEmpty()) {
            return false;
        }
        for (var child : node.children()) {
            if (profile.staticKeywords().contains(child.kind())) {
                return true;
            }
            if (!profile.modifiersKind().isEmpty() && child.is(profile.modifiersKind())) {
                for (var modifier : child.children()) {
                    if (profile.staticKeywords().contains(modifier.kind())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private boolean hasAsyncQualifier(SyntaxNode node) {
        if (profile.asyncKeyword().isEmpty()) {
            return false;
        }
        return node.children().stream().anyMatch(c -> c.is(profile.asyncKeyword()));
    }

    private boolean isGenerator(SyntaxNode node) {
        if (node.children().stream().anyMatch(c -> profile.generatorMarkers().contains(c.kind()))) {
            return true;
        }
        if (profile.suspensionKinds().isEmpty()) {
            return false;
        }
        var body = node.field(profile.bodyField());
        if (body.isPresent()) {
            return containsSuspension(body.get());
        }
        return node.namedChildren().stream().anyMatch(this::containsSuspension);
    }

    /** Searches for a suspension point without entering nested declarations, which own their own. */
    private boolean containsSuspension(SyntaxNode node) {
        if (profile.suspensionKinds().contains(node.kind())) {
            return true;
        }
        if (profile.isDeclaration(node)) {
            return false;
        }
        for (var child : node.namedChildren()) {
            if (containsSuspension(child)) {
                return true;
            }
        }
        return false;
    }

    /** Header text up to the body, whitespace-collapsed, without a trailing {@code :} or {@code ;}. */
    private String signatureOf(SyntaxNode node) {
        var text = node.text();
        var body = node.field(profile.bodyField());
        if (body.isPresent()) {
            byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
            int cut = body.get().span().startByte() - node.span().startByte();
            if (cut >= 0 && cut <= bytes.length) {
                text = new String(bytes, 0, cut, StandardCharsets.UTF_8);
            }
        }
        var signature = TextCanonicalizer.collapseWhitespace(text);
        while (signature.endsWith(":") || signature.endsWith(";")) {
            signature = signature.substring(0, signature.length() - 1).stripTrailing();
        }
        return signature;
    }

    static String snippet(SyntaxNode node) {
        var text = TextCanonicalizer.collapseWhitespace(node.text());
        return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH) + "...";
    }
}
