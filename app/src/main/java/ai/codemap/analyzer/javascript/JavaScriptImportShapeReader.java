package ai.codemap.analyzer.javascript;

import static ai.codemap.analyzer.javascript.JavaScriptTreeSitterNodeTypes.*;

import ai.codemap.analyzer.ImportTarget;
import ai.codemap.analyzer.syntax.ImportShape;
import ai.codemap.analyzer.syntax.ImportShapeReader;
import ai.codemap.analyzer.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads ES module imports, re-exports ({@code export ... from}), CommonJS {@code require(...)} and dynamic
 * {@code import(...)}.
 *
 * <p>A namespace binding ({@code import * as ns}, {@code const ns = require(...)}) is the target {@code *} bound to
 * the local name; it is not a wildcard, since nothing is spilled into the importing scope. Side-effect imports name
 * the module itself as their only target.
 */
final class JavaScriptImportShapeReader implements ImportShapeReader {
    private static final Logger log = LogManager.getLogger(JavaScriptImportShapeReader.class);

    private static final String REQUIRE = "require";
    private static final String DEFAULT_EXPORT = "default";
    private static final String NAMESPACE = "*";

    private record Bindings(List<ImportTarget> targets, boolean aliased) {
        static final Bindings NONE = new Bindings(List.of(), false);
    }

    @Override
    public List<ImportShape> read(SyntaxNode node, boolean foldLiterals) {
        switch (node.kind()) {
            case IMPORT_STATEMENT:
                return readImport(node).map(List::of).orElse(List.of());
            case EXPORT_STATEMENT:
                return readReExport(node).map(List::of).orElse(List.of());
            case CALL_EXPRESSION:
                return readCall(node, foldLiterals).map(List::of).orElse(List.of());
            default:
                return List.of();
        }
    }

    private Optional<ImportShape> readImport(SyntaxNode node) {
        var source = node.field(FIELD_SOURCE).flatMap(JavaScriptStrings::literalValue);
        if (source.isEmpty()) {
            log.debug("import without a literal source at {}", node.span());
            return Optional.empty();
        }
        var module = source.get();
        int depth = relativeDepth(module);

        var clause = node.firstChildOfKind(IMPORT_CLAUSE);
        if (clause.isEmpty()) {
            return Optional.of(ImportShape.of(module, depth, List.of(ImportTarget.of(module)), false));
        }
        var targets = new ArrayList<ImportTarget>();
        boolean aliased = false;
        for (var child : clause.get().namedChildren()) {
            switch (child.kind()) {
                case IDENTIFIER:
                    targets.add(ImportTarget.aliased(DEFAULT_EXPORT, child.text()));
                    break;
                case NAMESPACE_IMPORT:
                    targets.add(ImportTarget.aliased(
                            NAMESPACE,
                            child.firstChildOfKind(IDENTIFIER).map(SyntaxNode::text).orElse(null)));
                    aliased = true;
                    break;
                case NAMED_IMPORTS:
                    for (var specifier : child.namedChildren()) {
                        if (!specifier.is(IMPORT_SPECIFIER)) {
                            continue;
                        }
                        var target = specifierTarget(specifier);
                        aliased |= target.localAlias() != null;
                        targets.add(target);
                    }
                    break;
                default:
                    break;
            }
        }
        if (targets.isEmpty()) {
            // import {} from 'm'
            targets.add(ImportTarget.of(module));
        }
        return Optional.of(ImportShape.of(module, depth, targets, aliased));
    }

    /** {@code export * from}, {@code export * as ns from} and {@code export {a, b as c} from}; local exports are not imports. */
    private Optional<ImportShape> readReExport(SyntaxNode node) {
        var sourceNode = node.field(FIELD_SOURCE);
        if (sourceNode.isEmpty()) {
            return Optional.empty();
        }
        var source = JavaScriptStrings.literalValue(sourceNode.get());
        if (source.isEmpty()) {
            return Optional.empty();
        }
        var module = source.get();
        int depth = relativeDepth(module);

        var namespaceExport = node.firstChildOfKind(NAMESPACE_EXPORT);
        if (namespaceExport.isPresent()) {
            var name = namespaceExport.get().firstNamedChild().map(n -> JavaScriptStrings.literalValue(n).orElse(n.text()));
            return Optional.of(
                    ImportShape.reExport(module, depth, List.of(ImportTarget.aliased(NAMESPACE, name.orElse(null))), true));
        }
        var exportClause = node.firstChildOfKind(EXPORT_CLAUSE);
        if (exportClause.isPresent()) {
            var targets = new ArrayList<ImportTarget>();
            boolean aliased = false;
            for (var specifier : exportClause.get().namedChildren()) {
                if (specifier.is(EXPORT_SPECIFIER)) {
                    var target = specifierTarget(specifier);
                    aliased |= target.localAlias() != null;
                    targets.add(target);
                }
            }
            if (targets.isEmpty()) {
                targets.add(ImportTarget.of(module));
            }
            return Optional.of(ImportShape.reExport(module, depth, targets, aliased));
        }
        if (node.children().stream().anyMatch(c -> c.is(NAMESPACE))) {
            return Optional.of(ImportShape.reExport(module, depth, List.of(ImportTarget.WILDCARD), false));
        }
        log.debug("Unrecognized re-export form at {}", node.span());
        return Optional.empty();
    }

    private static ImportTarget specifierTarget(SyntaxNode specifier) {
        var name = specifier.field(FIELD_NAME).map(SyntaxNode::text).orElse(specifier.text());
        var alias = specifier.field(FIELD_ALIAS).map(SyntaxNode::text);
        return alias.isPresent() ? ImportTarget.aliased(name, alias.get()) : ImportTarget.of(name);
    }

    private Optional<ImportShape> readCall(SyntaxNode call, boolean foldLiterals) {
        var function = call.field(FIELD_FUNCTION);
        if (function.isEmpty()) {
            return Optional.empty();
        }
        boolean require = function.get().is(IDENTIFIER) && REQUIRE.equals(function.get().text());
        if (!require && !function.get().is(IMPORT)) {
            return Optional.empty();
        }

        var arg = call.field(FIELD_ARGUMENTS).flatMap(args -> args.namedChildren().stream()
                .filter(a -> !a.is(COMMENT))
                .findFirst());
        var bindings = bindingsOf(call);
        var value = arg.flatMap(JavaScriptStrings::literalValue);
        if (value.isEmpty() && foldLiterals) {
            value = arg.flatMap(JavaScriptStrings::fold);
        }
        if (value.isEmpty() || value.get().isBlank()) {
            return Optional.of(ImportShape.dynamic(bindings.targets()));
        }
        var module = value.get();
        var targets = bindings.targets().isEmpty() ? List.of(ImportTarget.of(module)) : bindings.targets();
        return Optional.of(ImportShape.of(module, relativeDepth(module), targets, bindings.aliased()));
    }

    /**
     * Names bound by {@code const x = require(...)} or {@code const {a, b: c} = await import(...)}; none if the call
     * is not the initializer of a declarator.
     */
    private static Bindings bindingsOf(SyntaxNode call) {
        var value = call;
        var parent = call.parent();
        while (parent.isPresent() && (parent.get().is(AWAIT_EXPRESSION) || parent.get().is(PARENTHESIZED_EXPRESSION))) {
            value = parent.get();
            parent = value.parent();
        }
        if (parent.isEmpty() || !parent.get().is(VARIABLE_DECLARATOR)) {
            return Bindings.NONE;
        }
        var declarator = parent.get();
        var initializer = declarator.field(FIELD_VALUE);
        if (initializer.isEmpty() || !initializer.get().span().equals(value.span())) {
            return Bindings.NONE;
        }
        var name = declarator.field(FIELD_NAME);
        if (name.isEmpty()) {
            return Bindings.NONE;
        }
        if (name.get().is(IDENTIFIER)) {
            return new Bindings(List.of(ImportTarget.aliased(NAMESPACE, name.get().text())), false);
        }
        if (!name.get().is(OBJECT_PATTERN)) {
            return Bindings.NONE;
        }
        var targets = new ArrayList<ImportTarget>();
        boolean aliased = false;
        for (var property : name.get().namedChildren()) {
            if (property.is(SHORTHAND_PROPERTY_IDENTIFIER_PATTERN)) {
                targets.add(ImportTarget.of(property.text()));
            } else if (property.is(PAIR_PATTERN)) {
                var key = property.field(FIELD_KEY).map(SyntaxNode::text);
                var local = property.field(FIELD_VALUE).filter(v -> v.is(IDENTIFIER)).map(SyntaxNode::text);
                if (key.isPresent() && local.isPresent()) {
                    targets.add(ImportTarget.aliased(key.get(), local.get()));
                    aliased = true;
                }
            }
        }
        return new Bindings(targets, aliased);
    }

    /** {@code ./x} is 1, {@code ../x} is 2 and each further {@code ../} adds one; bare specifiers are 0. */
    static int relativeDepth(String module) {
        if (!(module.equals(".") || module.equals("..") || module.startsWith("./") || module.startsWith("../"))) {
            return 0;
        }
        int depth = 1;
        int i = module.startsWith("./") ? 2 : 0;
        while (module.startsWith("../", i)) {
            depth++;
            i += 3;
        }
        if (module.substring(i).equals("..")) {
            depth++;
        }
        return depth;
    }
}
