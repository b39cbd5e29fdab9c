package ai.codemap.analyzer.python;

import static ai.codemap.analyzer.python.PythonTreeSitterNodeTypes.*;

import ai.codemap.analyzer.ImportTarget;
import ai.codemap.analyzer.syntax.ImportShape;
import ai.codemap.analyzer.syntax.ImportShapeReader;
import ai.codemap.analyzer.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads {@code import a.b as c}, {@code from ..pkg import x, y as z}, {@code from m import *},
 * {@code from __future__ import ...} and the dynamic forms {@code importlib.import_module(...)} and
 * {@code __import__(...)}.
 *
 * <p>{@code import a, b} yields one shape per module, since each names a different module. The other forms yield
 * one shape per statement.
 */
final class PythonImportShapeReader implements ImportShapeReader {
    private static final Logger log = LogManager.getLogger(PythonImportShapeReader.class);

    private static final Set<String> DYNAMIC_IMPORT_FUNCTIONS =
            Set.of("__import__", "import_module", "importlib.import_module");

    @Override
    public List<ImportShape> read(SyntaxNode node, boolean foldLiterals) {
        switch (node.kind()) {
            case IMPORT_STATEMENT:
                return readImport(node);
            case IMPORT_FROM_STATEMENT:
            case FUTURE_IMPORT_STATEMENT:
                return readFromImport(node).map(List::of).orElse(List.of());
            case CALL:
                return readDynamicImport(node, foldLiterals).map(List::of).orElse(List.of());
            default:
                return List.of();
        }
    }

    private List<ImportShape> readImport(SyntaxNode node) {
        var shapes = new ArrayList<ImportShape>();
        for (var name : node.fieldChildren(FIELD_NAME)) {
            if (name.is(ALIASED_IMPORT)) {
                var module = name.field(FIELD_NAME).map(SyntaxNode::text);
                var alias = name.field(FIELD_ALIAS).map(SyntaxNode::text);
                if (module.isPresent()) {
                    shapes.add(ImportShape.of(
                            module.get(), 0, List.of(ImportTarget.aliased(module.get(), alias.orElse(null))), true));
                }
            } else if (name.is(DOTTED_NAME)) {
                shapes.add(ImportShape.of(name.text(), 0, List.of(ImportTarget.of(name.text())), false));
            }
        }
        return shapes;
    }

    private Optional<ImportShape> readFromImport(SyntaxNode node) {
        String module;
        int depth = 0;
        if (node.is(FUTURE_IMPORT_STATEMENT)) {
            module = "__future__";
        } else {
            var moduleNode = node.field(FIELD_MODULE_NAME);
            if (moduleNode.isEmpty()) {
                log.debug("from-import without module name at {}", node.span());
                return Optional.empty();
            }
            module = moduleNode.get().text().strip();
            if (moduleNode.get().is(RELATIVE_IMPORT)) {
                depth = moduleNode.get()
                        .firstChildOfKind(IMPORT_PREFIX)
                        .map(prefix -> (int) prefix.text().chars().filter(c -> c == '.').count())
                        .orElse(0);
            }
        }

        if (node.children().stream().anyMatch(c -> c.is(WILDCARD_IMPORT))) {
            return Optional.of(ImportShape.of(module, depth, List.of(ImportTarget.WILDCARD), false));
        }

        var targets = new ArrayList<ImportTarget>();
        boolean aliased = false;
        for (var name : node.fieldChildren(FIELD_NAME)) {
            if (name.is(ALIASED_IMPORT)) {
                var imported = name.field(FIELD_NAME).map(SyntaxNode::text).orElse(name.text());
                var alias = name.field(FIELD_ALIAS).map(SyntaxNode::text).orElse(null);
                targets.add(ImportTarget.aliased(imported, alias));
                aliased = true;
            } else {
                targets.add(ImportTarget.of(name.text()));
            }
        }
        if (targets.isEmpty()) {
            log.debug("from-import of {} without names at {}", module, node.span());
            return Optional.empty();
        }
        return Optional.of(ImportShape.of(module, depth, targets, aliased));
    }

    private Optional<ImportShape> readDynamicImport(SyntaxNode call, boolean foldLiterals) {
        var function = call.field(FIELD_FUNCTION).map(f -> f.text().replace(" ", ""));
        if (function.isEmpty() || !DYNAMIC_IMPORT_FUNCTIONS.contains(function.get())) {
            return Optional.empty();
        }
        var firstArg = call.field(FIELD_ARGUMENTS)
                .filter(args -> args.is(ARGUMENT_LIST))
                .flatMap(args -> args.namedChildren().stream()
                        .filter(a -> !a.is(COMMENT))
                        .findFirst());
        if (firstArg.isEmpty() || firstArg.get().is(KEYWORD_ARGUMENT)) {
            return Optional.of(ImportShape.dynamic(List.of()));
        }

        var arg = firstArg.get();
        var value = arg.is(STRING) ? PythonStrings.literalValue(arg) : Optional.<String>empty();
        if (value.isEmpty() && foldLiterals) {
            value = PythonStrings.fold(arg);
        }
        if (value.isEmpty() || value.get().isBlank()) {
            return Optional.of(ImportShape.dynamic(List.of()));
        }
        var module = value.get().strip();
        int depth = 0;
        while (depth < module.length() && module.charAt(depth) == '.') {
            depth++;
        }
        return Optional.of(ImportShape.of(module, depth, List.of(ImportTarget.of(module.substring(depth))), false));
    }
}
