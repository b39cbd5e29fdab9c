package ai.codemap.analyzer.python;

import static org.junit.jupiter.api.Assertions.*;

import ai.codemap.analyzer.DiagnosticKind;
import ai.codemap.analyzer.FileAnalyzer;
import ai.codemap.analyzer.FileMap;
import ai.codemap.analyzer.ImportKind;
import ai.codemap.analyzer.ImportRecord;
import ai.codemap.analyzer.ImportTarget;
import ai.codemap.config.CodeMapConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

public class PythonImportResolutionTest {
    private final PythonGrammarAdapter adapter = new PythonGrammarAdapter(CodeMapConfig.defaults());
    private final FileAnalyzer analyzer = new FileAnalyzer(adapter, true);

    private static List<ImportKind> kinds(FileMap map) {
        return map.imports().stream().map(ImportRecord::kind).toList();
    }

    @Test
    void classifiesTheFiveImportShapes() {
        var map = analyzer.analyze("app/pkg/mod.py", """
                from .sub import x
                from ..parent import y
                import z as zz
                from pkg import *

                try:
                    import opt
                except ImportError:
                    opt = None
                """);

        assertEquals(
                List.of(
                        ImportKind.RELATIVE,
                        ImportKind.RELATIVE,
                        ImportKind.ALIASED,
                        ImportKind.WILDCARD,
                        ImportKind.CONDITIONAL),
                kinds(map));

        var sub = map.imports().get(0);
        assertEquals(1, sub.relativeDepth());
        assertEquals(".sub", sub.writtenModule());
        assertEquals("app.pkg.sub", sub.resolvedModule());
        assertEquals(List.of(ImportTarget.of("x")), sub.targets());

        var parent = map.imports().get(1);
        assertEquals(2, parent.relativeDepth());
        assertEquals("app.parent", parent.resolvedModule());

        assertEquals(List.of(ImportTarget.aliased("z", "zz")), map.imports().get(2).targets());

        var wildcard = map.imports().get(3);
        assertEquals(List.of(ImportTarget.WILDCARD), wildcard.targets());
        assertEquals("pkg", wildcard.resolvedModule());

        var guarded = map.imports().get(4);
        assertTrue(guarded.guarded());
        assertEquals("opt", guarded.resolvedModule());
        assertFalse(map.imports().subList(0, 4).stream().anyMatch(ImportRecord::guarded));
    }

    @Test
    void attributesImportsToEnclosingScope() {
        var map = analyzer.analyze("tool.py", """
                import os

                def load():
                    import json
                    return json

                if __name__ == "__main__":
                    import sys
                """);

        assertEquals(3, map.imports().size());
        assertNull(map.imports().get(0).scope());
        assertEquals("load", map.scopeOf(map.imports().get(1)).orElseThrow().name());
        var main = map.imports().get(2);
        assertNull(main.scope());
        assertTrue(main.guarded());
        assertEquals(ImportKind.CONDITIONAL, main.kind());
    }

    @Test
    void splitsMultiModuleImportStatements() {
        var map = analyzer.analyze("m.py", "import a.b, c as d\n");
        assertEquals(List.of(ImportKind.DIRECT, ImportKind.ALIASED), kinds(map));
        assertEquals("a.b", map.imports().get(0).resolvedModule());
        assertEquals(List.of(ImportTarget.aliased("c", "d")), map.imports().get(1).targets());
    }

    @Test
    void groupedFromImports() {
        var map = analyzer.analyze("m.py", """
                from pkg import a, b
                from pkg import c, d as e
                from __future__ import annotations
                """);
        assertEquals(List.of(ImportKind.SELECTIVE_MULTIPLE, ImportKind.ALIASED, ImportKind.DIRECT), kinds(map));
        assertEquals(2, map.imports().get(0).targets().size());
        assertEquals("__future__", map.imports().get(2).resolvedModule());
    }

    @Test
    void computedImportsAreUnresolved() {
        var map = analyzer.analyze("plugins.py", """
                import importlib

                def load(name):
                    return importlib.import_module("plugins." + name)

                mod = __import__(name)
                """);

        var dynamic = map.imports().stream().filter(i -> i.kind() == ImportKind.DYNAMIC).toList();
        assertEquals(2, dynamic.size());
        for (var record : dynamic) {
            assertTrue(record.isUnresolved());
            assertEquals(ImportRecord.UNRESOLVED, record.writtenModule());
            assertTrue(map.parseDiagnostics().isEmpty());
        }
        assertEquals("load", map.scopeOf(dynamic.get(0)).orElseThrow().name());
    }

    @Test
    void literalDynamicImportsFoldUnlessDisabled() {
        var source = "mod = importlib.import_module(\"a\" + \".b\")\n";

        var folded = analyzer.analyze("m.py", source).imports().get(0);
        assertEquals(ImportKind.DIRECT, folded.kind());
        assertEquals("a.b", folded.resolvedModule());

        var literal = analyzer.analyze("m.py", "mod = importlib.import_module('c')\n").imports().get(0);
        assertEquals("c", literal.resolvedModule());

        var strict = new FileAnalyzer(adapter, false).analyze("m.py", source).imports().get(0);
        assertEquals(ImportKind.DYNAMIC, strict.kind());
        assertTrue(strict.isUnresolved());
    }

    @Test
    void relativeImportAboveRootKeepsWrittenForm() {
        var map = analyzer.analyze("top.py", "from .. import x\n");
        var record = map.imports().get(0);
        assertEquals(ImportKind.RELATIVE, record.kind());
        assertEquals("..", record.resolvedModule());
        assertEquals(1, map.diagnosticsOfKind(DiagnosticKind.IMPORT_ANOMALY).size());
    }

    @Test
    void packageRelativeImport() {
        var record = analyzer.analyze("app/pkg/mod.py", "from . import helpers\n").imports().get(0);
        assertEquals(1, record.relativeDepth());
        assertEquals("app.pkg", record.resolvedModule());
        assertEquals(List.of(ImportTarget.of("helpers")), record.targets());
    }

    @Test
    void wildcardKeepsWrittenModule() {
        var record = analyzer.analyze("app/pkg/mod.py", "from .shapes import *\n").imports().get(0);
        assertEquals(ImportKind.WILDCARD, record.kind());
        assertEquals(".shapes", record.resolvedModule());
        assertEquals(1, record.targets().size());
    }
}
