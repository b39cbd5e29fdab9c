package ai.codemap.analyzer.javascript;

import static org.junit.jupiter.api.Assertions.*;

import ai.codemap.analyzer.FileAnalyzer;
import ai.codemap.analyzer.FileMap;
import ai.codemap.analyzer.ImportKind;
import ai.codemap.analyzer.ImportRecord;
import ai.codemap.analyzer.ImportTarget;
import ai.codemap.analyzer.SymbolKind;
import ai.codemap.analyzer.SymbolModifier;
import ai.codemap.analyzer.SymbolRecord;
import ai.codemap.config.CodeMapConfig;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class JavaScriptGrammarAdapterTest {
    private static final String SOURCE = """
            import React from 'react';
            import { readFile, writeFile as wf } from 'fs';
            import * as utils from './utils.js';
            import './polyfill';
            export * from '../shared/index.js';
            export { a, b } from 'lib';
            const path = require('path');
            const { join, resolve: res } = require('./paths');
            const lazy = import('./lazy.js');
            const dyn = require(name);

            /** Renders widgets. */
            export class Widget extends Base {
              constructor() { super(); }
              static create() { return new Widget(); }
              async *stream() { yield 1; }
              render = () => 1;
            }

            function* gen() { yield 2; }

            async function load() {
              if (ready) {
                const m = await import('./cond.js');
              }
            }
            """;

    private static FileMap map;

    @BeforeAll
    static void analyze() {
        var analyzer = new FileAnalyzer(new JavaScriptGrammarAdapter(CodeMapConfig.defaults()), true);
        map = analyzer.analyze("src/app.js", SOURCE);
        assertFalse(map.isUnparseable(), () -> map.parseDiagnostics().toString());
    }

    @Test
    void classifiesDeclarations() {
        assertEquals(
                List.of(
                        SymbolKind.CLASS,
                        SymbolKind.CONSTRUCTOR,
                        SymbolKind.STATIC_METHOD,
                        SymbolKind.METHOD,
                        SymbolKind.LAMBDA,
                        SymbolKind.FUNCTION,
                        SymbolKind.FUNCTION),
                map.symbols().stream().map(SymbolRecord::kind).toList());

        var widget = map.symbol(0);
        assertEquals("Widget", widget.name());
        assertEquals(List.of("Base"), widget.bases());
        assertEquals("Renders widgets.", widget.docComment());

        assertEquals(Set.of(SymbolModifier.STATIC), map.symbol(2).modifiers());
        assertEquals(Set.of(SymbolModifier.ASYNC, SymbolModifier.GENERATOR), map.symbol(3).modifiers());
        assertEquals(0, map.symbol(4).enclosingScope());
        assertTrue(map.symbol(4).name().startsWith("<lambda>@"));
        assertEquals("gen", map.symbol(5).name());
        assertTrue(map.symbol(5).has(SymbolModifier.GENERATOR));
        assertEquals(Set.of(SymbolModifier.ASYNC), map.symbol(6).modifiers());
    }

    @Test
    void classifiesImportsAndReExports() {
        assertEquals(
                List.of(
                        ImportKind.DIRECT,
                        ImportKind.ALIASED,
                        ImportKind.RELATIVE,
                        ImportKind.RELATIVE,
                        ImportKind.WILDCARD,
                        ImportKind.SELECTIVE_MULTIPLE,
                        ImportKind.DIRECT,
                        ImportKind.RELATIVE,
                        ImportKind.RELATIVE,
                        ImportKind.DYNAMIC,
                        ImportKind.CONDITIONAL),
                map.imports().stream().map(ImportRecord::kind).toList());
    }

    @Test
    void readsTargetsAndModules() {
        var imports = map.imports();
        assertEquals(List.of(ImportTarget.aliased("default", "React")), imports.get(0).targets());
        assertEquals(
                List.of(ImportTarget.of("readFile"), ImportTarget.aliased("writeFile", "wf")),
                imports.get(1).targets());

        var utils = imports.get(2);
        assertEquals(1, utils.relativeDepth());
        assertEquals("src/utils.js", utils.resolvedModule());
        assertEquals(List.of(ImportTarget.aliased("*", "utils")), utils.targets());

        assertEquals(List.of(ImportTarget.of("./polyfill")), imports.get(3).targets());

        var reExport = imports.get(4);
        assertEquals("../shared/index.js", reExport.resolvedModule());
        assertEquals(2, reExport.relativeDepth());

        assertEquals(List.of(ImportTarget.aliased("*", "path")), imports.get(6).targets());
        assertEquals(
                List.of(ImportTarget.of("join"), ImportTarget.aliased("resolve", "res")),
                imports.get(7).targets());
        assertEquals("src/paths", imports.get(7).resolvedModule());

        var dynamic = imports.get(9);
        assertTrue(dynamic.isUnresolved());

        var conditional = imports.get(10);
        assertTrue(conditional.guarded());
        assertEquals("src/cond.js", conditional.resolvedModule());
        assertEquals("load", map.scopeOf(conditional).orElseThrow().name());
    }

    @Test
    void relativeDepthCountsParentSteps() {
        assertEquals(0, JavaScriptImportShapeReader.relativeDepth("lodash"));
        assertEquals(0, JavaScriptImportShapeReader.relativeDepth(".hidden"));
        assertEquals(1, JavaScriptImportShapeReader.relativeDepth("./x"));
        assertEquals(1, JavaScriptImportShapeReader.relativeDepth("."));
        assertEquals(2, JavaScriptImportShapeReader.relativeDepth("../x"));
        assertEquals(2, JavaScriptImportShapeReader.relativeDepth(".."));
        assertEquals(3, JavaScriptImportShapeReader.relativeDepth("../../x"));
    }

    @Test
    void relativeGroupedReExportKeepsDepth() {
        var analyzer = new FileAnalyzer(new JavaScriptGrammarAdapter(CodeMapConfig.defaults()), true);
        var imports = analyzer.analyze("src/index.js", "export { a, b } from './x';\nexport { c } from './y';\n").imports();

        var grouped = imports.get(0);
        assertEquals(ImportKind.SELECTIVE_MULTIPLE, grouped.kind());
        assertEquals(List.of(ImportTarget.of("a"), ImportTarget.of("b")), grouped.targets());
        assertEquals(1, grouped.relativeDepth());
        assertEquals("src/x", grouped.resolvedModule());

        assertEquals(ImportKind.RELATIVE, imports.get(1).kind());
    }

    @Test
    void foldsConcatenatedRequire() {
        var analyzer = new FileAnalyzer(new JavaScriptGrammarAdapter(CodeMapConfig.defaults()), true);
        var record = analyzer.analyze("a.js", "require('./lib/' + 'x');\n").imports().get(0);
        assertEquals(ImportKind.RELATIVE, record.kind());
        assertEquals("lib/x", record.resolvedModule());

        var template = analyzer.analyze("a.js", "require(`./t${n}`);\n").imports().get(0);
        assertEquals(ImportKind.DYNAMIC, template.kind());
    }
}
