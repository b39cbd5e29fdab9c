package ai.codemap.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ModelInvariantsTest {

    private static SourceSpan span(int startByte, int endByte) {
        return new SourceSpan(1, startByte + 1, 1, endByte + 1, startByte, endByte);
    }

    private static SymbolRecord symbol(int id, String name, SymbolKind kind, Integer enclosing, SourceSpan span) {
        return new SymbolRecord(id, name, kind, Set.of(), enclosing, List.of(), null, name, List.of(), span);
    }

    private static ImportRecord directImport(String module) {
        return new ImportRecord(
                "import " + module,
                ImportKind.DIRECT,
                List.of(ImportTarget.of(module)),
                module,
                module,
                0,
                null,
                false,
                span(0, 7 + module.length()));
    }

    @Test
    void spanContainmentIsInclusive() {
        var outer = span(0, 100);
        assertTrue(outer.contains(span(0, 100)));
        assertTrue(outer.contains(span(10, 20)));
        assertFalse(outer.contains(span(90, 101)));
        assertEquals(100, outer.length());
        assertTrue(span(5, 6).compareTo(span(5, 9)) < 0);
    }

    @Test
    void spanRejectsZeroBasedLines() {
        assertThrows(IllegalArgumentException.class, () -> new SourceSpan(0, 1, 1, 1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new SourceSpan(1, 1, 1, 1, 5, 4));
    }

    @Test
    void enclosingScopeMustPrecedeRecord() {
        assertThrows(IllegalArgumentException.class, () -> symbol(1, "m", SymbolKind.METHOD, 1, span(0, 1)));
        assertThrows(IllegalArgumentException.class, () -> symbol(1, "m", SymbolKind.METHOD, 3, span(0, 1)));
        var ok = symbol(1, "m", SymbolKind.METHOD, 0, span(0, 1));
        assertFalse(ok.isTopLevel());
    }

    @Test
    void modifiersAreImmutable() {
        var record = new SymbolRecord(
                0,
                "f",
                SymbolKind.FUNCTION,
                Set.of(SymbolModifier.GENERATOR, SymbolModifier.ASYNC),
                null,
                List.of(),
                null,
                "async def f()",
                List.of(),
                span(0, 10));
        assertTrue(record.has(SymbolModifier.ASYNC));
        assertTrue(record.has(SymbolModifier.GENERATOR));
        assertEquals(List.of(SymbolModifier.ASYNC, SymbolModifier.GENERATOR), List.copyOf(record.modifiers()));
        assertThrows(UnsupportedOperationException.class, () -> record.modifiers().add(SymbolModifier.STATIC));
    }

    @Test
    void wildcardImportCarriesExactlyOneStarTarget() {
        var ok = new ImportRecord(
                "from pkg import *",
                ImportKind.WILDCARD,
                List.of(ImportTarget.WILDCARD),
                "pkg",
                "pkg",
                0,
                null,
                false,
                span(0, 17));
        assertTrue(ok.isWildcard());

        assertThrows(
                IllegalArgumentException.class,
                () -> new ImportRecord(
                        "from pkg import *",
                        ImportKind.WILDCARD,
                        List.of(ImportTarget.WILDCARD, ImportTarget.of("x")),
                        "pkg",
                        "pkg",
                        0,
                        null,
                        false,
                        span(0, 17)));
        assertThrows(IllegalArgumentException.class, () -> new ImportTarget("x", null, true));
    }

    @Test
    void staticKindsNeedTargetsButDynamicDoesNot() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new ImportRecord(
                        "import x", ImportKind.DIRECT, List.of(), "x", "x", 0, null, false, span(0, 8)));

        var dynamic = new ImportRecord(
                "__import__(name)",
                ImportKind.DYNAMIC,
                List.of(),
                ImportRecord.UNRESOLVED,
                ImportRecord.UNRESOLVED,
                0,
                null,
                false,
                span(0, 16));
        assertTrue(dynamic.isUnresolved());
    }

    @Test
    void aliasedTargetBindsAlias() {
        assertEquals("np", ImportTarget.aliased("numpy", "np").boundName());
        assertEquals("os", ImportTarget.of("os").boundName());
    }

    @Test
    void fileMapSymbolIdsMatchArenaPositions() {
        var cls = symbol(0, "C", SymbolKind.CLASS, null, span(0, 50));
        var method = symbol(1, "m", SymbolKind.METHOD, 0, span(10, 40));
        var map = new FileMap("a.py", "python", List.of(cls, method), List.of(), List.of());

        assertEquals(cls, map.enclosingScopeOf(method).orElseThrow());
        assertEquals(List.of(method), map.childrenOf(cls));
        assertEquals(List.of(cls), map.topLevelSymbols());
        assertFalse(map.isUnparseable());

        var misnumbered = symbol(5, "f", SymbolKind.FUNCTION, null, span(0, 1));
        assertThrows(
                IllegalArgumentException.class,
                () -> new FileMap("b.py", "python", List.of(misnumbered), List.of(), List.of()));
    }

    @Test
    void unparseableFileMapIsEmptyWithOneDiagnostic() {
        var map = FileMap.unparseable("bin.py", "python", "binary content");
        assertTrue(map.symbols().isEmpty());
        assertTrue(map.imports().isEmpty());
        assertEquals(1, map.parseDiagnostics().size());
        assertEquals(DiagnosticKind.UNPARSEABLE_FILE, map.parseDiagnostics().get(0).kind());
        assertNull(map.parseDiagnostics().get(0).span());
        assertTrue(map.isUnparseable());
    }

    @Test
    void edgeStatusMustMatchTarget() {
        var record = directImport("os");
        assertThrows(
                IllegalArgumentException.class,
                () -> new DependencyEdge("a.py", record, "b.py", EdgeStatus.NOT_FOUND));
        assertThrows(
                IllegalArgumentException.class,
                () -> new DependencyEdge("a.py", record, ProjectGraph.UNKNOWN_NODE, EdgeStatus.RESOLVED));
        assertTrue(DependencyEdge.unknown("a.py", record, EdgeStatus.STANDARD_LIBRARY).isUnknown());
    }

    @Test
    void graphQueriesFollowEdges() {
        var a = new FileMap("a.py", "python", List.of(), List.of(directImport("b")), List.of());
        var b = new FileMap("b.py", "python", List.of(), List.of(directImport("a"), directImport("os")), List.of());
        var graph = new ProjectGraph(
                Map.of("b.py", b, "a.py", a),
                List.of(
                        DependencyEdge.resolved("a.py", a.imports().get(0), "b.py"),
                        DependencyEdge.resolved("b.py", b.imports().get(0), "a.py"),
                        DependencyEdge.unknown("b.py", b.imports().get(1), EdgeStatus.STANDARD_LIBRARY)));

        assertEquals(List.of("a.py", "b.py"), List.copyOf(graph.files().keySet()));
        assertEquals(Set.of("b.py"), graph.dependenciesOf("a.py"));
        assertEquals(Set.of("a.py"), graph.dependenciesOf("b.py"));
        assertEquals(Set.of("b.py"), graph.dependentsOf("a.py"));
        assertEquals(1, graph.unknownEdges().size());
        assertEquals(1, graph.edgesWithStatus(EdgeStatus.STANDARD_LIBRARY).size());
    }

    @Test
    void graphRejectsEdgeFromMissingFile() {
        var record = directImport("x");
        assertThrows(
                IllegalArgumentException.class,
                () -> new ProjectGraph(
                        Map.of(), List.of(DependencyEdge.unknown("ghost.py", record, EdgeStatus.NOT_FOUND))));
    }
}
