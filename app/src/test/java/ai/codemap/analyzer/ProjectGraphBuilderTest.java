package ai.codemap.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.codemap.analyzer.resolve.ModuleResolution;
import ai.codemap.analyzer.resolve.ModuleResolver;
import ai.codemap.config.CodeMapConfig;
import ai.codemap.resolve.IndexedModuleResolver;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

public class ProjectGraphBuilderTest {
    private static final CodeMapConfig CONFIG = CodeMapConfig.defaults();
    private final Languages languages = Languages.defaults(CONFIG);
    private final FileAnalyzer python = new FileAnalyzer(languages.byId("python").orElseThrow(), true);

    private ProjectGraphBuilder builderWithProject() {
        var builder = new ProjectGraphBuilder(languages);
        // the importing file arrives before the files it imports
        builder.add(python.analyze("app/main.py", """
                from .models import User
                import app.util
                import os
                import requests
                mod = __import__(name)
                """));
        builder.add(python.analyze("app/models.py", """
                from .main import run
                from .util import *
                """));
        builder.add(python.analyze("app/util/__init__.py", "X = 1\n"));
        return builder;
    }

    @Test
    void everyImportBecomesOneEdge() {
        var builder = builderWithProject();
        var graph = builder.build(new IndexedModuleResolver(builder.knownFiles())).join();

        var fromMain = graph.edgesFrom("app/main.py");
        assertEquals(
                List.of(
                        EdgeStatus.RESOLVED,
                        EdgeStatus.RESOLVED,
                        EdgeStatus.STANDARD_LIBRARY,
                        EdgeStatus.NOT_FOUND,
                        EdgeStatus.UNRESOLVED),
                fromMain.stream().map(DependencyEdge::status).toList());
        assertEquals("app/models.py", fromMain.get(0).target());
        assertEquals("app/util/__init__.py", fromMain.get(1).target());
        for (var edge : fromMain.subList(2, 5)) {
            assertEquals(ProjectGraph.UNKNOWN_NODE, edge.target());
        }
        assertEquals(7, graph.edges().size());
    }

    @Test
    void cyclesAndRelativeWildcardsResolve() {
        var builder = builderWithProject();
        var graph = builder.build(new IndexedModuleResolver(builder.knownFiles())).join();

        assertTrue(graph.dependenciesOf("app/main.py").contains("app/models.py"));
        assertTrue(graph.dependenciesOf("app/models.py").contains("app/main.py"));
        var wildcard = graph.edgesFrom("app/models.py").get(1);
        assertEquals(ImportKind.WILDCARD, wildcard.importRecord().kind());
        assertEquals("app/util/__init__.py", wildcard.target());
        assertEquals(List.of("app/main.py", "app/models.py", "app/util/__init__.py"), List.copyOf(graph.files().keySet()));
    }

    @Test
    void guardedRelativeWildcardLinksToItsModule() {
        var builder = new ProjectGraphBuilder(languages);
        builder.add(python.analyze("pkg/a.py", """
                try:
                    from .compat import *
                except ImportError:
                    pass
                """));
        builder.add(python.analyze("pkg/compat.py", "X = 1\n"));
        var graph = builder.build(new IndexedModuleResolver(builder.knownFiles())).join();

        var edge = graph.edgesFrom("pkg/a.py").get(0);
        assertEquals(ImportKind.CONDITIONAL, edge.importRecord().kind());
        assertTrue(edge.importRecord().guarded());
        assertEquals(".compat", edge.importRecord().writtenModule());
        assertEquals(EdgeStatus.RESOLVED, edge.status());
        assertEquals("pkg/compat.py", edge.target());
    }

    @Test
    void resolverFailuresBecomeEdges() {
        var builder = new ProjectGraphBuilder(languages);
        builder.add(python.analyze("a.py", "import one\nimport two\nimport three\nimport four\n"));

        ModuleResolver resolver = (from, reference) -> {
            switch (reference.module()) {
                case "one":
                    throw new IllegalStateException("resolver bug");
                case "two":
                    return CompletableFuture.failedFuture(new RuntimeException("lookup timed out"));
                case "four":
                    return null;
                default:
                    return CompletableFuture.completedFuture(ModuleResolution.failed("permission denied"));
            }
        };
        var graph = builder.build(resolver).join();

        assertEquals(4, graph.edges().size());
        assertTrue(graph.edges().stream().allMatch(e -> e.status() == EdgeStatus.RESOLUTION_FAILED));
    }

    @Test
    void laterAddReplacesEarlierMap() {
        var builder = new ProjectGraphBuilder(languages);
        builder.add(python.analyze("a.py", "import x\n"));
        builder.add(python.analyze("a.py", "import x\nimport y\n"));
        assertEquals(1, builder.size());
        var graph = builder.build(new IndexedModuleResolver(builder.knownFiles())).join();
        assertEquals(2, graph.edgesFrom("a.py").size());
    }

    @Test
    void unparseableFilesStayInGraph() {
        var builder = new ProjectGraphBuilder(languages);
        builder.add(python.analyze("bin.py", "\u0000\u0001"));
        var graph = builder.build(new IndexedModuleResolver(builder.knownFiles())).join();
        assertTrue(graph.fileMap("bin.py").orElseThrow().isUnparseable());
        assertTrue(graph.edges().isEmpty());
    }
}
