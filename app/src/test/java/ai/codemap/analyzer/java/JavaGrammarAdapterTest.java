package ai.codemap.analyzer.java;

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

public class JavaGrammarAdapterTest {
    private static final String SOURCE = """
            package com.acme.app;

            import java.util.List;
            import com.acme.util.Strings;
            import static com.acme.util.Checks.requireValid;
            import com.acme.model.*;

            /**
             * Entry point.
             */
            @Deprecated
            public class App extends BaseApp implements Runnable, AutoCloseable {
                private final Runnable task = () -> System.out.println("hi");

                public App() {
                }

                @Override
                public void run() {
                }

                public static App create() {
                    return new App();
                }

                public void close() {}

                interface Listener {
                    void onEvent(String e);
                }

                record Point(int x, int y) {
                    Point {
                    }
                }
            }
            """;

    private static FileMap map;

    @BeforeAll
    static void analyze() {
        var analyzer = new FileAnalyzer(new JavaGrammarAdapter(CodeMapConfig.defaults()), true);
        map = analyzer.analyze("src/main/java/com/acme/app/App.java", SOURCE);
        assertFalse(map.isUnparseable(), () -> map.parseDiagnostics().toString());
    }

    @Test
    void classifiesDeclarations() {
        assertEquals(
                List.of(
                        SymbolKind.CLASS,
                        SymbolKind.LAMBDA,
                        SymbolKind.CONSTRUCTOR,
                        SymbolKind.METHOD,
                        SymbolKind.STATIC_METHOD,
                        SymbolKind.METHOD,
                        SymbolKind.CLASS,
                        SymbolKind.METHOD,
                        SymbolKind.CLASS,
                        SymbolKind.CONSTRUCTOR),
                map.symbols().stream().map(SymbolRecord::kind).toList());

        var app = map.symbol(0);
        assertEquals("App", app.name());
        assertEquals(List.of("BaseApp", "Runnable", "AutoCloseable"), app.bases());
        assertEquals("Entry point.", app.docComment());
        assertEquals(List.of("@Deprecated"), app.decorators());
        assertTrue(app.has(SymbolModifier.DECORATED));

        assertEquals(0, map.symbol(1).enclosingScope());
        assertEquals(List.of("@Override"), map.symbol(3).decorators());
        assertTrue(map.symbol(4).has(SymbolModifier.STATIC));
        assertEquals("void onEvent(String e)", map.symbol(7).signature());
        assertEquals(6, map.symbol(7).enclosingScope());
        assertEquals(8, map.symbol(9).enclosingScope());
    }

    @Test
    void readsImports() {
        assertEquals(
                List.of(ImportKind.DIRECT, ImportKind.DIRECT, ImportKind.DIRECT, ImportKind.WILDCARD),
                map.imports().stream().map(ImportRecord::kind).toList());
        assertEquals(List.of(ImportTarget.of("List")), map.imports().get(0).targets());
        assertEquals("java.util.List", map.imports().get(0).resolvedModule());

        var staticImport = map.imports().get(2);
        assertEquals("com.acme.util.Checks", staticImport.resolvedModule());
        assertEquals(List.of(ImportTarget.of("requireValid")), staticImport.targets());

        assertEquals("com.acme.model", map.imports().get(3).resolvedModule());
        assertTrue(map.imports().stream().allMatch(i -> i.relativeDepth() == 0 && i.scope() == null));
    }

    @Test
    void layoutTriesOuterTypes() {
        var layout = new JavaModuleLayout(Set.of("org.slf4j"));
        assertEquals(
                List.of("com/acme/Outer/Inner.java", "com/acme/Outer.java", "com/acme.java", "com.java"),
                layout.candidatePaths("App.java", "com.acme.Outer.Inner", false));
        assertTrue(layout.isStandardLibrary("java.util.List"));
        assertTrue(layout.isStandardLibrary("javax.annotation.Nullable"));
        assertTrue(layout.isStandardLibrary("org.slf4j.Logger"));
        assertFalse(layout.isStandardLibrary("com.acme.util.Strings"));
    }
}
