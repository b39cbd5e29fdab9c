package ai.codemap.analyzer.javascript;

import static ai.codemap.analyzer.javascript.JavaScriptTreeSitterNodeTypes.*;

import ai.codemap.analyzer.DocComments;
import ai.codemap.analyzer.syntax.ImportShapeReader;
import ai.codemap.analyzer.syntax.ModuleLayout;
import ai.codemap.analyzer.syntax.SyntaxNode;
import ai.codemap.analyzer.syntax.SyntaxProfile;
import ai.codemap.analyzer.treesitter.TreeSitterGrammarAdapter;
import ai.codemap.config.CodeMapConfig;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;

public final class JavaScriptGrammarAdapter extends TreeSitterGrammarAdapter {

    public static final String LANGUAGE_ID = "javascript";

    static final SyntaxProfile JS_SYNTAX_PROFILE = SyntaxProfile.builder()
            .classKinds(Set.of(CLASS_DECLARATION, CLASS))
            .anonymousClassKinds(Set.of(CLASS))
            .functionKinds(Set.of(FUNCTION_DECLARATION, GENERATOR_FUNCTION_DECLARATION, METHOD_DEFINITION))
            .lambdaKinds(Set.of(ARROW_FUNCTION, FUNCTION_EXPRESSION, GENERATOR_FUNCTION))
            .constructorNames(Set.of("constructor"))
            .decoratorKinds(Set.of(DECORATOR))
            .declarationWrapperKinds(Set.of(EXPORT_STATEMENT))
            .staticKeywords(Set.of("static"))
            .asyncKeyword("async")
            .generatorMarkers(Set.of("*"))
            .suspensionKinds(Set.of(YIELD_EXPRESSION))
            .importKinds(Set.of(IMPORT_STATEMENT, EXPORT_STATEMENT))
            .callKinds(Set.of(CALL_EXPRESSION))
            .guardKinds(Set.of(TRY_STATEMENT, IF_STATEMENT, TERNARY_EXPRESSION, SWITCH_STATEMENT))
            .commentKinds(Set.of(COMMENT))
            .docCommentPrefix("/**")
            .build();

    private final JavaScriptImportShapeReader importReader = new JavaScriptImportShapeReader();
    private final JavaScriptModuleLayout moduleLayout;

    public JavaScriptGrammarAdapter(CodeMapConfig config) {
        super(JS_SYNTAX_PROFILE, config.maxFileBytes());
        this.moduleLayout = new JavaScriptModuleLayout(config.extraStandardLibraryModules(LANGUAGE_ID));
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterJavascript();
    }

    @Override
    public String languageId() {
        return LANGUAGE_ID;
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of("js", "mjs", "cjs", "jsx");
    }

    @Override
    public ImportShapeReader importReader() {
        return importReader;
    }

    @Override
    public ModuleLayout moduleLayout() {
        return moduleLayout;
    }

    @Override
    public List<String> readBases(SyntaxNode classNode) {
        return classNode.firstChildOfKind(CLASS_HERITAGE)
                .flatMap(SyntaxNode::firstNamedChild)
                .map(base -> List.of(base.text().strip()))
                .orElse(List.of());
    }

    @Override
    public Optional<String> readDocComment(SyntaxNode declaration) {
        return DocComments.leadingDocComment(declaration, syntaxProfile());
    }
}
