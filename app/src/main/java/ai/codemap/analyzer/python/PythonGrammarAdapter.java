package ai.codemap.analyzer.python;

import static ai.codemap.analyzer.python.PythonTreeSitterNodeTypes.*;

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
import org.treesitter.TreeSitterPython;

public final class PythonGrammarAdapter extends TreeSitterGrammarAdapter {

    public static final String LANGUAGE_ID = "python";

    static final SyntaxProfile PY_SYNTAX_PROFILE = SyntaxProfile.builder()
            .classKinds(Set.of(CLASS_DEFINITION))
            .functionKinds(Set.of(FUNCTION_DEFINITION))
            .lambdaKinds(Set.of(LAMBDA))
            .constructorNames(Set.of("__init__"))
            .decoratorKinds(Set.of(DECORATOR))
            .decoratorWrapperKinds(Set.of(DECORATED_DEFINITION))
            .asyncKeyword("async")
            .suspensionKinds(Set.of(YIELD))
            .importKinds(Set.of(IMPORT_STATEMENT, IMPORT_FROM_STATEMENT, FUTURE_IMPORT_STATEMENT))
            .callKinds(Set.of(CALL))
            .guardKinds(Set.of(TRY_STATEMENT, IF_STATEMENT, CONDITIONAL_EXPRESSION))
            .commentKinds(Set.of(COMMENT))
            .build();

    private final PythonImportShapeReader importReader = new PythonImportShapeReader();
    private final PythonModuleLayout moduleLayout;

    public PythonGrammarAdapter(CodeMapConfig config) {
        super(PY_SYNTAX_PROFILE.withMarkers(config.markerDecorators()), config.maxFileBytes());
        this.moduleLayout = new PythonModuleLayout(config.extraStandardLibraryModules(LANGUAGE_ID));
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterPython();
    }

    @Override
    public String languageId() {
        return LANGUAGE_ID;
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of("py", "pyi");
    }

    @Override
    public ImportShapeReader importReader() {
        return importReader;
    }

    @Override
    public ModuleLayout moduleLayout() {
        return moduleLayout;
    }

    /** Positional superclass expressions; keyword arguments such as {@code metaclass=} are not bases. */
    @Override
    public List<String> readBases(SyntaxNode classNode) {
        return classNode.field(FIELD_SUPERCLASSES)
                .map(args -> args.namedChildren().stream()
                        .filter(arg -> !arg.is(KEYWORD_ARGUMENT) && !arg.is(COMMENT))
                        .map(arg -> arg.text().strip())
                        .toList())
                .orElse(List.of());
    }

    /** The docstring: a string literal forming the first statement of the body. */
    @Override
    public Optional<String> readDocComment(SyntaxNode declaration) {
        return declaration.field(syntaxProfile().bodyField())
                .flatMap(body -> body.namedChildren().stream()
                        .filter(stmt -> !stmt.is(COMMENT))
                        .findFirst())
                .filter(stmt -> stmt.is(EXPRESSION_STATEMENT))
                .filter(stmt -> stmt.namedChildren().size() == 1)
                .flatMap(SyntaxNode::firstNamedChild)
                .filter(expr -> expr.is(STRING))
                .flatMap(str -> PythonStrings.literalValue(str))
                .map(DocComments::dedent)
                .filter(doc -> !doc.isEmpty());
    }
}
