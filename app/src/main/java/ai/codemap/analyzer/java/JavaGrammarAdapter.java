package ai.codemap.analyzer.java;

import static ai.codemap.analyzer.java.JavaTreeSitterNodeTypes.*;

import ai.codemap.analyzer.DocComments;
import ai.codemap.analyzer.syntax.ImportShapeReader;
import ai.codemap.analyzer.syntax.ModuleLayout;
import ai.codemap.analyzer.syntax.SyntaxNode;
import ai.codemap.analyzer.syntax.SyntaxProfile;
import ai.codemap.analyzer.treesitter.TreeSitterGrammarAdapter;
import ai.codemap.config.CodeMapConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJava;

public final class JavaGrammarAdapter extends TreeSitterGrammarAdapter {

    public static final String LANGUAGE_ID = "java";

    static final SyntaxProfile JAVA_SYNTAX_PROFILE = SyntaxProfile.builder()
            .classKinds(Set.of(
                    CLASS_DECLARATION,
                    INTERFACE_DECLARATION,
                    ENUM_DECLARATION,
                    RECORD_DECLARATION,
                    ANNOTATION_TYPE_DECLARATION))
            .functionKinds(Set.of(METHOD_DECLARATION))
            .constructorKinds(Set.of(CONSTRUCTOR_DECLARATION, COMPACT_CONSTRUCTOR_DECLARATION))
            .lambdaKinds(Set.of(LAMBDA_EXPRESSION))
            .decoratorKinds(Set.of(MARKER_ANNOTATION, ANNOTATION))
            .modifiersKind(MODIFIERS)
            .staticKeywords(Set.of(STATIC))
            .importKinds(Set.of(IMPORT_DECLARATION))
            .commentKinds(Set.of(BLOCK_COMMENT, LINE_COMMENT))
            .docCommentPrefix("/**")
            .build();

    private final JavaImportShapeReader importReader = new JavaImportShapeReader();
    private final JavaModuleLayout moduleLayout;

    public JavaGrammarAdapter(CodeMapConfig config) {
        super(JAVA_SYNTAX_PROFILE, config.maxFileBytes());
        this.moduleLayout = new JavaModuleLayout(config.extraStandardLibraryModules(LANGUAGE_ID));
    }

    @Override
    protected TSLanguage createTSLanguage() {
        return new TreeSitterJava();
    }

    @Override
    public String languageId() {
        return LANGUAGE_ID;
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of("java");
    }

    @Override
    public ImportShapeReader importReader() {
        return importReader;
    }

    @Override
    public ModuleLayout moduleLayout() {
        return moduleLayout;
    }

    /** Superclass first, then implemented or extended interfaces, as written. */
    @Override
    public List<String> readBases(SyntaxNode classNode) {
        var bases = new ArrayList<String>();
        for (var child : classNode.children()) {
            if (child.is(SUPERCLASS)) {
                child.namedChildren().forEach(type -> bases.add(type.text().strip()));
            } else if (child.is(SUPER_INTERFACES) || child.is(EXTENDS_INTERFACES)) {
                child.firstChildOfKind(TYPE_LIST)
                        .ifPresent(list -> list.namedChildren().forEach(type -> bases.add(type.text().strip())));
            }
        }
        return bases;
    }

    @Override
    public Optional<String> readDocComment(SyntaxNode declaration) {
        return DocComments.leadingDocComment(declaration, syntaxProfile());
    }
}
