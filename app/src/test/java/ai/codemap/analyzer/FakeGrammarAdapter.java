package ai.codemap.analyzer;

import ai.codemap.analyzer.syntax.GrammarAdapter;
import ai.codemap.analyzer.syntax.ImportShapeReader;
import ai.codemap.analyzer.syntax.ModuleLayout;
import ai.codemap.analyzer.syntax.ParseOutcome;
import ai.codemap.analyzer.syntax.SyntaxNode;
import ai.codemap.analyzer.syntax.SyntaxProfile;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Adapter over {@link FakeNode} trees; it cannot parse text. */
final class FakeGrammarAdapter implements GrammarAdapter {
    static final SyntaxProfile PROFILE = SyntaxProfile.builder()
            .classKinds(Set.of("class_def"))
            .functionKinds(Set.of("function_def"))
            .lambdaKinds(Set.of("lambda"))
            .build();

    private final String languageId;
    private final Set<String> extensions;
    private final SyntaxProfile profile;

    FakeGrammarAdapter() {
        this("fake", Set.of("fake"), PROFILE);
    }

    FakeGrammarAdapter(String languageId, Set<String> extensions, SyntaxProfile profile) {
        this.languageId = languageId;
        this.extensions = extensions;
        this.profile = profile;
    }

    @Override
    public String languageId() {
        return languageId;
    }

    @Override
    public Set<String> fileExtensions() {
        return extensions;
    }

    @Override
    public ParseOutcome parse(String sourceText) {
        return ParseOutcome.error("fake grammar cannot parse text");
    }

    @Override
    public SyntaxProfile syntaxProfile() {
        return profile;
    }

    @Override
    public ImportShapeReader importReader() {
        return (node, foldLiterals) -> List.of();
    }

    @Override
    public ModuleLayout moduleLayout() {
        return new ModuleLayout() {
            @Override
            public Optional<String> normalizeRelative(String fromFile, String writtenModule, int relativeDepth) {
                return Optional.of(writtenModule);
            }

            @Override
            public List<String> candidatePaths(String fromFile, String module, boolean rootAnchored) {
                return List.of(module + ".fake");
            }

            @Override
            public boolean isStandardLibrary(String module) {
                return false;
            }
        };
    }

    @Override
    public Optional<String> readDocComment(SyntaxNode declaration) {
        return Optional.empty();
    }
}
