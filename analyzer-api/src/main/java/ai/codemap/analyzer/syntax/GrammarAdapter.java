package ai.codemap.analyzer.syntax;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One supported source language: its parser and the capability tables the extraction core needs to read its trees.
 * Implementations must be safe for concurrent use.
 */
public interface GrammarAdapter {

    /** Stable identifier such as {@code python}. */
    String languageId();

    /** File extensions without the leading dot. */
    Set<String> fileExtensions();

    /** Never throws for bad input; a file the parser cannot handle yields a {@link ParseOutcome.ParseError}. */
    ParseOutcome parse(String sourceText);

    SyntaxProfile syntaxProfile();

    ImportShapeReader importReader();

    ModuleLayout moduleLayout();

    /** Base classes, extended or implemented types of a class declaration, as written. */
    default List<String> readBases(SyntaxNode classNode) {
        return List.of();
    }

    /** Documentation attached to a declaration, cleaned of comment or string delimiters. */
    Optional<String> readDocComment(SyntaxNode declaration);
}
