package ai.codemap.analyzer.syntax;

import java.util.List;

/** Reads the grammar-specific parts of import statements. One instance per language, shared across threads. */
public interface ImportShapeReader {

    /**
     * Reads {@code node}, whose kind is one of the profile's import or call kinds.
     *
     * @param foldLiterals whether a dynamic import argument built only from string literals is folded to its value
     * @return one shape per import record to emit; empty if the node does not import anything
     */
    List<ImportShape> read(SyntaxNode node, boolean foldLiterals);
}
