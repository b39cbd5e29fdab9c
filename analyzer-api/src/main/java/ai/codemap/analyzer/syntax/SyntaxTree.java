package ai.codemap.analyzer.syntax;

/** A parsed source file. */
public interface SyntaxTree {

    String languageId();

    SyntaxNode root();

    /** The text the tree was parsed from, after byte-order-mark removal. */
    String sourceText();
}
