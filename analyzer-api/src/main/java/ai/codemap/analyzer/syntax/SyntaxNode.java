package ai.codemap.analyzer.syntax;

import ai.codemap.analyzer.SourceSpan;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of a concrete syntax tree. Implementations wrap a parser's native node type; the
 * extraction core only ever sees this interface.
 */
public interface SyntaxNode {

    /** Grammar node type, e.g. {@code function_definition}. Anonymous tokens report their literal text. */
    String kind();

    SourceSpan span();

    /** Exact source text covered by this node. */
    String text();

    /** All children, including anonymous tokens such as keywords and punctuation. */
    List<SyntaxNode> children();

    List<SyntaxNode> namedChildren();

    /** First child bound to the given grammar field. */
    Optional<SyntaxNode> field(String fieldName);

    /** Every child bound to the given grammar field, in source order. */
    List<SyntaxNode> fieldChildren(String fieldName);

    Optional<SyntaxNode> parent();

    /** Sibling immediately before this node, named or not. */
    Optional<SyntaxNode> previousSibling();

    /** True for an error region produced by parser recovery. */
    boolean isError();

    /** True for a zero-width node the parser inserted to recover from an error. */
    boolean isMissing();

    /** True if this node or any descendant is an error or missing node. */
    boolean hasError();

    default boolean is(String nodeKind) {
        return kind().equals(nodeKind);
    }

    default Optional<SyntaxNode> firstNamedChild() {
        var named = namedChildren();
        return named.isEmpty() ? Optional.empty() : Optional.of(named.get(0));
    }

    default Optional<SyntaxNode> firstChildOfKind(String nodeKind) {
        return children().stream().filter(c -> c.is(nodeKind)).findFirst();
    }
}
