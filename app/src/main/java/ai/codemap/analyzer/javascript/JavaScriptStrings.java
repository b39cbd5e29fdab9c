package ai.codemap.analyzer.javascript;

import static ai.codemap.analyzer.javascript.JavaScriptTreeSitterNodeTypes.*;

import ai.codemap.analyzer.syntax.SyntaxNode;
import java.util.Optional;

/** Constant string values of JavaScript expressions. Escape sequences are kept as written. */
final class JavaScriptStrings {
    private JavaScriptStrings() {}

    /** Value of a quoted string, or of a template string without substitutions. */
    static Optional<String> literalValue(SyntaxNode node) {
        if (node.is(STRING)) {
            return Optional.of(unquote(node.text()));
        }
        if (node.is(TEMPLATE_STRING)) {
            if (node.firstChildOfKind(TEMPLATE_SUBSTITUTION).isPresent()) {
                return Optional.empty();
            }
            return Optional.of(unquote(node.text()));
        }
        return Optional.empty();
    }

    /** Folds literals joined with {@code +}, possibly parenthesized; empty if any operand is not constant. */
    static Optional<String> fold(SyntaxNode node) {
        switch (node.kind()) {
            case STRING:
            case TEMPLATE_STRING:
                return literalValue(node);
            case PARENTHESIZED_EXPRESSION:
                return node.firstNamedChild().flatMap(JavaScriptStrings::fold);
            case BINARY_EXPRESSION: {
                var operator = node.field(FIELD_OPERATOR).map(SyntaxNode::text).orElse("");
                if (!"+".equals(operator)) {
                    return Optional.empty();
                }
                var left = node.field(FIELD_LEFT).flatMap(JavaScriptStrings::fold);
                var right = node.field(FIELD_RIGHT).flatMap(JavaScriptStrings::fold);
                if (left.isEmpty() || right.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(left.get() + right.get());
            }
            default:
                return Optional.empty();
        }
    }

    private static String unquote(String text) {
        var t = text.strip();
        if (t.length() >= 2) {
            char first = t.charAt(0);
            if ((first == '"' || first == '\'' || first == '`') && t.charAt(t.length() - 1) == first) {
                return t.substring(1, t.length() - 1);
            }
        }
        return t;
    }
}
