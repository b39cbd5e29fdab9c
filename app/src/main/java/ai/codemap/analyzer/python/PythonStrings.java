package ai.codemap.analyzer.python;

import static ai.codemap.analyzer.python.PythonTreeSitterNodeTypes.*;

import ai.codemap.analyzer.syntax.SyntaxNode;
import java.util.Optional;

/** Reading Python string literals from the syntax tree. */
final class PythonStrings {
    private PythonStrings() {}

    /**
     * The contents of a {@code string} node without prefix and quotes, or empty for f-strings with interpolations.
     * Escape sequences are kept as written.
     */
    static Optional<String> literalValue(SyntaxNode string) {
        if (!string.is(STRING)) {
            return Optional.empty();
        }
        if (string.namedChildren().stream().anyMatch(c -> c.is(INTERPOLATION))) {
            return Optional.empty();
        }
        var text = string.text();
        int start = 0;
        while (start < text.length() && Character.isLetter(text.charAt(start))) {
            start++;
        }
        if (start >= text.length()) {
            return Optional.empty();
        }
        char quote = text.charAt(start);
        if (quote != '"' && quote != '\'') {
            return Optional.empty();
        }
        int quoteLength = text.startsWith(String.valueOf(quote).repeat(3), start) ? 3 : 1;
        int end = text.length() - quoteLength;
        if (end < start + quoteLength) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start + quoteLength, end));
    }

    /**
     * Folds an expression built only from string literals: a literal, implicit concatenation of literals, {@code +}
     * of foldable operands, or a parenthesized foldable expression.
     */
    static Optional<String> fold(SyntaxNode expr) {
        switch (expr.kind()) {
            case STRING:
                return literalValue(expr);
            case CONCATENATED_STRING: {
                var sb = new StringBuilder();
                for (var part : expr.namedChildren()) {
                    var value = literalValue(part);
                    if (value.isEmpty()) {
                        return Optional.empty();
                    }
                    sb.append(value.get());
                }
                return Optional.of(sb.toString());
            }
            case BINARY_OPERATOR: {
                var operator = expr.field("operator").map(SyntaxNode::text).orElse("");
                if (!operator.equals("+")) {
                    return Optional.empty();
                }
                var left = expr.field("left").flatMap(PythonStrings::fold);
                var right = expr.field("right").flatMap(PythonStrings::fold);
                if (left.isEmpty() || right.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(left.get() + right.get());
            }
            case PARENTHESIZED_EXPRESSION:
                return expr.firstNamedChild().flatMap(PythonStrings::fold);
            default:
                return Optional.empty();
        }
    }
}
