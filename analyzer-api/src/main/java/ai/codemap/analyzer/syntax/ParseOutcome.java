package ai.codemap.analyzer.syntax;

import java.util.Objects;

/** Result of handing one file's text to a {@link GrammarAdapter}: either a tree or a whole-file parse error. */
public sealed interface ParseOutcome permits ParseOutcome.Parsed, ParseOutcome.ParseError {

    record Parsed(SyntaxTree tree) implements ParseOutcome {
        public Parsed {
            Objects.requireNonNull(tree, "tree");
        }
    }

    record ParseError(String message) implements ParseOutcome {
        public ParseError {
            Objects.requireNonNull(message, "message");
        }
    }

    static ParseOutcome parsed(SyntaxTree tree) {
        return new Parsed(tree);
    }

    static ParseOutcome error(String message) {
        return new ParseError(message);
    }
}
