package ai.codemap.analyzer;

import ai.codemap.analyzer.syntax.SyntaxNode;
import ai.codemap.analyzer.syntax.SyntaxProfile;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Locating and cleaning documentation text. */
public final class DocComments {
    private static final Splitter LINES = Splitter.onPattern("\r?\n");

    private DocComments() {}

    /**
     * The doc comment directly preceding a declaration, looking past decorator and export wrappers. Only comments
     * starting with the profile's doc comment prefix count.
     */
    public static Optional<String> leadingDocComment(SyntaxNode declaration, SyntaxProfile profile) {
        if (profile.docCommentPrefix().isEmpty()) {
            return Optional.empty();
        }
        var anchor = declaration;
        var parent = anchor.parent();
        while (parent.isPresent() && isWrapper(parent.get(), profile)) {
            anchor = parent.get();
            parent = anchor.parent();
        }
        return anchor.previousSibling()
                .filter(prev -> profile.commentKinds().contains(prev.kind()))
                .map(SyntaxNode::text)
                .filter(text -> text.startsWith(profile.docCommentPrefix()))
                .map(DocComments::cleanBlockComment)
                .filter(text -> !text.isEmpty());
    }

    private static boolean isWrapper(SyntaxNode node, SyntaxProfile profile) {
        return profile.decoratorWrapperKinds().contains(node.kind())
                || profile.declarationWrapperKinds().contains(node.kind());
    }

    /** Strips {@code /**}, {@code *}{@code /} and leading {@code *} gutters. */
    public static String cleanBlockComment(String comment) {
        var body = comment.strip();
        if (body.startsWith("/**")) {
            body = body.substring(3);
        } else if (body.startsWith("/*")) {
            body = body.substring(2);
        }
        if (body.endsWith("*/")) {
            body = body.substring(0, body.length() - 2);
        }
        var lines = new ArrayList<String>();
        for (var line : LINES.split(body)) {
            var stripped = line.strip();
            if (stripped.startsWith("*")) {
                stripped = stripped.substring(1).strip();
            }
            lines.add(stripped);
        }
        return trimBlankLines(lines);
    }

    /**
     * Removes common leading indentation from every line after the first, the way documentation tools treat
     * docstrings, and drops blank leading and trailing lines.
     */
    public static String dedent(String text) {
        var lines = LINES.splitToList(text);
        int indent = Integer.MAX_VALUE;
        for (int i = 1; i < lines.size(); i++) {
            var line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            int lead = 0;
            while (lead < line.length() && (line.charAt(lead) == ' ' || line.charAt(lead) == '\t')) {
                lead++;
            }
            indent = Math.min(indent, lead);
        }
        var out = new ArrayList<String>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if (i == 0) {
                out.add(line.strip());
            } else if (line.isBlank()) {
                out.add("");
            } else {
                out.add(line.substring(Math.min(indent, line.length())).stripTrailing());
            }
        }
        return trimBlankLines(out);
    }

    private static String trimBlankLines(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isBlank()) start++;
        while (end > start && lines.get(end - 1).isBlank()) end--;
        return String.join("\n", lines.subList(start, end));
    }
}
