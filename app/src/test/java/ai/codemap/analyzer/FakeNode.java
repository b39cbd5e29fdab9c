package ai.codemap.analyzer;

import ai.codemap.analyzer.syntax.SyntaxNode;
import ai.codemap.analyzer.syntax.SyntaxTree;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Hand-built syntax node for exercising the extraction core without a parser. Leaves are laid out on one line,
 * separated by single spaces, once the tree is wrapped in {@link #tree(String, FakeNode)}.
 */
final class FakeNode implements SyntaxNode {
    private final String kind;
    private final @Nullable String leafText;
    private final boolean named;
    private final List<FakeNode> children = new ArrayList<>();
    private final Map<FakeNode, String> fieldNames = new IdentityHashMap<>();
    private boolean missing;
    private @Nullable FakeNode parent;
    private int startByte;
    private int endByte;
    private String source = "";

    private FakeNode(String kind, @Nullable String leafText, boolean named) {
        this.kind = kind;
        this.leafText = leafText;
        this.named = named;
    }

    static FakeNode node(String kind, FakeNode... children) {
        var node = new FakeNode(kind, null, true);
        for (var child : children) {
            node.children.add(child);
        }
        return node;
    }

    static FakeNode leaf(String kind, String text) {
        return new FakeNode(kind, text, true);
    }

    /** An anonymous token; its kind is its text. */
    static FakeNode token(String text) {
        return new FakeNode(text, text, false);
    }

    FakeNode field(String fieldName, FakeNode child) {
        children.add(child);
        fieldNames.put(child, fieldName);
        return this;
    }

    FakeNode add(FakeNode child) {
        children.add(child);
        return this;
    }

    FakeNode missing() {
        this.missing = true;
        return this;
    }

    static SyntaxTree tree(String languageId, FakeNode root) {
        var sb = new StringBuilder();
        root.layout(sb);
        var text = sb.toString();
        root.share(text);
        return new SyntaxTree() {
            @Override
            public String languageId() {
                return languageId;
            }

            @Override
            public SyntaxNode root() {
                return root;
            }

            @Override
            public String sourceText() {
                return text;
            }
        };
    }

    private void layout(StringBuilder sb) {
        if (leafText != null) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            startByte = sb.length();
            sb.append(leafText);
            endByte = sb.length();
            return;
        }
        for (var child : children) {
            child.parent = this;
            child.layout(sb);
        }
        if (children.isEmpty()) {
            startByte = sb.length();
            endByte = sb.length();
        } else {
            startByte = children.get(0).startByte;
            endByte = children.get(children.size() - 1).endByte;
        }
    }

    private void share(String text) {
        source = text;
        children.forEach(c -> c.share(text));
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public SourceSpan span() {
        return new SourceSpan(1, startByte + 1, 1, endByte + 1, startByte, endByte);
    }

    @Override
    public String text() {
        return source.substring(startByte, endByte);
    }

    @Override
    public List<SyntaxNode> children() {
        return List.copyOf(children);
    }

    @Override
    public List<SyntaxNode> namedChildren() {
        return children.stream().filter(c -> c.named).map(c -> (SyntaxNode) c).toList();
    }

    @Override
    public Optional<SyntaxNode> field(String fieldName) {
        return children.stream()
                .filter(c -> fieldName.equals(fieldNames.get(c)))
                .map(c -> (SyntaxNode) c)
                .findFirst();
    }

    @Override
    public List<SyntaxNode> fieldChildren(String fieldName) {
        return children.stream()
                .filter(c -> fieldName.equals(fieldNames.get(c)))
                .map(c -> (SyntaxNode) c)
                .toList();
    }

    @Override
    public Optional<SyntaxNode> parent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public Optional<SyntaxNode> previousSibling() {
        if (parent == null) {
            return Optional.empty();
        }
        int index = parent.children.indexOf(this);
        return index > 0 ? Optional.of(parent.children.get(index - 1)) : Optional.empty();
    }

    @Override
    public boolean isError() {
        return "ERROR".equals(kind);
    }

    @Override
    public boolean isMissing() {
        return missing;
    }

    @Override
    public boolean hasError() {
        return isError() || missing || children.stream().anyMatch(FakeNode::hasError);
    }

    @Override
    public String toString() {
        return kind + "@" + span();
    }
}
