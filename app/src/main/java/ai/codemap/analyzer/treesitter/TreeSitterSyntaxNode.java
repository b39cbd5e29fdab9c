package ai.codemap.analyzer.treesitter;

import ai.codemap.analyzer.SourceSpan;
import ai.codemap.analyzer.syntax.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.treesitter.TSNode;

/** {@link SyntaxNode} over a tree-sitter {@link TSNode}. */
final class TreeSitterSyntaxNode implements SyntaxNode {
    private static final String ERROR = "ERROR";

    private final TreeSitterSyntaxTree owner;
    private final TSNode node;

    TreeSitterSyntaxNode(TreeSitterSyntaxTree owner, TSNode node) {
        this.owner = owner;
        this.node = node;
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public SourceSpan span() {
        var start = node.getStartPoint();
        var end = node.getEndPoint();
        return new SourceSpan(
                start.getRow() + 1,
                start.getColumn() + 1,
                end.getRow() + 1,
                end.getColumn() + 1,
                node.getStartByte(),
                node.getEndByte());
    }

    @Override
    public String text() {
        return owner.textSlice(node.getStartByte(), node.getEndByte());
    }

    @Override
    public List<SyntaxNode> children() {
        int count = node.getChildCount();
        var result = new ArrayList<SyntaxNode>(count);
        for (int i = 0; i < count; i++) {
            var child = node.getChild(i);
            if (child != null && !child.isNull()) {
                result.add(owner.wrap(child));
            }
        }
        return result;
    }

    @Override
    public List<SyntaxNode> namedChildren() {
        int count = node.getNamedChildCount();
        var result = new ArrayList<SyntaxNode>(count);
        for (int i = 0; i < count; i++) {
            var child = node.getNamedChild(i);
            if (child != null && !child.isNull()) {
                result.add(owner.wrap(child));
            }
        }
        return result;
    }

    @Override
    public Optional<SyntaxNode> field(String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        if (child == null || child.isNull()) {
            return Optional.empty();
        }
        return Optional.of(owner.wrap(child));
    }

    @Override
    public List<SyntaxNode> fieldChildren(String fieldName) {
        var result = new ArrayList<SyntaxNode>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (fieldName.equals(node.getFieldNameForChild(i))) {
                var child = node.getChild(i);
                if (child != null && !child.isNull()) {
                    result.add(owner.wrap(child));
                }
            }
        }
        return result;
    }

    @Override
    public Optional<SyntaxNode> parent() {
        var parent = node.getParent();
        if (parent == null || parent.isNull()) {
            return Optional.empty();
        }
        return Optional.of(owner.wrap(parent));
    }

    @Override
    public Optional<SyntaxNode> previousSibling() {
        var prev = node.getPrevSibling();
        if (prev == null || prev.isNull()) {
            return Optional.empty();
        }
        return Optional.of(owner.wrap(prev));
    }

    @Override
    public boolean isError() {
        return ERROR.equals(node.getType());
    }

    @Override
    public boolean isMissing() {
        return node.isMissing();
    }

    @Override
    public boolean hasError() {
        return node.hasError();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TreeSitterSyntaxNode other)) return false;
        return owner == other.owner
                && node.getStartByte() == other.node.getStartByte()
                && node.getEndByte() == other.node.getEndByte()
                && node.getType().equals(other.node.getType());
    }

    @Override
    public int hashCode() {
        return 31 * (31 * node.getStartByte() + node.getEndByte()) + node.getType().hashCode();
    }

    @Override
    public String toString() {
        return kind() + "@" + span();
    }
}
