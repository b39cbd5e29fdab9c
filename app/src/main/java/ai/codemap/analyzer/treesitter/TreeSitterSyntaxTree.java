package ai.codemap.analyzer.treesitter;

import ai.codemap.analyzer.syntax.SyntaxNode;
import ai.codemap.analyzer.syntax.SyntaxTree;
import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A tree-sitter parse of one file. Holds the native tree for as long as any of its nodes is reachable, and the UTF-8
 * bytes the node offsets refer to.
 */
public final class TreeSitterSyntaxTree implements SyntaxTree {
    private static final Logger log = LogManager.getLogger(TreeSitterSyntaxTree.class);

    private final String languageId;
    private final String sourceText;
    private final byte[] sourceBytes;
    private final TSTree tree;

    TreeSitterSyntaxTree(String languageId, String sourceText, byte[] sourceBytes, TSTree tree) {
        this.languageId = languageId;
        this.sourceText = sourceText;
        this.sourceBytes = sourceBytes;
        this.tree = tree;
    }

    @Override
    public String languageId() {
        return languageId;
    }

    @Override
    public SyntaxNode root() {
        return wrap(tree.getRootNode());
    }

    @Override
    public String sourceText() {
        return sourceText;
    }

    SyntaxNode wrap(TSNode node) {
        return new TreeSitterSyntaxNode(this, node);
    }

    /** Extracts a UTF-8 byte slice as a String. */
    String textSlice(int startByte, int endByte) {
        if (startByte < 0 || endByte > sourceBytes.length || startByte > endByte) {
            log.warn(
                    "Invalid byte range [{}, {}] for byte array of length {}", startByte, endByte, sourceBytes.length);
            return "";
        }
        return new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }
}
