package ai.codemap.analyzer.treesitter;

import ai.codemap.analyzer.syntax.GrammarAdapter;
import ai.codemap.analyzer.syntax.ParseOutcome;
import ai.codemap.analyzer.syntax.SyntaxProfile;
import ai.codemap.util.TextCanonicalizer;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * Base for grammar adapters backed by a tree-sitter grammar. Parsers are not thread-safe, so each thread gets its
 * own.
 */
public abstract class TreeSitterGrammarAdapter implements GrammarAdapter {
    private static final Logger log = LogManager.getLogger(TreeSitterGrammarAdapter.class);

    private final long maxFileBytes;
    private final SyntaxProfile profile;

    private final ThreadLocal<TSLanguage> threadLocalLanguage = ThreadLocal.withInitial(this::createTSLanguage);
    private final ThreadLocal<TSParser> threadLocalParser = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        if (!parser.setLanguage(threadLocalLanguage.get())) {
            log.error("Failed to set language on TSParser for {}", languageId());
        }
        return parser;
    });

    protected TreeSitterGrammarAdapter(SyntaxProfile profile, long maxFileBytes) {
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes must be > 0");
        }
        this.profile = Objects.requireNonNull(profile, "profile");
        this.maxFileBytes = maxFileBytes;
    }

    /** Creates the grammar; called once per thread. */
    protected abstract TSLanguage createTSLanguage();

    @Override
    public SyntaxProfile syntaxProfile() {
        return profile;
    }

    @Override
    public ParseOutcome parse(String sourceText) {
        Objects.requireNonNull(sourceText, "sourceText");
        var src = TextCanonicalizer.stripUtf8Bom(sourceText);
        if (TextCanonicalizer.looksBinary(src)) {
            return ParseOutcome.error("binary content (NUL byte)");
        }
        byte[] bytes = src.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > maxFileBytes) {
            return ParseOutcome.error(
                    String.format(Locale.ROOT, "file is %d bytes, limit is %d", bytes.length, maxFileBytes));
        }

        TSTree tree = threadLocalParser.get().parseString(null, src);
        if (tree == null) {
            return ParseOutcome.error("parser returned no tree");
        }
        var rootNode = tree.getRootNode();
        if (rootNode == null || rootNode.isNull()) {
            log.warn("Parsing failed or produced null root node for {} input", languageId());
            return ParseOutcome.error("parser produced no root node");
        }
        if ("ERROR".equals(rootNode.getType())) {
            return ParseOutcome.error("no recognizable " + languageId() + " structure");
        }
        return ParseOutcome.parsed(new TreeSitterSyntaxTree(languageId(), src, bytes, tree));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + languageId() + "]";
    }
}
