package ai.codemap.analyzer.java;

import static ai.codemap.analyzer.java.JavaTreeSitterNodeTypes.*;

import ai.codemap.analyzer.ImportTarget;
import ai.codemap.analyzer.syntax.ImportShape;
import ai.codemap.analyzer.syntax.ImportShapeReader;
import ai.codemap.analyzer.syntax.SyntaxNode;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads {@code import a.b.C;}, {@code import a.b.*;} and their {@code static} forms. A static import names a member,
 * so its module is the declaring type and the member is the target.
 */
final class JavaImportShapeReader implements ImportShapeReader {
    private static final Logger log = LogManager.getLogger(JavaImportShapeReader.class);

    @Override
    public List<ImportShape> read(SyntaxNode node, boolean foldLiterals) {
        if (!node.is(IMPORT_DECLARATION)) {
            return List.of();
        }
        Optional<SyntaxNode> name = node.namedChildren().stream()
                .filter(c -> c.is(SCOPED_IDENTIFIER) || c.is(IDENTIFIER))
                .findFirst();
        if (name.isEmpty()) {
            log.debug("import declaration without a name at {}", node.span());
            return List.of();
        }
        var path = name.get().text().replaceAll("\\s+", "");
        boolean isStatic = node.children().stream().anyMatch(c -> c.is(STATIC));
        boolean wildcard = node.children().stream().anyMatch(c -> c.is(ASTERISK));

        if (wildcard) {
            return List.of(ImportShape.of(path, 0, List.of(ImportTarget.WILDCARD), false));
        }
        int lastDot = path.lastIndexOf('.');
        if (isStatic && lastDot > 0) {
            var member = path.substring(lastDot + 1);
            return List.of(ImportShape.of(path.substring(0, lastDot), 0, List.of(ImportTarget.of(member)), false));
        }
        var simpleName = lastDot < 0 ? path : path.substring(lastDot + 1);
        return List.of(ImportShape.of(path, 0, List.of(ImportTarget.of(simpleName)), false));
    }
}
