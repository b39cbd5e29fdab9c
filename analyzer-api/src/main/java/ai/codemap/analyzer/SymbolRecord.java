package ai.codemap.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * One declared unit of a source file: a function, method, class or lambda.
 *
 * <p>Records live in the arena of their {@link FileMap}; {@code id} is the index in that arena and
 * {@code enclosingScope} refers to another record of the same file by id.
 *
 * @param id index of this record within its file, in document order
 * @param name identifier, or a synthetic {@code <lambda>@line:col} name for anonymous forms
 * @param kind normalized declaration kind
 * @param modifiers flags, iterated in enum order
 * @param enclosingScope id of the containing record, or null at file level
 * @param decorators decorator or annotation texts, verbatim and in source order
 * @param docComment docstring or leading doc comment, if any
 * @param signature declaration header up to the body, whitespace-normalized
 * @param bases base classes or implemented types, for classes only
 * @param span source span of the declaration node
 */
public record SymbolRecord(
        int id,
        String name,
        SymbolKind kind,
        Set<SymbolModifier> modifiers,
        @Nullable Integer enclosingScope,
        List<String> decorators,
        @Nullable String docComment,
        String signature,
        List<String> bases,
        SourceSpan span) {

    public SymbolRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(span, "span");
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0");
        }
        if (enclosingScope != null && enclosingScope >= id) {
            throw new IllegalArgumentException("enclosing scope " + enclosingScope + " must precede record " + id);
        }
        modifiers = modifiers.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(SymbolModifier.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(modifiers));
        decorators = List.copyOf(decorators);
        bases = List.copyOf(bases);
    }

    public boolean has(SymbolModifier modifier) {
        return modifiers.contains(modifier);
    }

    @JsonIgnore
    public boolean isTopLevel() {
        return enclosingScope == null;
    }
}
