package ai.codemap.analyzer.syntax;

import java.util.Set;

/**
 * Capability table mapping a grammar's native node kinds onto the normalized symbol and import vocabulary. The
 * extraction core consults only this table and never branches on the language itself.
 *
 * @param classKinds node kinds declaring a class-like type
 * @param anonymousClassKinds class kinds that may legitimately lack a name (class expressions)
 * @param functionKinds named function or method declarations
 * @param lambdaKinds anonymous or inline function expressions
 * @param constructorKinds node kinds that always declare a constructor
 * @param constructorNames method names that make a method a constructor
 * @param decoratorKinds decorator or annotation nodes
 * @param decoratorWrapperKinds nodes holding decorators next to the declaration they decorate
 * @param declarationWrapperKinds nodes that wrap a declaration without changing it, such as export statements
 * @param modifiersKind container node for keywords and annotations, or empty if the grammar has none
 * @param staticKeywords token kinds marking a static member
 * @param asyncKeyword token kind of the async qualifier, or empty
 * @param generatorMarkers token kinds that mark a declaration as a generator on their own, such as {@code *}
 * @param suspensionKinds yield-equivalent node kinds
 * @param nameField grammar field holding a declaration's name
 * @param bodyField grammar field holding a declaration's body
 * @param importKinds statement kinds that may import a module
 * @param callKinds call expression kinds that may perform a dynamic import
 * @param guardKinds branch constructs that make an import conditional
 * @param commentKinds comment node kinds
 * @param docCommentPrefix prefix of a leading doc comment, or empty
 * @param markers recognized marker decorators
 */
public record SyntaxProfile(
        Set<String> classKinds,
        Set<String> anonymousClassKinds,
        Set<String> functionKinds,
        Set<String> lambdaKinds,
        Set<String> constructorKinds,
        Set<String> constructorNames,
        Set<String> decoratorKinds,
        Set<String> decoratorWrapperKinds,
        Set<String> declarationWrapperKinds,
        String modifiersKind,
        Set<String> staticKeywords,
        String asyncKeyword,
        Set<String> generatorMarkers,
        Set<String> suspensionKinds,
        String nameField,
        String bodyField,
        Set<String> importKinds,
        Set<String> callKinds,
        Set<String> guardKinds,
        Set<String> commentKinds,
        String docCommentPrefix,
        MarkerDecorators markers) {

    public boolean isClass(SyntaxNode node) {
        return classKinds.contains(node.kind());
    }

    public boolean isLambda(SyntaxNode node) {
        return lambdaKinds.contains(node.kind());
    }

    public boolean isNamedFunction(SyntaxNode node) {
        return functionKinds.contains(node.kind()) || constructorKinds.contains(node.kind());
    }

    /** Any node that produces a symbol record. */
    public boolean isDeclaration(SyntaxNode node) {
        return isClass(node) || isNamedFunction(node) || isLambda(node);
    }

    public boolean isImportCandidate(SyntaxNode node) {
        return importKinds.contains(node.kind()) || callKinds.contains(node.kind());
    }

    public SyntaxProfile withMarkers(MarkerDecorators newMarkers) {
        return toBuilder().markers(newMarkers).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .classKinds(classKinds)
                .anonymousClassKinds(anonymousClassKinds)
                .functionKinds(functionKinds)
                .lambdaKinds(lambdaKinds)
                .constructorKinds(constructorKinds)
                .constructorNames(constructorNames)
                .decoratorKinds(decoratorKinds)
                .decoratorWrapperKinds(decoratorWrapperKinds)
                .declarationWrapperKinds(declarationWrapperKinds)
                .modifiersKind(modifiersKind)
                .staticKeywords(staticKeywords)
                .asyncKeyword(asyncKeyword)
                .generatorMarkers(generatorMarkers)
                .suspensionKinds(suspensionKinds)
                .nameField(nameField)
                .bodyField(bodyField)
                .importKinds(importKinds)
                .callKinds(callKinds)
                .guardKinds(guardKinds)
                .commentKinds(commentKinds)
                .docCommentPrefix(docCommentPrefix)
                .markers(markers);
    }

    /** Unset collections default to empty, unset strings to {@code ""}, fields to {@code name} and {@code body}. */
    public static final class Builder {
        private Set<String> classKinds = Set.of();
        private Set<String> anonymousClassKinds = Set.of();
        private Set<String> functionKinds = Set.of();
        private Set<String> lambdaKinds = Set.of();
        private Set<String> constructorKinds = Set.of();
        private Set<String> constructorNames = Set.of();
        private Set<String> decoratorKinds = Set.of();
        private Set<String> decoratorWrapperKinds = Set.of();
        private Set<String> declarationWrapperKinds = Set.of();
        private String modifiersKind = "";
        private Set<String> staticKeywords = Set.of();
        private String asyncKeyword = "";
        private Set<String> generatorMarkers = Set.of();
        private Set<String> suspensionKinds = Set.of();
        private String nameField = "name";
        private String bodyField = "body";
        private Set<String> importKinds = Set.of();
        private Set<String> callKinds = Set.of();
        private Set<String> guardKinds = Set.of();
        private Set<String> commentKinds = Set.of();
        private String docCommentPrefix = "";
        private MarkerDecorators markers = MarkerDecorators.NONE;

        private Builder() {}

        public Builder classKinds(Set<String> v) {
            classKinds = Set.copyOf(v);
            return this;
        }

        public Builder anonymousClassKinds(Set<String> v) {
            anonymousClassKinds = Set.copyOf(v);
            return this;
        }

        public Builder functionKinds(Set<String> v) {
            functionKinds = Set.copyOf(v);
            return this;
        }

        public Builder lambdaKinds(Set<String> v) {
            lambdaKinds = Set.copyOf(v);
            return this;
        }

        public Builder constructorKinds(Set<String> v) {
            constructorKinds = Set.copyOf(v);
            return this;
        }

        public Builder constructorNames(Set<String> v) {
            constructorNames = Set.copyOf(v);
            return this;
        }

        public Builder decoratorKinds(Set<String> v) {
            decoratorKinds = Set.copyOf(v);
            return this;
        }

        public Builder decoratorWrapperKinds(Set<String> v) {
            decoratorWrapperKinds = Set.copyOf(v);
            return this;
        }

        public Builder declarationWrapperKinds(Set<String> v) {
            declarationWrapperKinds = Set.copyOf(v);
            return this;
        }

        public Builder modifiersKind(String v) {
            modifiersKind = v;
            return this;
        }

        public Builder staticKeywords(Set<String> v) {
            staticKeywords = Set.copyOf(v);
            return this;
        }

        public Builder asyncKeyword(String v) {
            asyncKeyword = v;
            return this;
        }

        public Builder generatorMarkers(Set<String> v) {
            generatorMarkers = Set.copyOf(v);
            return this;
        }

        public Builder suspensionKinds(Set<String> v) {
            suspensionKinds = Set.copyOf(v);
            return this;
        }

        public Builder nameField(String v) {
            nameField = v;
            return this;
        }

        public Builder bodyField(String v) {
            bodyField = v;
            return this;
        }

        public Builder importKinds(Set<String> v) {
            importKinds = Set.copyOf(v);
            return this;
        }

        public Builder callKinds(Set<String> v) {
            callKinds = Set.copyOf(v);
            return this;
        }

        public Builder guardKinds(Set<String> v) {
            guardKinds = Set.copyOf(v);
            return this;
        }

        public Builder commentKinds(Set<String> v) {
            commentKinds = Set.copyOf(v);
            return this;
        }

        public Builder docCommentPrefix(String v) {
            docCommentPrefix = v;
            return this;
        }

        public Builder markers(MarkerDecorators v) {
            markers = v;
            return this;
        }

        public SyntaxProfile build() {
            return new SyntaxProfile(
                    classKinds,
                    anonymousClassKinds,
                    functionKinds,
                    lambdaKinds,
                    constructorKinds,
                    constructorNames,
                    decoratorKinds,
                    decoratorWrapperKinds,
                    declarationWrapperKinds,
                    modifiersKind,
                    staticKeywords,
                    asyncKeyword,
                    generatorMarkers,
                    suspensionKinds,
                    nameField,
                    bodyField,
                    importKinds,
                    callKinds,
                    guardKinds,
                    commentKinds,
                    docCommentPrefix,
                    markers);
        }
    }
}
