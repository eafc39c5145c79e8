package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.jetbrains.annotations.Nullable;

/**
 * One node of a parsed translation unit. The variants mirror the front end's node kinds; the type id written to
 * the sidecar cache is the front end's own kind name, so a cache file reads like a trimmed front end dump.
 *
 * <p>Accessors that do not apply to a variant return the neutral value (no name, no range, not static ...), so
 * callers can treat a declaration list uniformly and only downcast to {@link LinkageDecl} to change state.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind",
        defaultImpl = OtherDecl.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = EnumDecl.class, name = "EnumDecl"),
    @JsonSubTypes.Type(value = RecordDecl.class, name = "RecordDecl"),
    @JsonSubTypes.Type(value = FunctionDecl.class, name = "FunctionDecl"),
    @JsonSubTypes.Type(value = VarDecl.class, name = "VarDecl"),
    @JsonSubTypes.Type(value = TypedefDecl.class, name = "TypedefDecl"),
    @JsonSubTypes.Type(value = TranslationUnitDecl.class, name = "TranslationUnitDecl"),
    @JsonSubTypes.Type(value = OtherDecl.class, name = "Other")
})
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.NONE,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public sealed interface Decl permits LocatedDecl, LinkageDecl, TranslationUnitDecl, OtherDecl {

    DeclKind kind();

    default @Nullable String name() {
        return null;
    }

    default @Nullable SourceLocation loc() {
        return null;
    }

    default @Nullable SourceRange range() {
        return null;
    }

    /** Compiler-synthesized nodes, and nodes of kinds we do not model, never take part in code generation. */
    default boolean isImplicit() {
        return true;
    }

    /** Internal linkage. */
    default boolean isStatic() {
        return false;
    }

    default boolean isExtern() {
        return false;
    }

    default boolean isInline() {
        return false;
    }

    /**
     * Whether this node defines (rather than merely declares) its entity: a function with a body, a variable that is
     * not a bare {@code extern} declaration, or a tag type with a complete body.
     */
    default boolean isDefinition() {
        return false;
    }

    default boolean hasInit() {
        return false;
    }

    /** True for a function that carries a body. */
    default boolean hasBody() {
        return false;
    }

    default boolean isCommitted() {
        return false;
    }

    /** The external-linkage alias assigned to an internal-linkage declaration, if any. */
    default @Nullable String alias() {
        return null;
    }

    /** Whether this node is emitted as source text at all. */
    default boolean participatesInCodegen() {
        return kind().participatesInCodegen() && !isImplicit();
    }
}
