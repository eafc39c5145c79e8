package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/** A {@code struct} or {@code union}, complete or forward-declared. */
public final class RecordDecl extends LocatedDecl {
    @JsonProperty("tagUsed")
    private final String tagUsed;

    @JsonProperty("completeDefinition")
    private final boolean completeDefinition;

    @JsonCreator
    public RecordDecl(
            @JsonProperty("name") @Nullable String name,
            @JsonProperty("loc") @Nullable SourceLocation loc,
            @JsonProperty("range") @Nullable SourceRange range,
            @JsonProperty("tagUsed") @Nullable String tagUsed,
            @JsonProperty("completeDefinition") boolean completeDefinition,
            @JsonProperty("isImplicit") boolean implicit) {
        super(name, loc, range, implicit);
        this.tagUsed = tagUsed == null ? "struct" : tagUsed;
        this.completeDefinition = completeDefinition;
    }

    @Override
    public DeclKind kind() {
        return DeclKind.RECORD;
    }

    public String tagUsed() {
        return tagUsed;
    }

    @Override
    public boolean isDefinition() {
        return completeDefinition;
    }
}
