package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

public final class EnumDecl extends LocatedDecl {
    @JsonProperty("completeDefinition")
    private final boolean completeDefinition;

    @JsonCreator
    public EnumDecl(
            @JsonProperty("name") @Nullable String name,
            @JsonProperty("loc") @Nullable SourceLocation loc,
            @JsonProperty("range") @Nullable SourceRange range,
            @JsonProperty("completeDefinition") boolean completeDefinition,
            @JsonProperty("isImplicit") boolean implicit) {
        super(name, loc, range, implicit);
        this.completeDefinition = completeDefinition;
    }

    @Override
    public DeclKind kind() {
        return DeclKind.ENUM;
    }

    @Override
    public boolean isDefinition() {
        return completeDefinition;
    }
}
