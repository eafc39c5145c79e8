package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

public final class TypedefDecl extends LocatedDecl {
    @JsonProperty("qualType")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final @Nullable String qualType;

    @JsonCreator
    public TypedefDecl(
            @JsonProperty("name") String name,
            @JsonProperty("loc") @Nullable SourceLocation loc,
            @JsonProperty("range") @Nullable SourceRange range,
            @JsonProperty("qualType") @Nullable String qualType,
            @JsonProperty("isImplicit") boolean implicit) {
        super(name, loc, range, implicit);
        this.qualType = qualType;
    }

    @Override
    public DeclKind kind() {
        return DeclKind.TYPEDEF;
    }

    public @Nullable String qualType() {
        return qualType;
    }

    @Override
    public boolean isDefinition() {
        return true;
    }
}
