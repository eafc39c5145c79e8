package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

public final class FunctionDecl extends LocatedDecl implements LinkageDecl {
    @JsonProperty("storageClass")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final @Nullable String storageClass;

    @JsonProperty("inline")
    private final boolean inline;

    @JsonProperty("hasBody")
    private final boolean hasBody;

    @JsonProperty("committed")
    private boolean committed;

    @JsonProperty("alias")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private @Nullable String alias;

    @JsonCreator
    public FunctionDecl(
            @JsonProperty("name") String name,
            @JsonProperty("loc") @Nullable SourceLocation loc,
            @JsonProperty("range") @Nullable SourceRange range,
            @JsonProperty("storageClass") @Nullable String storageClass,
            @JsonProperty("inline") boolean inline,
            @JsonProperty("hasBody") boolean hasBody,
            @JsonProperty("isImplicit") boolean implicit,
            @JsonProperty("committed") boolean committed,
            @JsonProperty("alias") @Nullable String alias) {
        super(name, loc, range, implicit);
        this.storageClass = storageClass;
        this.inline = inline;
        this.hasBody = hasBody;
        this.committed = committed;
        this.alias = alias;
    }

    @Override
    public DeclKind kind() {
        return DeclKind.FUNCTION;
    }

    @Override
    public String name() {
        var name = super.name();
        assert name != null : "functions are always named";
        return name;
    }

    @Override
    public @Nullable String storageClass() {
        return storageClass;
    }

    @Override
    public boolean isInline() {
        return inline;
    }

    @Override
    public boolean hasBody() {
        return hasBody;
    }

    @Override
    public boolean isDefinition() {
        return hasBody;
    }

    @Override
    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void setCommitted(boolean committed) {
        this.committed = committed;
    }

    @Override
    public @Nullable String alias() {
        return alias;
    }

    @Override
    public void setAlias(@Nullable String alias) {
        this.alias = alias;
    }
}
