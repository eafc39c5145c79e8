package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

public final class VarDecl extends LocatedDecl implements LinkageDecl {
    @JsonProperty("storageClass")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final @Nullable String storageClass;

    /** The front end's initialization style ({@code "c"}, {@code "call"}, {@code "list"}), or null. */
    @JsonProperty("init")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final @Nullable String init;

    @JsonProperty("committed")
    private boolean committed;

    @JsonProperty("alias")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private @Nullable String alias;

    @JsonCreator
    public VarDecl(
            @JsonProperty("name") String name,
            @JsonProperty("loc") @Nullable SourceLocation loc,
            @JsonProperty("range") @Nullable SourceRange range,
            @JsonProperty("storageClass") @Nullable String storageClass,
            @JsonProperty("init") @Nullable String init,
            @JsonProperty("isImplicit") boolean implicit,
            @JsonProperty("committed") boolean committed,
            @JsonProperty("alias") @Nullable String alias) {
        super(name, loc, range, implicit);
        this.storageClass = storageClass;
        this.init = init;
        this.committed = committed;
        this.alias = alias;
    }

    @Override
    public DeclKind kind() {
        return DeclKind.VARIABLE;
    }

    @Override
    public String name() {
        var name = super.name();
        assert name != null : "variables are always named";
        return name;
    }

    @Override
    public @Nullable String storageClass() {
        return storageClass;
    }

    @Override
    public boolean hasInit() {
        return init != null;
    }

    /**
     * A variable owns storage unless it is a plain {@code extern} declaration. An aliased variable was {@code static}
     * in the original unit and still owns its storage after the rewrite to {@code extern}.
     */
    @Override
    public boolean isDefinition() {
        return !isExtern() || hasInit() || alias != null;
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
