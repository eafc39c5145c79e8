package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** Shared state of every declaration variant that maps back to a source range. */
public abstract sealed class LocatedDecl implements Decl
        permits EnumDecl, RecordDecl, FunctionDecl, VarDecl, TypedefDecl {

    @JsonProperty("name")
    private final @Nullable String name;

    @JsonProperty("loc")
    private SourceLocation loc;

    @JsonProperty("range")
    private SourceRange range;

    @JsonProperty("isImplicit")
    private boolean implicit;

    protected LocatedDecl(
            @Nullable String name, @Nullable SourceLocation loc, @Nullable SourceRange range, boolean implicit) {
        this.name = name;
        this.loc = loc == null ? SourceLocation.EMPTY : loc;
        this.range = range == null ? SourceRange.EMPTY : range;
        this.implicit = implicit;
    }

    @Override
    public @Nullable String name() {
        return name;
    }

    @Override
    public SourceLocation loc() {
        return loc;
    }

    @Override
    public SourceRange range() {
        return range;
    }

    @Override
    public boolean isImplicit() {
        return implicit;
    }

    public void setImplicit(boolean implicit) {
        this.implicit = implicit;
    }

    /** Replaces location and range after location back-fill. */
    public void relocate(SourceLocation loc, SourceRange range) {
        this.loc = Objects.requireNonNull(loc);
        this.range = Objects.requireNonNull(range);
    }

    @Override
    public String toString() {
        return "%s[%s]".formatted(getClass().getSimpleName(), name == null ? "<anonymous>" : name);
    }
}
