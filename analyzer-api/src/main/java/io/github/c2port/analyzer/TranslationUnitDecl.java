package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Root of a parsed unit: the top-level declarations in source order plus the hash of the raw source bytes. */
public final class TranslationUnitDecl implements Decl {
    @JsonProperty("hash")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private @Nullable String hash;

    @JsonProperty("inner")
    private final List<Decl> inner;

    @JsonCreator
    public TranslationUnitDecl(
            @JsonProperty("hash") @Nullable String hash, @JsonProperty("inner") @Nullable List<Decl> inner) {
        this.hash = hash;
        this.inner = inner == null ? new ArrayList<>() : new ArrayList<>(inner);
    }

    @Override
    public DeclKind kind() {
        return DeclKind.TRANSLATION_UNIT;
    }

    public @Nullable String hash() {
        return hash;
    }

    public void setHash(String hash) {
        this.hash = hash;
    }

    /** Mutable, ordered view of the top-level declarations. */
    public List<Decl> inner() {
        return inner;
    }
}
