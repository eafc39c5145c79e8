package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Any node kind that is not modelled. Always implicit, so it is pruned before a unit is cached. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OtherDecl() implements Decl {
    @Override
    public DeclKind kind() {
        return DeclKind.OTHER;
    }
}
