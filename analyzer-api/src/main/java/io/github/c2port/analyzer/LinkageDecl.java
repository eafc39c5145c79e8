package io.github.c2port.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * Declarations with linkage: the only ones that are translated one at a time and whose translation state is
 * tracked.
 */
public sealed interface LinkageDecl extends Decl permits FunctionDecl, VarDecl {

    @Override
    String name();

    @Nullable
    String storageClass();

    void setCommitted(boolean committed);

    void setAlias(@Nullable String alias);

    @Override
    default boolean isStatic() {
        return "static".equals(storageClass());
    }

    @Override
    default boolean isExtern() {
        return "extern".equals(storageClass());
    }
}
