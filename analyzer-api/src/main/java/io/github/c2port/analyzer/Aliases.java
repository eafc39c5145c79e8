package io.github.c2port.analyzer;

import java.util.Optional;

/**
 * Naming of external-linkage aliases for internal-linkage declarations. An alias is a pure function of the unit's
 * content hash and the declaration's original name, so the same unit always yields the same aliases and no registry
 * has to be kept between runs.
 */
public final class Aliases {
    public static final String PRIVATE_PREFIX = "_priv_";

    private Aliases() {}

    public static String aliasFor(String unitHash, String name) {
        return PRIVATE_PREFIX + unitHash + "_" + name;
    }

    public static boolean isPrivateAlias(String name) {
        return name.startsWith(PRIVATE_PREFIX);
    }

    /** Recovers the original short name from an alias minted for {@code unitHash}. */
    public static Optional<String> originalName(String unitHash, String alias) {
        var prefix = PRIVATE_PREFIX + unitHash + "_";
        if (!alias.startsWith(prefix) || alias.length() == prefix.length()) {
            return Optional.empty();
        }
        return Optional.of(alias.substring(prefix.length()));
    }

    /** Recovers the original short name from any alias; hashes are hex, so the name follows the first separator. */
    public static Optional<String> originalName(String alias) {
        if (!isPrivateAlias(alias)) {
            return Optional.empty();
        }
        int separator = alias.indexOf('_', PRIVATE_PREFIX.length());
        if (separator < 0 || separator == alias.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(alias.substring(separator + 1));
    }

    /** The guarded macro that lets unmodified references to {@code name} resolve to {@code alias}. */
    public static String shim(String name, String alias) {
        return """
                #if !defined(%1$s)
                #define %1$s %2$s
                #endif
                """
                .formatted(name, alias);
    }
}
