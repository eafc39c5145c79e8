package io.github.c2port.analyzer;

import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.MigrationException.IoFailureException;
import io.github.c2port.MigrationException.ParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Gives every internal-linkage function and variable of a unit an external-linkage alias, so that each declaration
 * can later be compiled on its own and still link against its siblings.
 *
 * <p>When at least one alias is assigned the unit is rendered with all replacements applied, written beside the
 * original as {@code <stem>.c}, and parsed again; the returned tree's ranges point into that file. Its hash is the
 * hash of the untouched unit, so the sidecar cache keeps matching the original source.
 */
public final class StaticSymbolResolver {
    private static final Logger logger = LogManager.getLogger(StaticSymbolResolver.class);

    /** Parses (and normalizes) a C file into a fresh tree. */
    @FunctionalInterface
    public interface Parser {
        TranslationUnitDecl parse(Path unit) throws ParseException, InvalidStateException, IoFailureException;
    }

    private StaticSymbolResolver() {}

    /** Assigns aliases in place; returns the number assigned. */
    public static int assignAliases(TranslationUnitDecl tree, String unitHash) {
        int assigned = 0;
        for (Decl decl : tree.inner()) {
            if (decl instanceof LinkageDecl linkage && linkage.isStatic() && !decl.isImplicit()) {
                linkage.setAlias(Aliases.aliasFor(unitHash, linkage.name()));
                assigned++;
            }
        }
        return assigned;
    }

    public static TranslationUnitDecl resolve(
            TranslationUnitDecl tree, Path unit, Path cRoot, String unitHash, Parser parser)
            throws ParseException, InvalidStateException, IoFailureException {
        int assigned = assignAliases(tree, unitHash);
        if (assigned == 0) {
            tree.setHash(unitHash);
            return tree;
        }
        var rewritten = TranslationUnit.sibling(unit, "c");
        var content = CSourceRenderer.render(tree.inner(), cRoot);
        try {
            Files.writeString(rewritten, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IoFailureException(rewritten, e);
        }
        logger.debug("Assigned {} aliases in {}, re-parsing {}", assigned, unit.getFileName(), rewritten.getFileName());

        var reparsed = parser.parse(rewritten);
        for (Decl decl : reparsed.inner()) {
            if (decl instanceof LinkageDecl linkage && Aliases.isPrivateAlias(linkage.name())) {
                linkage.setAlias(linkage.name());
            }
        }
        reparsed.setHash(unitHash);
        return reparsed;
    }
}
