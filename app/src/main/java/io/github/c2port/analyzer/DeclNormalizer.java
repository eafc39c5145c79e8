package io.github.c2port.analyzer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Normalization passes run on a freshly parsed unit, in this order: presumed-location back-fill, duplicate variable
 * collapsing, implicit-node pruning. None of them can fail.
 */
public final class DeclNormalizer {
    private static final Logger logger = LogManager.getLogger(DeclNormalizer.class);

    private DeclNormalizer() {}

    public static void normalize(TranslationUnitDecl unit) {
        backfillLocations(unit.inner());
        collapseDuplicateVariables(unit.inner());
        pruneImplicit(unit.inner());
    }

    /**
     * The dumper only prints a presumed file/line when it differs from the previously printed one, so a declaration
     * may lack the {@code #line} attribution its predecessor carries. Such a declaration inherits it from its
     * immediately preceding sibling, shifted by the physical line distance between the two.
     */
    static void backfillLocations(List<Decl> decls) {
        for (int i = 1; i < decls.size(); i++) {
            if (!(decls.get(i) instanceof LocatedDecl target) || !(decls.get(i - 1) instanceof LocatedDecl source)) {
                continue;
            }
            var loc = backfill(target.loc(), source.loc());
            var range = new SourceRange(
                    backfill(target.range().begin(), source.range().begin()),
                    backfill(target.range().end(), source.range().end()));
            target.relocate(loc, range);
        }
    }

    private static SourceLocation backfill(SourceLocation target, SourceLocation source) {
        return new SourceLocation(
                backfill(target.spellingLoc(), source.spellingLoc()),
                backfill(target.expansionLoc(), source.expansionLoc()));
    }

    private static @Nullable BareLocation backfill(@Nullable BareLocation target, @Nullable BareLocation source) {
        if (target == null || source == null || target.presumedFile() != null) {
            return target;
        }
        if (source.presumedFile() == null || source.presumedLine() == null) {
            return target;
        }
        return target.withPresumed(source.presumedFile(), source.presumedLine() + (target.line() - source.line()));
    }

    /**
     * Among variables sharing a name, the one with an initializer is canonical, or the first one if none has an
     * initializer. All others become implicit and are pruned afterwards.
     */
    static void collapseDuplicateVariables(List<Decl> decls) {
        Map<String, VarDecl> canonical = new HashMap<>();
        for (Decl decl : decls) {
            if (!(decl instanceof VarDecl var) || var.isImplicit()) {
                continue;
            }
            var current = canonical.get(var.name());
            if (current == null || (!current.hasInit() && var.hasInit())) {
                canonical.put(var.name(), var);
            }
        }
        for (Decl decl : decls) {
            if (decl instanceof VarDecl var && !var.isImplicit() && canonical.get(var.name()) != var) {
                logger.debug("Dropping redundant declaration of variable {}", var.name());
                var.setImplicit(true);
            }
        }
    }

    static void pruneImplicit(List<Decl> decls) {
        decls.removeIf(Decl::isImplicit);
    }
}
