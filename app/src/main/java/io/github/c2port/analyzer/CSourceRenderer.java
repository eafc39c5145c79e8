package io.github.c2port.analyzer;

import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.MigrationException.IoFailureException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Renders a declaration list back to C. Every declaration is preceded by a {@code #line} directive pointing at its
 * original position and followed by its alias shim, if it has one, so that the output compiles and reports
 * diagnostics exactly like the unit it came from.
 */
public final class CSourceRenderer {
    private CSourceRenderer() {}

    /** Renders every code-generating declaration of {@code decls}. */
    public static String render(List<Decl> decls, Path root) throws InvalidStateException, IoFailureException {
        return render(decls, root, decl -> true);
    }

    /** Renders the declarations that have not been committed yet: the C that still has to be compiled as C. */
    public static String renderResidual(List<Decl> decls, Path root)
            throws InvalidStateException, IoFailureException {
        return render(decls, root, decl -> !decl.isCommitted());
    }

    static String render(List<Decl> decls, Path root, Predicate<Decl> include)
            throws InvalidStateException, IoFailureException {
        var content = new StringBuilder();
        for (int i = 0; i < decls.size(); i++) {
            var decl = decls.get(i);
            if (!decl.participatesInCodegen() || !include.test(decl) || isEmittedWithNext(decls, i, include)) {
                continue;
            }
            lineDirective(decl).ifPresent(line -> content.append(line).append('\n'));
            content.append(SourceExtractor.toSourceText(decl, root, false)).append('\n');
            AliasRewriter.shimFor(decl).ifPresent(content::append);
            content.append('\n');
        }
        return content.toString();
    }

    /**
     * The directive for the first line of the declaration's text. The range begin is preferred over the name
     * location because the two differ when a declaration spans several lines.
     */
    public static Optional<String> lineDirective(Decl decl) {
        var range = decl.range();
        if (range != null && range.begin().expansionLoc() != null) {
            return range.begin().lineDirective();
        }
        var loc = decl.loc();
        return loc == null ? Optional.empty() : loc.lineDirective();
    }

    private static boolean isEmittedWithNext(List<Decl> decls, int index, Predicate<Decl> include) {
        return isEmbedded(decls, index)
                && decls.get(index + 1).participatesInCodegen()
                && include.test(decls.get(index + 1));
    }

    /**
     * True when the declaration at {@code index} is part of the text of the declaration that follows it, like the
     * struct in {@code typedef struct {...} T;}. Its text is emitted with the enclosing declaration.
     */
    public static boolean isEmbedded(List<Decl> decls, int index) {
        if (index + 1 >= decls.size()) {
            return false;
        }
        var range = decls.get(index).range();
        var next = decls.get(index + 1).range();
        return range != null && next != null && next.encloses(range);
    }
}
