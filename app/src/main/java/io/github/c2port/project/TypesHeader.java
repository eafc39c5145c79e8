package io.github.c2port.project;

import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.MigrationException.IoFailureException;
import io.github.c2port.analyzer.CSourceRenderer;
import io.github.c2port.analyzer.Decl;
import io.github.c2port.analyzer.SourceExtractor;
import io.github.c2port.analyzer.TranslationUnit;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The consolidated C header the type bindings are generated from: every enum, struct and union (complete or
 * forward), every typedef and every top-level variable of every unit, in unit order and then source order.
 */
public final class TypesHeader {
    private TypesHeader() {}

    enum Category {
        COMPLETE_TAG,
        FORWARD_TAG,
        TYPEDEF,
        VARIABLE
    }

    private record Key(Category category, String id) {}

    public static String render(List<TranslationUnit> units) throws InvalidStateException, IoFailureException {
        var content = new StringBuilder();
        Set<Key> seen = new HashSet<>();
        for (TranslationUnit unit : units) {
            var decls = unit.decls();
            for (int i = 0; i < decls.size(); i++) {
                var decl = decls.get(i);
                var category = categoryOf(decl);
                if (category == null || decl.isImplicit()) {
                    continue;
                }
                var id = decl.name() != null ? decl.name() : CSourceRenderer.lineDirective(decl).orElse("#" + i);
                if (!seen.add(new Key(category, id)) || CSourceRenderer.isEmbedded(decls, i)) {
                    // an embedded tag is emitted with the declaration enclosing it
                    continue;
                }
                content.append(SourceExtractor.toSourceText(decl, unit.cRoot(), false)).append('\n');
            }
        }
        return content.toString();
    }

    static @Nullable Category categoryOf(Decl decl) {
        return switch (decl.kind()) {
            case ENUM, RECORD -> decl.isDefinition() ? Category.COMPLETE_TAG : Category.FORWARD_TAG;
            case TYPEDEF -> Category.TYPEDEF;
            case VARIABLE -> Category.VARIABLE;
            default -> null;
        };
    }
}
