package io.github.c2port.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DeclNormalizerTest {

    private static SourceLocation at(long offset, int line, String presumedFile, Integer presumedLine) {
        return SourceLocation.of(new BareLocation(offset, "unit.c", line, 1, 1, presumedFile, presumedLine));
    }

    private static VarDecl variable(String name, String init) {
        return new VarDecl(name, at(0, 1, null, null), null, null, init, false, false, null);
    }

    @Test
    void initializedVariableWinsOverEarlierDeclarations() {
        var first = variable("limit", null);
        var initialized = variable("limit", "c");
        var other = variable("other", null);
        List<Decl> decls = new ArrayList<>(List.of(first, initialized, other));

        DeclNormalizer.collapseDuplicateVariables(decls);
        DeclNormalizer.pruneImplicit(decls);

        assertEquals(List.of(initialized, other), decls);
    }

    @Test
    void firstVariableWinsWhenNoneIsInitialized() {
        var first = variable("limit", null);
        var second = variable("limit", null);
        List<Decl> decls = new ArrayList<>(List.of(first, second));

        DeclNormalizer.collapseDuplicateVariables(decls);

        assertFalse(first.isImplicit());
        assertTrue(second.isImplicit());
    }

    @Test
    void missingPresumedLocationIsInheritedFromPreviousSibling() {
        var previous = variable("a", null);
        previous.relocate(at(0, 10, "src/a.c", 3), new SourceRange(at(0, 10, "src/a.c", 3), at(4, 10, "src/a.c", 3)));
        var target = variable("b", null);
        target.relocate(at(20, 12, null, null), new SourceRange(at(20, 12, null, null), at(24, 12, null, null)));

        DeclNormalizer.backfillLocations(new ArrayList<>(List.of(previous, target)));

        var loc = target.loc().expansionLoc();
        assertEquals("src/a.c", loc.presumedFile());
        assertEquals(5, loc.presumedLine());
        assertEquals(5, target.range().end().expansionLoc().presumedLine());
        assertEquals(20, loc.offset());
    }
}
