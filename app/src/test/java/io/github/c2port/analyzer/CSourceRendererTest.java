package io.github.c2port.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CSourceRendererTest {
    private static final String SOURCE = "typedef struct point { int x; } point_t;\nint f(void);\n";

    @TempDir
    Path root;

    private static SourceLocation at(long offset, int line, int tokLen) {
        return SourceLocation.of(new BareLocation(offset, "unit.c", line, 1, tokLen, null, null));
    }

    private static List<Decl> decls() {
        // the struct sits inside the typedef's range
        var struct = new RecordDecl("point", at(15, 1, 5), new SourceRange(at(8, 1, 6), at(30, 1, 1)), "struct", true,
                false);
        var typedef = new TypedefDecl("point_t", at(32, 1, 7), new SourceRange(at(0, 1, 7), at(32, 1, 7)),
                "struct point", false);
        var function = new FunctionDecl(
                "f", at(45, 2, 1), new SourceRange(at(41, 2, 3), at(51, 2, 1)), null, false, false, false, false, null);
        return List.of(struct, typedef, function);
    }

    @Test
    void embeddedTagIsEmittedWithItsTypedef() throws Exception {
        Files.writeString(root.resolve("unit.c"), SOURCE);
        var decls = decls();
        assertTrue(CSourceRenderer.isEmbedded(decls, 0));
        assertFalse(CSourceRenderer.isEmbedded(decls, 1));

        assertEquals("""
                #line 1 "unit.c"
                typedef struct point { int x; } point_t;

                #line 2 "unit.c"
                int f(void);

                """, CSourceRenderer.render(decls, root));
    }

    @Test
    void committedDeclarationsLeaveTheResidual() throws Exception {
        Files.writeString(root.resolve("unit.c"), SOURCE);
        var decls = decls();
        ((FunctionDecl) decls.get(2)).setCommitted(true);

        var residual = CSourceRenderer.renderResidual(decls, root);
        assertTrue(residual.contains("point_t;"));
        assertFalse(residual.contains("int f(void)"));
    }

    @Test
    void directiveFollowsPresumedLocation() {
        var loc = SourceLocation.of(new BareLocation(0, "net.c", 7, 1, 3, "src/net.c", 120));
        var decl = new VarDecl("v", loc, new SourceRange(loc, loc), null, null, false, false, null);
        assertEquals("#line 120 \"src/net.c\"", CSourceRenderer.lineDirective(decl).orElseThrow());
    }
}
