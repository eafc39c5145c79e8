package io.github.c2port.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DeclJsonTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void kindIsTheFrontEndNodeName() throws Exception {
        var loc = SourceLocation.of(new BareLocation(4, "unit.c", 1, 5, 6, null, null));
        var fn = new FunctionDecl("helper", loc, new SourceRange(loc, loc), "static", true, true, false, true,
                "_priv_abc_helper");
        var json = MAPPER.writeValueAsString(new TranslationUnitDecl("abc", List.of(fn)));

        assertTrue(json.contains("\"kind\":\"TranslationUnitDecl\""), json);
        assertTrue(json.contains("\"kind\":\"FunctionDecl\""), json);
        assertFalse(json.contains("presumedFile"), json);

        var back = MAPPER.readValue(json, TranslationUnitDecl.class);
        assertEquals("abc", back.hash());
        var decl = assertInstanceOf(FunctionDecl.class, back.inner().get(0));
        assertTrue(decl.isStatic());
        assertTrue(decl.isInline());
        assertTrue(decl.isCommitted());
        assertEquals("_priv_abc_helper", decl.alias());
        assertEquals(4, decl.loc().expansionLoc().offset());
    }

    @Test
    void unknownKindsBecomeInertNodes() throws Exception {
        var json = "{\"kind\":\"StaticAssertDecl\",\"id\":\"0x1\",\"inner\":[]}";
        var decl = MAPPER.readValue(json, Decl.class);
        assertInstanceOf(OtherDecl.class, decl);
        assertTrue(decl.isImplicit());
        assertFalse(decl.participatesInCodegen());
    }

    @Test
    void externVariableWithoutInitializerIsNotADefinition() {
        var declaration = new VarDecl("shared", null, null, "extern", null, false, false, null);
        var initialized = new VarDecl("shared", null, null, "extern", "c", false, false, null);
        var plain = new VarDecl("local", null, null, null, null, false, false, null);
        assertFalse(declaration.isDefinition());
        assertTrue(initialized.isDefinition());
        assertTrue(plain.isDefinition());
    }

    @Test
    void aliasedVariableOwnsItsStorage() {
        var aliased = new VarDecl("_priv_abc_counter", null, null, "extern", null, false, false, "_priv_abc_counter");
        assertTrue(aliased.isDefinition());
    }
}
