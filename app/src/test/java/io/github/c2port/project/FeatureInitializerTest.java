package io.github.c2port.project;

import static org.junit.jupiter.api.Assertions.*;

import io.github.c2port.MigrationException.ExternalToolException;
import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.analyzer.Aliases;
import io.github.c2port.analyzer.ContentHash;
import io.github.c2port.testutil.FeatureFixture;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FeatureInitializerTest {
    static final String MAIN = """
            static int helper(void) { return 1; }
            int main(void) { return helper(); }
            """;

    @TempDir
    Path root;

    private FeatureFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new FeatureFixture(root);
    }

    private FeatureInitializer initializer() throws Exception {
        return new FeatureInitializer(fixture.feature(), fixture.loader(), fixture.toolchain());
    }

    @Test
    void createsOneModulePerUnitAndOneStubPerDefinition() throws Exception {
        var unit = fixture.unit("main.c2rust", MAIN);
        var alias = Aliases.aliasFor(ContentHash.of(unit), "helper");

        var report = initializer().initialize();

        assertEquals(List.of("main"), report.modules());
        assertEquals(2, report.stubs());

        var rust = fixture.cRoot().resolveSibling("rust");
        assertTrue(Files.readString(rust.resolve("Cargo.toml")).endsWith("[lib]\ncrate-type = [\"cdylib\"]\n"));
        assertEquals("// generated by c2port\n\nmod types;\nuse types::*;\n\nmod main;\n",
                Files.readString(rust.resolve("src/lib.rs")));

        var module = rust.resolve("src/main");
        assertEquals("// generated by c2port\n\nmod " + alias + ";\nmod main;\n",
                Files.readString(module.resolve("mod.rs")));
        assertEquals("", Files.readString(module.resolve(alias + ".rs")));
        assertEquals("", Files.readString(module.resolve("main.rs")));
        assertEquals("extern int " + alias + "(void) { return 1; }", Files.readString(module.resolve(alias + ".c")));
        assertEquals("int main(void) { return helper(); }", Files.readString(module.resolve("main.c")));

        var header = Files.readString(fixture.cRoot().resolve("main.h"));
        assertTrue(header.contains("#define helper " + alias), header);
        assertTrue(Files.exists(rust.resolve("src/types.h")));
        assertTrue(Files.exists(rust.resolve("src/types.rs")));
        assertFalse(Files.exists(fixture.cRoot().resolveSibling("rust_old")));
    }

    @Test
    void staticVariableWithoutInitializerGetsAStub() throws Exception {
        var unit = fixture.unit("state.c2rust", "static int counter;\nint get(void) { return counter; }\n");
        var alias = Aliases.aliasFor(ContentHash.of(unit), "counter");

        var report = initializer().initialize();

        assertEquals(2, report.stubs());
        var module = fixture.cRoot().resolveSibling("rust").resolve("src/state");
        assertEquals("", Files.readString(module.resolve(alias + ".rs")));
        assertEquals("extern int " + alias + ";", Files.readString(module.resolve(alias + ".c")));
        assertTrue(Files.readString(module.resolve("mod.rs")).contains("mod " + alias + ";\n"));
    }

    @Test
    void bindgenRunsOnTheConsolidatedHeader() throws Exception {
        fixture.unit("main.c2rust", MAIN);
        initializer().initialize();

        var bindgen = fixture.toolchain().commands().stream()
                .filter(c -> c.get(0).equals("bindgen"))
                .findFirst()
                .orElseThrow();
        assertEquals(List.of("bindgen", "src/types.h", "-o", "src/types.rs", "--no-layout-tests",
                "--default-enum-style", "consts", "--disable-nested-struct-naming"), bindgen);
    }

    @Test
    void reinitializingReplacesTheProject() throws Exception {
        fixture.unit("main.c2rust", MAIN);
        initializer().initialize();
        var rust = fixture.cRoot().resolveSibling("rust");
        Files.writeString(rust.resolve("src/main/main.rs"), "pub fn main() {}\n");

        initializer().initialize();

        assertEquals("", Files.readString(rust.resolve("src/main/main.rs")));
        assertFalse(Files.exists(fixture.cRoot().resolveSibling("rust_old")));
    }

    @Test
    void failedBindingGenerationRestoresThePreviousProject() throws Exception {
        fixture.unit("main.c2rust", MAIN);
        var rust = Files.createDirectories(fixture.cRoot().resolveSibling("rust"));
        Files.writeString(rust.resolve("marker"), "previous");
        fixture.toolchain().setFailBindgen(true);

        var e = assertThrows(ExternalToolException.class, () -> initializer().initialize());

        assertTrue(e.getOutput().contains("types.h"), e.getOutput());
        assertEquals("previous", Files.readString(rust.resolve("marker")));
        assertFalse(Files.exists(rust.resolve("src")));
        assertFalse(Files.exists(fixture.cRoot().resolveSibling("rust_old")));
    }

    @Test
    void failedScaffoldLeavesNoProjectBehind() throws Exception {
        fixture.unit("main.c2rust", MAIN);
        fixture.toolchain().setFailScaffold(true);

        assertThrows(ExternalToolException.class, () -> initializer().initialize());

        assertFalse(Files.exists(fixture.cRoot().resolveSibling("rust")));
        assertEquals(0, fixture.toolchain().clang().invocations());
    }

    @Test
    void featureWithoutCSourcesCannotBeOpened() {
        assertThrows(InvalidStateException.class, () -> fixture.feature());
        assertThrows(InvalidStateException.class,
                () -> Feature.open(MigrationConfig.defaults(root), "../escape"));
    }
}
