package io.github.c2port.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.github.c2port.testutil.FeatureFixture;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

public class C2PortCliTest {
    @TempDir
    Path root;

    private FeatureFixture fixture;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new FeatureFixture(root);
        fixture.unit("main.c2rust", """
                static int helper(void) { return 1; }
                int main(void) { return helper(); }
                """);
    }

    private int run(String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        var cli = new C2PortCli(
                fixture.toolchain(),
                Map.of(),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        var commandLine = new CommandLine(cli);
        commandLine.setErr(new PrintWriter(new StringWriter()));
        var full = new String[args.length + 4];
        full[0] = "--root";
        full[1] = root.toString();
        full[2] = "--feature";
        full[3] = FeatureFixture.FEATURE;
        System.arraycopy(args, 0, full, 4, args.length);
        return commandLine.execute(full);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    @Test
    void initReportsModulesAndDeclarations() {
        assertEquals(0, run("--init"));
        assertEquals("Initialized 1 modules with 2 declarations\n", stdout());
    }

    @Test
    void updateReportsEachRepair() throws Exception {
        run("--init");
        Files.writeString(fixture.cRoot().resolveSibling("rust").resolve("src/main/main.rs"), "pub fn main() {}\n");

        assertEquals(0, run("--update"));
        assertEquals("main::main committed\n", stdout());

        assertEquals(0, run("--update"));
        assertEquals("Already up to date\n", stdout());
    }

    @Test
    void statusListsPendingDeclarations() throws Exception {
        run("--init");
        assertEquals(0, run("--status"));
        var lines = stdout().split("\n");
        assertEquals("main: 0/2 committed", lines[0]);
        assertTrue(lines[1].startsWith("  pending _priv_"), lines[1]);
        assertEquals("  pending main", lines[2]);
    }

    @Test
    void mergeReportsMergedModules() {
        run("--init");
        assertEquals(0, run("--merge"));
        assertEquals("Merged 1 modules\n", stdout());
        assertEquals(1, fixture.toolchain().builds());
    }

    @Test
    void migrationFailureExitsWithOne() {
        fixture.toolchain().setFailBindgen(true);
        assertEquals(1, run("--init"));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Error: bindgen"), err.toString());
    }

    @Test
    void unknownFeatureExitsWithOne() {
        var cli = new C2PortCli(fixture.toolchain(), Map.of(), new PrintStream(new ByteArrayOutputStream()),
                new PrintStream(new ByteArrayOutputStream()));
        int exit = new CommandLine(cli).execute("--root", root.toString(), "--feature", "missing", "--status");
        assertEquals(1, exit);
    }

    @Test
    void actionsAreMutuallyExclusive() {
        assertEquals(2, run("--init", "--merge"));
        assertEquals(2, run());
    }
}
