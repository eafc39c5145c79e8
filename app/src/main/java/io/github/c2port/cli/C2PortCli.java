package io.github.c2port.cli;

import io.github.c2port.MigrationException;
import io.github.c2port.analyzer.ClangFrontEnd;
import io.github.c2port.analyzer.TranslationUnitLoader;
import io.github.c2port.merge.RustModuleMerger;
import io.github.c2port.project.DeclarationStateTracker;
import io.github.c2port.project.Feature;
import io.github.c2port.project.FeatureInitializer;
import io.github.c2port.project.MigrationConfig;
import io.github.c2port.util.CommandRunner;
import io.github.c2port.util.ProcessCommandRunner;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "c2port",
        mixinStandardHelpOptions = true,
        description = "Tracks and assembles the declaration-by-declaration migration of a C feature to Rust.")
public final class C2PortCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(C2PortCli.class);

    @CommandLine.Option(names = "--feature", required = true, description = "Name of the feature under .c2rust/.")
    private String feature;

    @CommandLine.Option(
            names = "--root",
            description = "Project root. Defaults to the nearest directory holding .c2rust/, starting from here.")
    @Nullable
    private Path root;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
    private Action action;

    static final class Action {
        @CommandLine.Option(names = "--init", description = "Generate the Rust project, replacing any existing one.")
        boolean init;

        @CommandLine.Option(names = "--update", description = "Reconcile translation state with the Rust files.")
        boolean update;

        @CommandLine.Option(names = "--merge", description = "Merge per-declaration files into one file per module.")
        boolean merge;

        @CommandLine.Option(names = "--status", description = "Show translation progress per module.")
        boolean status;
    }

    private final CommandRunner runner;
    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;

    public C2PortCli() {
        this(ProcessCommandRunner.INSTANCE, System.getenv(), System.out, System.err);
    }

    C2PortCli(CommandRunner runner, Map<String, String> env, PrintStream out, PrintStream err) {
        this.runner = runner;
        this.env = env;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new C2PortCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            run();
            return 0;
        } catch (MigrationException e) {
            logger.debug("Operation failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void run() throws MigrationException {
        var projectRoot = root != null ? root.toAbsolutePath().normalize() : MigrationConfig.discoverRoot(Path.of(""));
        var config = MigrationConfig.load(projectRoot, env);
        var feat = Feature.open(config, feature);
        var loader = new TranslationUnitLoader(new ClangFrontEnd(runner, config.clang(), feat.cRoot()));

        if (action.init) {
            var report = new FeatureInitializer(feat, loader, runner).initialize();
            out.printf("Initialized %d modules with %d declarations%n", report.modules().size(), report.stubs());
        } else if (action.update) {
            var report = new DeclarationStateTracker(feat, loader).update();
            if (report.consistent()) {
                out.println("Already up to date");
            }
            for (var change : report.changes()) {
                for (var repair : change.repairs()) {
                    out.printf("%s::%s %s%n", change.module(), repair.name(),
                            repair.committed() ? "committed" : "reset");
                }
            }
        } else if (action.merge) {
            var report = new RustModuleMerger(feat, runner).merge();
            out.printf("Merged %d modules%n", report.mergedModules().size());
        } else {
            for (var status : new DeclarationStateTracker(feat, loader).status()) {
                out.printf("%s: %d/%d committed%n", status.module(), status.committed(), status.definitions());
                for (String pending : status.pending()) {
                    out.println("  pending " + pending);
                }
            }
        }
    }
}
