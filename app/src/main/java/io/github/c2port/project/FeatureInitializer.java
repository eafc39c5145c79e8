package io.github.c2port.project;

import io.github.c2port.MigrationException;
import io.github.c2port.MigrationException.IoFailureException;
import io.github.c2port.analyzer.LinkageDecl;
import io.github.c2port.analyzer.TranslationUnit;
import io.github.c2port.analyzer.TranslationUnitLoader;
import io.github.c2port.util.CommandRunner;
import io.github.c2port.util.Environment;
import io.github.c2port.util.FileUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the Rust project of a feature from scratch: a {@code cdylib} crate with one module per unit, one empty stub
 * plus the extracted C text per translatable declaration, and type bindings generated from all units.
 *
 * <p>An existing project is moved aside first and only removed once the new one is complete; any failure restores
 * it.
 */
public final class FeatureInitializer {
    private static final Logger logger = LogManager.getLogger(FeatureInitializer.class);

    static final String GENERATED_BANNER = "// generated by c2port\n\n";
    static final String CDYLIB_SECTION = "\n[lib]\ncrate-type = [\"cdylib\"]\n";

    private final Feature feature;
    private final TranslationUnitLoader loader;
    private final CommandRunner runner;

    /**
     * Outcome of an initialization.
     *
     * @param modules module names in unit order
     * @param stubs number of per-declaration stubs written
     */
    public record InitReport(List<String> modules, int stubs) {}

    public FeatureInitializer(Feature feature, TranslationUnitLoader loader, CommandRunner runner) {
        this.feature = feature;
        this.loader = loader;
        this.runner = runner;
    }

    public InitReport initialize() throws MigrationException {
        logger.info("Initializing feature {}", feature.name());
        var rust = feature.rustDir();
        var backup = feature.dir().resolve("rust_old");
        moveAside(rust, backup);

        InitReport report;
        try (var guard = new RollbackGuard("initialization of " + feature.name(), () -> restore(rust, backup))) {
            scaffold();
            var units = new ArrayList<TranslationUnit>();
            for (Path path : feature.units()) {
                units.add(loader.load(path));
            }
            report = writeModules(units);
            generateTypes(units);
            guard.disarm();
        }
        if (Files.exists(backup) && !FileUtil.deleteRecursively(backup)) {
            logger.warn("Could not remove backup {}", backup);
        }
        logger.info("Feature {} initialized: {} modules, {} stubs", feature.name(), report.modules().size(),
                report.stubs());
        return report;
    }

    private static void moveAside(Path rust, Path backup) throws IoFailureException {
        try {
            if (Files.exists(backup)) {
                logger.warn("Removing stale backup {}", backup);
                FileUtil.deleteTree(backup);
            }
            if (Files.exists(rust)) {
                Files.move(rust, backup);
                logger.info("Backed up existing {} to {}", rust.getFileName(), backup.getFileName());
            }
        } catch (IOException e) {
            throw new IoFailureException("Failed to back up " + rust, e);
        }
    }

    private static void restore(Path rust, Path backup) {
        FileUtil.deleteRecursively(rust);
        if (!Files.exists(backup)) {
            return;
        }
        try {
            Files.move(backup, rust);
            logger.info("Restored {} from backup", rust.getFileName());
        } catch (IOException e) {
            logger.warn("Failed to restore {} from {}", rust, backup, e);
        }
    }

    private void scaffold() throws MigrationException {
        var cargo = feature.config().cargo();
        Environment.runChecked(runner, feature.dir(), List.of(cargo, "new", "--lib", "rust"));
        var manifest = feature.rustDir().resolve("Cargo.toml");
        try {
            Files.writeString(manifest, CDYLIB_SECTION, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new IoFailureException(manifest, e);
        }
    }

    private InitReport writeModules(List<TranslationUnit> units) throws MigrationException {
        var crateRoot = new StringBuilder(GENERATED_BANNER).append("mod types;\nuse types::*;\n\n");
        var modules = new ArrayList<String>();
        int stubs = 0;
        for (TranslationUnit unit : units) {
            var moduleName = feature.layout().moduleName(unit.path());
            var moduleDir = feature.moduleDir(unit.path());
            var index = new StringBuilder(GENERATED_BANNER);
            try {
                Files.createDirectories(moduleDir);
                for (LinkageDecl decl : unit.definitions()) {
                    Files.writeString(moduleDir.resolve(decl.name() + ".rs"), "");
                    Files.writeString(moduleDir.resolve(decl.name() + ".c"), unit.sourceText(decl),
                            StandardCharsets.UTF_8);
                    index.append(RustIdentifiers.modDeclaration(decl.name(), false));
                    stubs++;
                }
                Files.writeString(moduleDir.resolve("mod.rs"), index.toString(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IoFailureException(moduleDir, e);
            }
            unit.writeResidualHeader();
            crateRoot.append(RustIdentifiers.modDeclaration(moduleName, true));
            modules.add(moduleName);
            logger.debug("Module {}: {} declarations", moduleName, unit.definitions().size());
        }
        var lib = feature.rustSrc().resolve("lib.rs");
        try {
            Files.writeString(lib, crateRoot.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IoFailureException(lib, e);
        }
        return new InitReport(List.copyOf(modules), stubs);
    }

    private void generateTypes(List<TranslationUnit> units) throws MigrationException {
        var header = feature.rustSrc().resolve("types.h");
        try {
            Files.writeString(header, TypesHeader.render(units), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IoFailureException(header, e);
        }
        Environment.runChecked(
                runner,
                feature.rustDir(),
                List.of(feature.config().bindgen(),
                        "src/types.h",
                        "-o",
                        "src/types.rs",
                        "--no-layout-tests",
                        "--default-enum-style",
                        "consts",
                        "--disable-nested-struct-naming"));
    }
}
