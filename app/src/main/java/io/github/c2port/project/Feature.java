package io.github.c2port.project;

import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.MigrationException.IoFailureException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A named slice of the project being migrated: the preprocessed units under {@code .c2rust/<name>/c/} and the
 * generated Rust project under {@code .c2rust/<name>/rust/}.
 */
public final class Feature {
    private static final Logger logger = LogManager.getLogger(Feature.class);

    private final MigrationConfig config;
    private final String name;
    private final Path dir;
    private final List<Path> units;
    private final ModuleLayout layout;

    private Feature(MigrationConfig config, String name, Path dir, List<Path> units, ModuleLayout layout) {
        this.config = config;
        this.name = name;
        this.dir = dir;
        this.units = units;
        this.layout = layout;
    }

    /** Scans the feature's C root for units and derives their module names. */
    public static Feature open(MigrationConfig config, String name) throws InvalidStateException, IoFailureException {
        validateName(name);
        var dir = config.configDir().resolve(name);
        var cRoot = dir.resolve("c");
        if (!Files.isDirectory(cRoot)) {
            throw new InvalidStateException("Feature '%s' has no C sources at %s".formatted(name, cRoot));
        }
        var units = scanUnits(cRoot, config.unitExtension());
        logger.debug("Feature {} has {} units", name, units.size());
        return new Feature(config, name, dir, units, ModuleLayout.of(cRoot, units));
    }

    static void validateName(String name) throws InvalidStateException {
        if (name.isBlank() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new InvalidStateException("Invalid feature name '%s'".formatted(name));
        }
    }

    private static List<Path> scanUnits(Path cRoot, String extension) throws IoFailureException {
        var suffix = "." + extension;
        try (Stream<Path> walk = Files.walk(cRoot)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .map(p -> p.toAbsolutePath().normalize())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IoFailureException(cRoot, e);
        }
    }

    public MigrationConfig config() {
        return config;
    }

    public String name() {
        return name;
    }

    /** {@code .c2rust/<name>} */
    public Path dir() {
        return dir;
    }

    public Path cRoot() {
        return dir.resolve("c");
    }

    public Path rustDir() {
        return dir.resolve("rust");
    }

    public Path rustSrc() {
        return rustDir().resolve("src");
    }

    public List<Path> units() {
        return units;
    }

    public ModuleLayout layout() {
        return layout;
    }

    /** The per-declaration directory of a unit's module, present between initialization and merge. */
    public Path moduleDir(Path unit) throws InvalidStateException {
        return rustSrc().resolve(layout.moduleName(unit));
    }

    /** The single file that replaces {@link #moduleDir} after merging. */
    public Path mergedModuleFile(Path unit) throws InvalidStateException {
        return rustSrc().resolve(layout.moduleName(unit) + ".rs");
    }
}
