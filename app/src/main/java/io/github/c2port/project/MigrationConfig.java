package io.github.c2port.project;

import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.MigrationException.IoFailureException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Where the project lives and which external tools to run.
 *
 * <p>Values are resolved from built-in defaults, then {@code <root>/.c2rust/c2port.properties}, then environment
 * variables, later sources winning.
 *
 * @param root the project root, the directory holding {@code .c2rust/}
 * @param clang the C front end executable
 * @param bindgen the binding generator executable
 * @param cargo the build tool executable
 * @param unitExtension file extension of the preprocessed units, without the dot
 */
public record MigrationConfig(Path root, String clang, String bindgen, String cargo, String unitExtension) {
    private static final Logger logger = LogManager.getLogger(MigrationConfig.class);

    public static final String CONFIG_DIR = ".c2rust";
    public static final String PROPERTIES_FILE = "c2port.properties";

    public static final String DEFAULT_CLANG = "clang";
    public static final String DEFAULT_BINDGEN = "bindgen";
    public static final String DEFAULT_CARGO = "cargo";
    public static final String DEFAULT_UNIT_EXTENSION = "c2rust";

    public static final String ENV_CLANG = "C2RUST_CLANG";
    public static final String ENV_BINDGEN = "C2PORT_BINDGEN";
    public static final String ENV_CARGO = "C2PORT_CARGO";

    public static MigrationConfig defaults(Path root) {
        return new MigrationConfig(
                root.toAbsolutePath().normalize(),
                DEFAULT_CLANG,
                DEFAULT_BINDGEN,
                DEFAULT_CARGO,
                DEFAULT_UNIT_EXTENSION);
    }

    public static MigrationConfig load(Path root, Map<String, String> env) throws IoFailureException {
        var props = new Properties();
        var file = root.resolve(CONFIG_DIR).resolve(PROPERTIES_FILE);
        if (Files.isRegularFile(file)) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
            } catch (IOException e) {
                throw new IoFailureException(file, e);
            }
            logger.debug("Loaded configuration from {}", file);
        }
        var defaults = defaults(root);
        var unitExtension = pick(env, null, props, "unit.extension", defaults.unitExtension());
        if (unitExtension.startsWith(".")) {
            unitExtension = unitExtension.substring(1);
        }
        return new MigrationConfig(
                defaults.root(),
                pick(env, ENV_CLANG, props, "clang", defaults.clang()),
                pick(env, ENV_BINDGEN, props, "bindgen", defaults.bindgen()),
                pick(env, ENV_CARGO, props, "cargo", defaults.cargo()),
                unitExtension);
    }

    private static String pick(
            Map<String, String> env, @Nullable String envVar, Properties props, String key, String fallback) {
        if (envVar != null) {
            var fromEnv = env.get(envVar);
            if (fromEnv != null && !fromEnv.isBlank()) {
                return fromEnv.strip();
            }
        }
        var fromFile = props.getProperty(key);
        if (fromFile != null && !fromFile.isBlank()) {
            return fromFile.strip();
        }
        return fallback;
    }

    /** Walks up from {@code start} to the first directory that holds a {@code .c2rust/} directory. */
    public static Path discoverRoot(Path start) throws InvalidStateException {
        for (Path dir = start.toAbsolutePath().normalize(); dir != null; dir = dir.getParent()) {
            if (Files.isDirectory(dir.resolve(CONFIG_DIR))) {
                return dir;
            }
        }
        throw new InvalidStateException("No %s directory found in %s or any parent".formatted(CONFIG_DIR, start));
    }

    public Path configDir() {
        return root.resolve(CONFIG_DIR);
    }
}
