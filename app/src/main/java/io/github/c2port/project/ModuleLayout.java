package io.github.c2port.project;

import com.google.common.base.Joiner;
import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.MigrationException.IoFailureException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Maps every unit of a feature to the name of its Rust module.
 *
 * <p>Names are taken relative to a common prefix, found by descending from the C root as long as a directory holds
 * exactly one entry and that entry is a directory. For {@code c/src/net/http.c2rust} and {@code c/src/util.c2rust}
 * the prefix is {@code c/src} and the modules are {@code net_http} and {@code util}.
 */
public final class ModuleLayout {
    private static final Logger logger = LogManager.getLogger(ModuleLayout.class);

    private final Path prefix;
    private final Map<Path, String> moduleNames;

    private ModuleLayout(Path prefix, Map<Path, String> moduleNames) {
        this.prefix = prefix;
        this.moduleNames = moduleNames;
    }

    public static ModuleLayout of(Path cRoot, List<Path> units) throws InvalidStateException, IoFailureException {
        var prefix = commonPrefix(cRoot);
        var names = new LinkedHashMap<Path, String>();
        var owners = new LinkedHashMap<String, Path>();
        for (Path unit : units) {
            var normalized = unit.toAbsolutePath().normalize();
            var name = moduleNameFor(prefix, normalized);
            var previous = owners.putIfAbsent(name, normalized);
            if (previous != null) {
                throw new InvalidStateException(
                        "Units %s and %s both map to module %s".formatted(previous, normalized, name));
            }
            names.put(normalized, name);
        }
        return new ModuleLayout(prefix, Collections.unmodifiableMap(names));
    }

    static Path commonPrefix(Path cRoot) throws IoFailureException {
        var prefix = cRoot.toAbsolutePath().normalize();
        for (Path child = singleSubdirectory(prefix); child != null; child = singleSubdirectory(prefix)) {
            prefix = child;
        }
        logger.debug("Module names are relative to {}", prefix);
        return prefix;
    }

    private static @Nullable Path singleSubdirectory(Path dir) throws IoFailureException {
        try (Stream<Path> entries = Files.list(dir)) {
            var all = entries.limit(2).toList();
            if (all.size() != 1 || !Files.isDirectory(all.get(0))) {
                return null;
            }
            return all.get(0);
        } catch (IOException e) {
            throw new IoFailureException(dir, e);
        }
    }

    static String moduleNameFor(Path prefix, Path unit) {
        var relative = unit.startsWith(prefix) ? prefix.relativize(unit) : unit.getFileName();
        var segments = new ArrayList<String>();
        for (Path segment : relative) {
            segments.add(segment.toString());
        }
        var last = segments.get(segments.size() - 1);
        int dot = last.lastIndexOf('.');
        if (dot > 0) {
            segments.set(segments.size() - 1, last.substring(0, dot));
        }
        return RustIdentifiers.sanitize(Joiner.on('_').join(segments));
    }

    public Path prefix() {
        return prefix;
    }

    public String moduleName(Path unit) throws InvalidStateException {
        var name = moduleNames.get(unit.toAbsolutePath().normalize());
        if (name == null) {
            throw new InvalidStateException("%s is not a unit of this feature".formatted(unit));
        }
        return name;
    }

    /** Module names in unit order. */
    public List<String> moduleNames() {
        return List.copyOf(moduleNames.values());
    }
}
