package io.github.c2port.project;

import io.github.c2port.MigrationException;
import io.github.c2port.MigrationException.IoFailureException;
import io.github.c2port.analyzer.LinkageDecl;
import io.github.c2port.analyzer.TranslationUnitLoader;
import io.github.c2port.util.FileUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Keeps the recorded translation state of every declaration in line with the Rust files on disk. A declaration is
 * committed exactly when {@code rust/src/<module>/<name>.rs} exists and is not blank.
 */
public final class DeclarationStateTracker {
    private static final Logger logger = LogManager.getLogger(DeclarationStateTracker.class);

    private final Feature feature;
    private final TranslationUnitLoader loader;

    /** A declaration whose recorded state was changed to {@code committed}. */
    public record Repair(String name, boolean committed) {}

    public record UnitChanges(String module, List<Repair> repairs) {}

    public record UpdateReport(List<UnitChanges> changes) {
        /** True if nothing had to be repaired. */
        public boolean consistent() {
            return changes.isEmpty();
        }
    }

    /**
     * Translation progress of one module.
     *
     * @param pending names of the declarations not committed yet, in source order
     */
    public record ModuleStatus(String module, int definitions, int committed, List<String> pending) {}

    public DeclarationStateTracker(Feature feature, TranslationUnitLoader loader) {
        this.feature = feature;
        this.loader = loader;
    }

    /**
     * Repairs every unit whose module directory exists. Changed units are persisted and get their residual header
     * regenerated; running again without touching any Rust file changes nothing.
     */
    public UpdateReport update() throws MigrationException {
        logger.info("Updating translation state of feature {}", feature.name());
        var changes = new ArrayList<UnitChanges>();
        for (Path path : feature.units()) {
            var moduleDir = feature.moduleDir(path);
            if (!Files.isDirectory(moduleDir)) {
                continue;
            }
            var unit = loader.load(path);
            var repairs = new ArrayList<Repair>();
            for (LinkageDecl decl : unit.definitions()) {
                boolean translated = !isBlank(moduleDir.resolve(decl.name() + ".rs"));
                if (decl.isCommitted() != translated) {
                    logger.debug("{}: {} -> committed={}", moduleDir.getFileName(), decl.name(), translated);
                    decl.setCommitted(translated);
                    repairs.add(new Repair(decl.name(), translated));
                }
            }
            if (!repairs.isEmpty()) {
                unit.save();
                unit.writeResidualHeader();
                var module = feature.layout().moduleName(path);
                logger.info("Updated {} declarations in module {}", repairs.size(), module);
                changes.add(new UnitChanges(module, List.copyOf(repairs)));
            }
        }
        if (changes.isEmpty()) {
            logger.info("Feature {} already up to date", feature.name());
        }
        return new UpdateReport(List.copyOf(changes));
    }

    /** Recorded progress per module, without looking at or changing any Rust file. */
    public List<ModuleStatus> status() throws MigrationException {
        var result = new ArrayList<ModuleStatus>();
        for (Path path : feature.units()) {
            var unit = loader.load(path);
            var definitions = unit.definitions();
            var pending = definitions.stream()
                    .filter(d -> !d.isCommitted())
                    .map(LinkageDecl::name)
                    .toList();
            result.add(new ModuleStatus(
                    feature.layout().moduleName(path),
                    definitions.size(),
                    definitions.size() - pending.size(),
                    pending));
        }
        return result;
    }

    private static boolean isBlank(Path file) throws IoFailureException {
        try {
            return FileUtil.isBlank(file);
        } catch (IOException e) {
            throw new IoFailureException(file, e);
        }
    }
}
