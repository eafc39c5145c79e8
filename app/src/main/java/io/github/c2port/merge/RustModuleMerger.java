package io.github.c2port.merge;

import io.github.c2port.MigrationException;
import io.github.c2port.MigrationException.IoFailureException;
import io.github.c2port.MigrationException.ParseException;
import io.github.c2port.analyzer.Aliases;
import io.github.c2port.merge.RustItem.ForeignBlock;
import io.github.c2port.merge.RustItem.Import;
import io.github.c2port.merge.RustItem.InnerAttribute;
import io.github.c2port.merge.RustItem.ItemKind;
import io.github.c2port.merge.RustItem.Plain;
import io.github.c2port.project.Feature;
import io.github.c2port.project.RustIdentifiers;
import io.github.c2port.util.BuildVerifier;
import io.github.c2port.util.CommandRunner;
import io.github.c2port.util.FileUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Folds each module's per-declaration files into a single {@code <module>.rs}, then checks that the crate still
 * builds. Modules are merged and verified one at a time, so a failing build points at the module just merged.
 */
public final class RustModuleMerger {
    private static final Logger logger = LogManager.getLogger(RustModuleMerger.class);

    private final Feature feature;
    private final CommandRunner runner;
    private final RustSourceParser parser = new RustSourceParser();

    public record MergeReport(List<String> mergedModules) {}

    public RustModuleMerger(Feature feature, CommandRunner runner) {
        this.feature = feature;
        this.runner = runner;
    }

    public MergeReport merge() throws MigrationException {
        logger.info("Merging modules of feature {}", feature.name());
        var merged = new ArrayList<String>();
        for (Path unit : feature.units()) {
            var moduleDir = feature.moduleDir(unit);
            var content = mergeDirectory(moduleDir);
            if (content.isEmpty()) {
                continue;
            }
            var target = feature.mergedModuleFile(unit);
            try {
                Files.writeString(target, content.get(), StandardCharsets.UTF_8);
                FileUtil.deleteTree(moduleDir);
            } catch (IOException e) {
                throw new IoFailureException("Failed to replace " + moduleDir + " with " + target, e);
            }
            var module = feature.layout().moduleName(unit);
            repointCrateRoot(module);
            logger.info("Merged module {}", module);
            merged.add(module);
            BuildVerifier.requireSuccess(runner, feature.rustDir(), feature.config().cargo());
        }
        if (merged.isEmpty()) {
            logger.info("Feature {}: no modules needed merging", feature.name());
        }
        return new MergeReport(List.copyOf(merged));
    }

    /**
     * A module declared with an explicit {@code #[path]} still names {@code <module>/mod.rs} in the crate root; point
     * it at the merged file instead.
     */
    private void repointCrateRoot(String module) throws IoFailureException {
        var directoryForm = RustIdentifiers.modDeclaration(module, true);
        var fileForm = RustIdentifiers.modDeclaration(module, false);
        if (directoryForm.equals(fileForm)) {
            return;
        }
        var lib = feature.rustSrc().resolve("lib.rs");
        try {
            var crateRoot = Files.readString(lib, StandardCharsets.UTF_8);
            Files.writeString(lib, crateRoot.replace(directoryForm, fileForm), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IoFailureException(lib, e);
        }
        logger.debug("Crate root now declares module {} from {}.rs", module, module);
    }

    /** The merged text of a module directory, or empty if it holds no per-declaration files. */
    Optional<String> mergeDirectory(Path moduleDir) throws ParseException, IoFailureException {
        if (!Files.isDirectory(moduleDir)) {
            return Optional.empty();
        }
        List<Path> files;
        try (Stream<Path> list = Files.list(moduleDir)) {
            files = list.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".rs"))
                    .filter(p -> !"mod.rs".equals(p.getFileName().toString()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IoFailureException(moduleDir, e);
        }
        if (files.isEmpty()) {
            return Optional.empty();
        }
        logger.debug("Merging {} files in {}", files.size(), moduleDir.getFileName());
        var parsed = new ArrayList<List<RustItem>>();
        for (Path file : files) {
            String source;
            try {
                source = FileUtil.readStringLossy(file);
            } catch (IOException e) {
                throw new IoFailureException(file, e);
            }
            parsed.add(parser.parse(file.getFileName().toString(), source));
        }
        return Optional.of(mergeItems(parsed));
    }

    /** Merges the items of several files, given in file order. */
    static String mergeItems(List<List<RustItem>> files) {
        var innerAttributes = new LinkedHashSet<String>();
        var imports = new ArrayList<Import>();
        var foreignBlocks = new ArrayList<ForeignBlock>();
        var others = new ArrayList<Plain>();
        Set<String> definedFunctions = new HashSet<>();
        for (List<RustItem> items : files) {
            for (RustItem item : items) {
                if (item instanceof InnerAttribute attribute) {
                    innerAttributes.add(attribute.text());
                } else if (item instanceof Import use) {
                    imports.add(use);
                } else if (item instanceof ForeignBlock block) {
                    foreignBlocks.add(block);
                } else if (item instanceof Plain plain) {
                    if (plain.kind() == ItemKind.FUNCTION && plain.name() != null) {
                        definedFunctions.add(plain.name());
                    }
                    others.add(plain);
                }
            }
        }

        var sections = new ArrayList<String>();
        if (!innerAttributes.isEmpty()) {
            sections.add(String.join("\n", innerAttributes));
        }
        var retained = ImportDeduplicator.deduplicate(imports);
        if (!retained.isEmpty()) {
            sections.add(String.join("\n", retained.stream().map(i -> i.text().strip()).toList()));
        }
        ForeignBlockMerger.merge(foreignBlocks, definedFunctions).ifPresent(sections::add);
        for (Plain plain : others) {
            sections.add(lowerVisibility(plain).strip());
        }
        return String.join("\n\n", sections) + "\n";
    }

    /** Functions and statics carrying an internal alias stay private to the module whatever their file declared. */
    static String lowerVisibility(Plain item) {
        boolean lowerable = item.kind() == ItemKind.FUNCTION || item.kind() == ItemKind.STATIC;
        if (lowerable && item.name() != null && Aliases.isPrivateAlias(item.name())) {
            return item.withoutVisibility();
        }
        return item.text();
    }
}
