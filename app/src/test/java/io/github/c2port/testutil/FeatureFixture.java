package io.github.c2port.testutil;

import io.github.c2port.MigrationException;
import io.github.c2port.analyzer.ClangFrontEnd;
import io.github.c2port.analyzer.TranslationUnitLoader;
import io.github.c2port.project.Feature;
import io.github.c2port.project.MigrationConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Lays out {@code .c2rust/<feature>/c/} under a temporary project root and wires a feature to fake tools. */
public final class FeatureFixture {
    public static final String FEATURE = "core";

    private final Path root;
    private final FakeToolchain toolchain = new FakeToolchain();

    public FeatureFixture(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    public FakeToolchain toolchain() {
        return toolchain;
    }

    public Path cRoot() {
        return root.resolve(MigrationConfig.CONFIG_DIR).resolve(FEATURE).resolve("c");
    }

    /** Writes a unit at {@code relativePath} under the C root. */
    public Path unit(String relativePath, String source) throws IOException {
        var path = cRoot().resolve(relativePath);
        Files.createDirectories(path.getParent());
        Files.writeString(path, source, StandardCharsets.UTF_8);
        return path;
    }

    public Feature feature() throws MigrationException {
        return Feature.open(MigrationConfig.defaults(root), FEATURE);
    }

    public TranslationUnitLoader loader() {
        return new TranslationUnitLoader(new ClangFrontEnd(toolchain, "clang", cRoot()));
    }
}
