package io.github.c2port.analyzer;

import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.MigrationException.IoFailureException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One C unit of a feature: its path, its declaration tree and the C root its declaration ranges resolve against.
 * The tree is the state; every change to it must be followed by {@link #save()}.
 */
public final class TranslationUnit {
    private static final Logger logger = LogManager.getLogger(TranslationUnit.class);

    private final Path path;
    private final Path cRoot;
    private final TranslationUnitDecl tree;

    public TranslationUnit(Path path, Path cRoot, TranslationUnitDecl tree) {
        this.path = path.toAbsolutePath().normalize();
        this.cRoot = cRoot.toAbsolutePath().normalize();
        this.tree = Objects.requireNonNull(tree);
    }

    /** {@code unit} with its extension replaced by {@code extension}. */
    public static Path sibling(Path unit, String extension) {
        var fileName = unit.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        var stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return unit.resolveSibling(stem + "." + extension);
    }

    public Path path() {
        return path;
    }

    public Path cRoot() {
        return cRoot;
    }

    public String hash() {
        return Objects.requireNonNull(tree.hash(), "a loaded unit always carries its content hash");
    }

    public TranslationUnitDecl tree() {
        return tree;
    }

    public List<Decl> decls() {
        return tree.inner();
    }

    /**
     * The functions and variables that get translated one by one: functions with a body, and variables that are
     * not bare {@code extern} declarations. One per name, in source order; among variables of the same name the one
     * with an initializer wins.
     */
    public List<LinkageDecl> definitions() {
        var byName = new LinkedHashMap<String, LinkageDecl>();
        for (Decl decl : decls()) {
            if (!(decl instanceof LinkageDecl linkage) || decl.isImplicit() || !decl.isDefinition()) {
                continue;
            }
            byName.merge(
                    linkage.name(),
                    linkage,
                    (old, candidate) -> candidate.hasInit() && !old.hasInit() ? candidate : old);
        }
        return new ArrayList<>(byName.values());
    }

    /** The C text of {@code decl} as it is handed to translation: alias-resolved, with its body. */
    public String sourceText(Decl decl) throws InvalidStateException, IoFailureException {
        return SourceExtractor.toSourceText(decl, cRoot, false);
    }

    public void save() throws IoFailureException {
        SidecarCache.save(tree, SidecarCache.sidecarFor(path));
    }

    public Path residualHeaderPath() {
        return sibling(path, "h");
    }

    /** Rewrites the header holding every declaration that has not been committed yet. */
    public void writeResidualHeader() throws InvalidStateException, IoFailureException {
        var header = residualHeaderPath();
        var content = CSourceRenderer.renderResidual(decls(), cRoot);
        try {
            Files.writeString(header, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IoFailureException(header, e);
        }
        logger.debug("Wrote residual header {}", header);
    }

    @Override
    public String toString() {
        return "TranslationUnit[" + cRoot.relativize(path) + "]";
    }
}
