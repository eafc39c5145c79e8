package io.github.c2port.analyzer;

import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.MigrationException.IoFailureException;
import io.github.c2port.MigrationException.ParseException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Produces the declaration tree of a unit: from its sidecar cache when the cached hash matches the unit's bytes,
 * otherwise by running the front end, normalizing, resolving internal linkage and caching the result.
 */
public final class TranslationUnitLoader {
    private static final Logger logger = LogManager.getLogger(TranslationUnitLoader.class);

    private final ClangFrontEnd frontEnd;

    public TranslationUnitLoader(ClangFrontEnd frontEnd) {
        this.frontEnd = frontEnd;
    }

    public Path cRoot() {
        return frontEnd.cRoot();
    }

    public TranslationUnit load(Path unit) throws ParseException, InvalidStateException, IoFailureException {
        var hash = ContentHash.of(unit);
        var cached = SidecarCache.load(SidecarCache.sidecarFor(unit));
        if (cached.isPresent() && hash.equals(cached.get().hash())) {
            logger.debug("Cache hit for {}", unit.getFileName());
            return new TranslationUnit(unit, cRoot(), cached.get());
        }
        logger.debug("Cache miss for {}, running the front end", unit.getFileName());

        var tree = parse(unit);
        tree = StaticSymbolResolver.resolve(tree, unit, cRoot(), hash, this::parse);
        var loaded = new TranslationUnit(unit, cRoot(), tree);
        loaded.save();
        return loaded;
    }

    private TranslationUnitDecl parse(Path file) throws ParseException, InvalidStateException, IoFailureException {
        var tree = ClangDumpReader.read(frontEnd.dump(file));
        DeclNormalizer.normalize(tree);
        return tree;
    }
}
