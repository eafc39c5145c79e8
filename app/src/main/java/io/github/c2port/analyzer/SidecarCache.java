package io.github.c2port.analyzer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.github.c2port.MigrationException.IoFailureException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Persistence of a unit's declaration tree in a JSON file beside the unit.
 *
 * <p>Loading never fails: a missing, unreadable or incompatible file is reported as empty and the caller re-parses.
 * Saving does fail, since a tree that cannot be persisted would lose translation state.
 */
public final class SidecarCache {
    private static final Logger logger = LogManager.getLogger(SidecarCache.class);

    static final int SCHEMA_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private SidecarCache() {}

    /** On-disk form: the tree plus the version of this layout. */
    public record SidecarDto(int schemaVersion, TranslationUnitDecl unit) {}

    /** The sidecar of {@code unit}: same directory, same stem, {@code .json}. */
    public static Path sidecarFor(Path unit) {
        return TranslationUnit.sibling(unit, "json");
    }

    public static void save(TranslationUnitDecl unit, Path file) throws IoFailureException {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(file.toFile(), new SidecarDto(SCHEMA_VERSION, unit));
            logger.debug("Saved declaration tree to {}", file);
        } catch (IOException e) {
            throw new IoFailureException(file, e);
        }
    }

    /** Returns the cached tree, or empty if there is none that this version can read. */
    public static Optional<TranslationUnitDecl> load(Path file) {
        if (!Files.exists(file)) {
            logger.debug("No sidecar cache at {}", file);
            return Optional.empty();
        }
        try {
            var dto = MAPPER.readValue(file.toFile(), SidecarDto.class);
            if (dto.schemaVersion() != SCHEMA_VERSION || dto.unit() == null) {
                logger.warn("Sidecar cache {} has schema version {}, expected {}. Will re-parse.",
                        file, dto.schemaVersion(), SCHEMA_VERSION);
                return Optional.empty();
            }
            return Optional.of(dto.unit());
        } catch (MismatchedInputException mie) {
            logger.warn("Sidecar cache {} appears incompatible ({}). Will re-parse.", file, mie.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("Failed to read sidecar cache {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
