package io.github.c2port.project;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a cleanup action when closed unless {@link #disarm()} was called first. Meant for try-with-resources around a
 * multi-step operation whose partial results must not survive a failure.
 */
public final class RollbackGuard implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RollbackGuard.class);

    private final String description;
    private final Runnable rollback;
    private boolean armed = true;

    public RollbackGuard(String description, Runnable rollback) {
        this.description = description;
        this.rollback = rollback;
    }

    /** Marks the guarded operation as successful; closing the guard does nothing afterwards. */
    public void disarm() {
        armed = false;
    }

    public boolean isArmed() {
        return armed;
    }

    @Override
    public void close() {
        if (!armed) {
            return;
        }
        armed = false;
        logger.info("Rolling back {}", description);
        try {
            rollback.run();
        } catch (RuntimeException e) {
            logger.warn("Rollback of {} failed", description, e);
        }
    }
}
