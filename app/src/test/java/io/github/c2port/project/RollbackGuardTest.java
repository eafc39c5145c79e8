package io.github.c2port.project;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

public class RollbackGuardTest {

    @Test
    void rollsBackWhenLeftArmed() {
        var rollbacks = new AtomicInteger();
        assertThrows(IllegalStateException.class, () -> {
            try (var guard = new RollbackGuard("test", rollbacks::incrementAndGet)) {
                throw new IllegalStateException("step failed");
            }
        });
        assertEquals(1, rollbacks.get());
    }

    @Test
    void disarmedGuardDoesNothing() {
        var rollbacks = new AtomicInteger();
        try (var guard = new RollbackGuard("test", rollbacks::incrementAndGet)) {
            guard.disarm();
            assertFalse(guard.isArmed());
        }
        assertEquals(0, rollbacks.get());
    }

    @Test
    void failingRollbackDoesNotMaskTheOriginalError() {
        var e = assertThrows(IllegalStateException.class, () -> {
            try (var guard = new RollbackGuard("test", () -> {
                throw new IllegalArgumentException("rollback failed");
            })) {
                throw new IllegalStateException("step failed");
            }
        });
        assertEquals("step failed", e.getMessage());
    }

    @Test
    void rollbackRunsOnce() {
        var rollbacks = new AtomicInteger();
        var guard = new RollbackGuard("test", rollbacks::incrementAndGet);
        guard.close();
        guard.close();
        assertEquals(1, rollbacks.get());
    }
}
