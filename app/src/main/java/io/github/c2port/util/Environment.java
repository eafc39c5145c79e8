package io.github.c2port.util;

import io.github.c2port.MigrationException.ExternalToolException;
import io.github.c2port.MigrationException.IoFailureException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Runs external tools through a {@link CommandRunner} and maps their failures onto migration exceptions. */
public final class Environment {
    private static final Logger logger = LogManager.getLogger(Environment.class);

    private Environment() {}

    /** Runs a command; a nonzero exit is returned to the caller, failing to run at all is an I/O failure. */
    public static CommandResult run(CommandRunner runner, Path workingDirectory, List<String> command)
            throws IoFailureException {
        try {
            return runner.run(workingDirectory, command);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IoFailureException(
                    "Interrupted while running " + command.get(0),
                    new InterruptedIOException(e.getMessage()));
        } catch (IOException e) {
            throw new IoFailureException("Failed to run " + command.get(0), e);
        }
    }

    /** Runs a command and fails with {@link ExternalToolException}, carrying its output, on a nonzero exit. */
    public static CommandResult runChecked(CommandRunner runner, Path workingDirectory, List<String> command)
            throws IoFailureException, ExternalToolException {
        var result = run(runner, workingDirectory, command);
        if (!result.success()) {
            logger.debug("{} failed with exit code {}", command.get(0), result.exitCode());
            throw new ExternalToolException(String.join(" ", command), result.exitCode(), result.combinedOutput());
        }
        return result;
    }
}
