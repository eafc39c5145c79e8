package io.github.c2port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Any failure that aborts a top-level migration operation. Cache mismatches and normalization are handled
 * internally and never surface as one of these.
 */
public abstract sealed class MigrationException extends Exception {
    protected MigrationException(String message) {
        super(message);
    }

    protected MigrationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** The C front end failed, or its dump (or a target-language file) could not be understood. */
    public static final class ParseException extends MigrationException {
        public ParseException(String message) {
            super(message);
        }

        public ParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** An external tool (binding generator, scaffolder, verifying build) exited unsuccessfully. */
    public static final class ExternalToolException extends MigrationException {
        private final int exitCode;
        private final String output;

        public ExternalToolException(String tool, int exitCode, String output) {
            super("%s failed with exit code %d%s".formatted(tool, exitCode, output.isBlank() ? "" : ":\n" + output));
            this.exitCode = exitCode;
            this.output = output;
        }

        public int getExitCode() {
            return exitCode;
        }

        public String getOutput() {
            return output;
        }
    }

    /** A filesystem operation failed. */
    public static final class IoFailureException extends MigrationException {
        public IoFailureException(String message, IOException cause) {
            super(message + ": " + cause.getMessage(), cause);
        }

        public IoFailureException(Path path, IOException cause) {
            this("I/O failure on " + path, cause);
        }
    }

    /** A structural precondition does not hold, e.g. asking for the text of a node that has no range. */
    public static final class InvalidStateException extends MigrationException {
        public InvalidStateException(String message) {
            super(message);
        }
    }
}
