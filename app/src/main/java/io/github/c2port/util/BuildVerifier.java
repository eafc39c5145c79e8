package io.github.c2port.util;

import io.github.c2port.MigrationException.ExternalToolException;
import io.github.c2port.MigrationException.IoFailureException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the build tool over the generated project to check that it still compiles. A failure is reported with the
 * tool's complete diagnostic output; only the log line is shortened.
 */
public final class BuildVerifier {
    private static final Logger logger = LogManager.getLogger(BuildVerifier.class);

    /** Maximum number of output lines echoed to the log */
    public static final int MAX_OUTPUT_LINES = 80;

    /**
     * Result of a build.
     *
     * @param success true if the build exited with code 0
     * @param exitCode the exit code
     * @param output stdout and stderr combined, unmodified
     */
    public record VerificationResult(boolean success, int exitCode, String output) {}

    private BuildVerifier() {}

    public static VerificationResult verify(CommandRunner runner, Path projectDir, String buildTool)
            throws IoFailureException {
        logger.info("Running {} build in {} to verify compilation", buildTool, projectDir);
        var result = Environment.run(runner, projectDir, List.of(buildTool, "build"));
        if (result.success()) {
            logger.info("Build succeeded");
        } else {
            logger.info("Build failed with exit code {}:\n{}", result.exitCode(), boundOutput(result.combinedOutput()));
        }
        return new VerificationResult(result.success(), result.exitCode(), result.combinedOutput());
    }

    /** Same as {@link #verify} but turns a failed build into an {@link ExternalToolException}. */
    public static void requireSuccess(CommandRunner runner, Path projectDir, String buildTool)
            throws IoFailureException, ExternalToolException {
        var result = verify(runner, projectDir, buildTool);
        if (!result.success()) {
            throw new ExternalToolException(buildTool + " build", result.exitCode(), result.output());
        }
    }

    static String boundOutput(String fullOutput) {
        if (fullOutput.isBlank()) {
            return "";
        }
        String[] split = fullOutput.split("\\R", -1);
        int start = Math.max(0, split.length - MAX_OUTPUT_LINES);
        return Arrays.stream(split, start, split.length).collect(Collectors.joining("\n"));
    }
}
