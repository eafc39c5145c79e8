package io.github.c2port.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Both streams are redirected to temporary files so that
 * very large outputs (a front end JSON dump easily runs to hundreds of megabytes) cannot stall the child on a full
 * pipe.
 */
@NullMarked
public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger logger = LogManager.getLogger(ProcessCommandRunner.class);

    public static final ProcessCommandRunner INSTANCE = new ProcessCommandRunner();

    private ProcessCommandRunner() {}

    @Override
    public CommandResult run(Path workingDirectory, List<String> command) throws IOException, InterruptedException {
        logger.debug("Running {} in {}", String.join(" ", command), workingDirectory);
        Path out = Files.createTempFile("c2port-", ".out");
        Path err = Files.createTempFile("c2port-", ".err");
        try {
            Process process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .start();
            int exitCode = process.waitFor();
            var result = new CommandResult(
                    List.copyOf(command),
                    exitCode,
                    new String(Files.readAllBytes(out), StandardCharsets.UTF_8),
                    new String(Files.readAllBytes(err), StandardCharsets.UTF_8));
            logger.debug("{} exited with code {}", command.get(0), exitCode);
            return result;
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
