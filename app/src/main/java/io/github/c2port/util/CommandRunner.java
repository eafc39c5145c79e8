package io.github.c2port.util;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs external tools synchronously. This is the only way the analyzer talks to the C front end, the binding
 * generator and the build tool, which lets tests substitute fakes.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Runs {@code command} in {@code workingDirectory} and waits for it to finish. A nonzero exit status is reported
     * through the result, not as an exception; callers decide what failure means.
     *
     * @throws IOException if the process cannot be started or its output cannot be collected
     */
    CommandResult run(Path workingDirectory, List<String> command) throws IOException, InterruptedException;
}
