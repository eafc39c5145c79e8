package io.github.c2port.util;

import java.util.List;

/**
 * Outcome of one finished subprocess.
 *
 * @param command the command line that was run
 * @param exitCode the process exit status
 * @param stdout everything written to standard output
 * @param stderr everything written to standard error
 */
public record CommandResult(List<String> command, int exitCode, String stdout, String stderr) {

    public boolean success() {
        return exitCode == 0;
    }

    /** Both streams, stderr last, for attaching to error reports. */
    public String combinedOutput() {
        if (stdout.isBlank()) {
            return stderr.strip();
        }
        if (stderr.isBlank()) {
            return stdout.strip();
        }
        return stdout.strip() + "\n" + stderr.strip();
    }
}
