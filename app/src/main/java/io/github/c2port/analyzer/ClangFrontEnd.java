package io.github.c2port.analyzer;

import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.MigrationException.IoFailureException;
import io.github.c2port.MigrationException.ParseException;
import io.github.c2port.util.CommandRunner;
import io.github.c2port.util.Environment;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The C front end, run in syntax-check mode to dump a unit's declarations as JSON. It runs from the C root with a
 * relative path so the file names recorded in the dump resolve against that root.
 */
public final class ClangFrontEnd {
    private static final Logger logger = LogManager.getLogger(ClangFrontEnd.class);

    private final CommandRunner runner;
    private final String executable;
    private final Path cRoot;

    public ClangFrontEnd(CommandRunner runner, String executable, Path cRoot) {
        this.runner = runner;
        this.executable = executable;
        this.cRoot = cRoot.toAbsolutePath().normalize();
    }

    public Path cRoot() {
        return cRoot;
    }

    /** Returns the JSON dump of {@code unit}, which must live under the C root. */
    public String dump(Path unit) throws ParseException, InvalidStateException, IoFailureException {
        var absolute = unit.toAbsolutePath().normalize();
        if (!absolute.startsWith(cRoot)) {
            throw new InvalidStateException("Unit %s is outside of %s".formatted(unit, cRoot));
        }
        var relative = cRoot.relativize(absolute);
        var command = List.of(executable, "-xc", "-Xclang", "-ast-dump=json", "-fsyntax-only", relative.toString());
        var result = Environment.run(runner, cRoot, command);
        if (!result.success()) {
            throw new ParseException("%s exited with code %d on %s:\n%s"
                    .formatted(executable, result.exitCode(), relative, result.stderr().strip()));
        }
        logger.debug("Front end dumped {} ({} chars)", relative, result.stdout().length());
        return result.stdout();
    }
}
