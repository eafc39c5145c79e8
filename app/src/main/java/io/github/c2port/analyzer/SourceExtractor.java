package io.github.c2port.analyzer;

import io.github.c2port.MigrationException.InvalidStateException;
import io.github.c2port.MigrationException.IoFailureException;
import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** Maps declaration ranges back to the exact text of the files they were parsed from. */
public final class SourceExtractor {
    private SourceExtractor() {}

    /**
     * Returns the text covered by {@code range}, through the end of its last token, from the file named by the begin
     * expansion location (resolved against {@code root}). Ranges without expansion locations at both ends belong to
     * macro artifacts and yield the empty string. Malformed UTF-8 is replaced, never rejected.
     *
     * <p>The end is token-inclusive: the front end's range end is the start of the last token, so the slice runs to
     * {@code end.offset + tokLen}, not {@code end.offset + 1}.
     */
    public static String extract(Path root, SourceRange range) throws IoFailureException {
        var begin = range.begin().expansionLoc();
        var end = range.end().expansionLoc();
        if (begin == null || end == null) {
            return "";
        }
        long start = begin.offset();
        long stop = end.offset() + Math.max(end.tokLen(), 1);
        return readRange(root.resolve(begin.file()), start, stop);
    }

    /**
     * The declaration's text as it should appear in emitted C: internal-linkage declarations carry their alias, and
     * everything except a function definition gets a terminating semicolon. With {@code terse} a function definition
     * is terminated too.
     */
    public static String toSourceText(Decl decl, Path root, boolean terse)
            throws InvalidStateException, IoFailureException {
        var range = decl.range();
        if (range == null) {
            throw new InvalidStateException("%s has no source range".formatted(decl.kind()));
        }
        var text = extract(root, range);
        if (decl instanceof LinkageDecl linkage && linkage.isStatic() && linkage.alias() != null) {
            text = AliasRewriter.rewrite(linkage, text);
        }
        if (terse || !(decl instanceof FunctionDecl && decl.hasBody())) {
            text = text + ";";
        }
        return text;
    }

    private static String readRange(Path file, long start, long stop) throws IoFailureException {
        try (var channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (start >= size || stop <= start) {
                return "";
            }
            long length = Math.min(stop, size) - start;
            // map only the slice; it becomes unreachable when this call returns
            MappedByteBuffer slice = channel.map(FileChannel.MapMode.READ_ONLY, start, length);
            byte[] bytes = new byte[(int) length];
            slice.get(bytes);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IoFailureException(file, e);
        }
    }
}
