package io.github.c2port.merge;

import io.github.c2port.merge.RustItem.ForeignBlock;
import io.github.c2port.merge.RustItem.ForeignEntry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Combines the {@code extern} blocks of several files into at most one. Function declarations of functions that are
 * defined in the merged module itself are dropped, and of the remaining entries the first one per name wins. The
 * merged block takes the attributes and header of the first block; a header without an ABI gets {@code "C"}.
 */
public final class ForeignBlockMerger {
    private static final String INDENT = "    ";

    private ForeignBlockMerger() {}

    public static Optional<String> merge(List<ForeignBlock> blocks, Set<String> definedFunctions) {
        if (blocks.isEmpty()) {
            return Optional.empty();
        }
        var seen = new HashSet<String>();
        var entries = new ArrayList<ForeignEntry>();
        for (ForeignBlock block : blocks) {
            for (ForeignEntry entry : block.entries()) {
                var name = entry.name();
                if (name == null) {
                    entries.add(entry);
                    continue;
                }
                if (entry.function() && definedFunctions.contains(name)) {
                    continue;
                }
                if (seen.add(name)) {
                    entries.add(entry);
                }
            }
        }
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        var first = blocks.get(0);
        return Optional.of(render(first.leading(), withAbi(first.header()), entries));
    }

    static String withAbi(String header) {
        var trimmed = header.strip();
        return trimmed.endsWith("extern") ? trimmed + " \"C\"" : trimmed;
    }

    static String render(String leading, String header, List<ForeignEntry> entries) {
        var sb = new StringBuilder(leading).append(header).append(" {\n");
        for (ForeignEntry entry : entries) {
            for (String line : entry.text().split("\\R")) {
                sb.append(line.isBlank() ? "" : INDENT + line.strip()).append('\n');
            }
        }
        return sb.append('}').toString();
    }
}
