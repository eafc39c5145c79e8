package io.github.c2port.merge;

import io.github.c2port.merge.RustItem.Import;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops {@code use} declarations that import nothing new. A path is covered when it was imported before, or when a
 * glob over one of its ancestors was; a declaration is dropped only when all of its paths are covered. Globs and
 * renaming imports are only covered by an identical import.
 */
public final class ImportDeduplicator {
    private static final String GLOB = "::*";

    private final Set<String> covered = new HashSet<>();

    public static List<Import> deduplicate(List<Import> imports) {
        var deduplicator = new ImportDeduplicator();
        var retained = new ArrayList<Import>();
        for (Import item : imports) {
            if (deduplicator.offer(item)) {
                retained.add(item);
            }
        }
        return retained;
    }

    /** Returns true if {@code item} is kept, recording its paths as covered. */
    public boolean offer(Import item) {
        if (!item.paths().isEmpty() && item.paths().stream().allMatch(this::isCovered)) {
            return false;
        }
        covered.addAll(item.paths());
        return true;
    }

    boolean isCovered(String path) {
        if (covered.contains(path)) {
            return true;
        }
        if (path.endsWith(GLOB) || path.contains(" as ")) {
            return false;
        }
        var segments = path.split("::");
        var ancestor = new StringBuilder();
        for (int i = 0; i < segments.length - 1; i++) {
            if (i > 0) {
                ancestor.append("::");
            }
            ancestor.append(segments[i]);
            if (covered.contains(ancestor + GLOB)) {
                return true;
            }
        }
        return false;
    }
}
