package io.github.c2port.project;

import com.google.common.collect.ImmutableSet;

/** Turning C names and paths into Rust module declarations. */
public final class RustIdentifiers {
    private static final ImmutableSet<String> KEYWORDS = ImmutableSet.of(
            "as", "async", "await", "break", "const", "continue", "crate", "dyn", "else", "enum", "extern", "false",
            "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub", "ref", "return",
            "self", "Self", "static", "struct", "super", "trait", "true", "type", "unsafe", "use", "where", "while",
            "abstract", "become", "box", "do", "final", "gen", "macro", "override", "priv", "try", "typeof", "unsized",
            "virtual", "yield");

    /** Keywords that cannot be written as raw identifiers either. */
    private static final ImmutableSet<String> NOT_RAWABLE = ImmutableSet.of("crate", "self", "Self", "super", "_");

    private RustIdentifiers() {}

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    /** Replaces every character that may not appear in an identifier with {@code _}. */
    public static String sanitize(String raw) {
        var sb = new StringBuilder(raw.length() + 1);
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            boolean valid = c == '_' || (c < 128 && Character.isLetterOrDigit(c));
            sb.append(valid ? c : '_');
        }
        if (sb.isEmpty() || Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    /**
     * The {@code mod} item for a module stored in {@code <name>.rs} or {@code <name>/mod.rs}. Keywords are written as
     * raw identifiers; the few that cannot be are renamed and pointed at their file.
     */
    public static String modDeclaration(String name, boolean directory) {
        if (NOT_RAWABLE.contains(name)) {
            var file = directory ? name + "/mod.rs" : name + ".rs";
            return "#[path = \"%s\"]\nmod %s_;\n".formatted(file, name);
        }
        if (isKeyword(name)) {
            return "mod r#" + name + ";\n";
        }
        return "mod " + name + ";\n";
    }
}
