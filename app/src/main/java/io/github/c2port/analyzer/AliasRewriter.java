package io.github.c2port.analyzer;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Text rewriting for internal-linkage declarations: the declared name becomes the alias, {@code static} becomes
 * {@code extern}, and {@code inline} is dropped because an inline function with internal linkage cannot be split
 * into its own unit.
 */
public final class AliasRewriter {
    private static final Pattern STATIC_KEYWORD = Pattern.compile("^static\\s|\\sstatic\\s");
    private static final Pattern INLINE_KEYWORD = Pattern.compile("^inline\\s|\\sinline\\s");

    private AliasRewriter() {}

    /**
     * Rewrites the extracted text of {@code decl}. The name token is located by byte offset relative to the start of
     * the range, so the splice is exact even when the name also occurs elsewhere in the declaration.
     */
    public static String rewrite(LinkageDecl decl, String text) {
        var alias = decl.alias();
        if (alias == null) {
            return text;
        }
        var rewritten = spliceName(decl, text, alias);
        rewritten = replaceFirst(rewritten, STATIC_KEYWORD, " extern ");
        if (decl.isInline()) {
            rewritten = replaceFirst(rewritten, INLINE_KEYWORD, " ");
        }
        return rewritten.startsWith(" ") ? rewritten.substring(1) : rewritten;
    }

    /** The shim that keeps references to the original short name working, if {@code decl} has an alias. */
    public static Optional<String> shimFor(Decl decl) {
        var alias = decl.alias();
        if (alias == null) {
            return Optional.empty();
        }
        return Aliases.originalName(alias).map(name -> Aliases.shim(name, alias));
    }

    private static String spliceName(LinkageDecl decl, String text, String alias) {
        var nameLoc = decl.loc().expansionLoc();
        var begin = decl.range().begin().expansionLoc();
        if (nameLoc == null || begin == null) {
            return text;
        }
        int offset = (int) (nameLoc.offset() - begin.offset());
        int length = nameLoc.tokLen();
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (offset < 0 || length <= 0 || offset + length > bytes.length) {
            return text;
        }
        var before = new String(bytes, 0, offset, StandardCharsets.UTF_8);
        var after = new String(bytes, offset + length, bytes.length - offset - length, StandardCharsets.UTF_8);
        return before + alias + after;
    }

    private static String replaceFirst(String text, Pattern pattern, String replacement) {
        var matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        return text.substring(0, matcher.start()) + replacement + text.substring(matcher.end());
    }
}
