package io.github.c2port.merge;

import static io.github.c2port.merge.ASTTraversalUtils.extractNodeText;
import static io.github.c2port.merge.ASTTraversalUtils.field;
import static io.github.c2port.merge.ASTTraversalUtils.namedChildren;

import io.github.c2port.MigrationException.ParseException;
import io.github.c2port.merge.RustItem.ForeignBlock;
import io.github.c2port.merge.RustItem.ForeignEntry;
import io.github.c2port.merge.RustItem.Import;
import io.github.c2port.merge.RustItem.InnerAttribute;
import io.github.c2port.merge.RustItem.ItemKind;
import io.github.c2port.merge.RustItem.Plain;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterRust;

/**
 * Splits a Rust file into {@link RustItem}s using tree-sitter. Files with syntax errors are rejected: merging text
 * the parser could not make sense of would only move the error somewhere harder to find.
 *
 * <p>Not thread-safe; the underlying parser is reused between calls.
 */
public final class RustSourceParser {
    private final TSParser parser;

    public RustSourceParser() {
        parser = new TSParser();
        parser.setLanguage(new TreeSitterRust());
    }

    public List<RustItem> parse(String fileName, String source) throws ParseException {
        var tree = parser.parseString(null, source);
        var root = tree.getRootNode();
        if (root.hasError()) {
            throw new ParseException("%s is not valid Rust".formatted(fileName));
        }
        var content = SourceContent.of(source);
        var items = new ArrayList<RustItem>();
        int leadingStart = -1;
        for (TSNode node : namedChildren(root)) {
            var type = node.getType();
            if ("attribute_item".equals(type) || ASTTraversalUtils.isComment(node)) {
                if (leadingStart < 0) {
                    leadingStart = node.getStartByte();
                }
                continue;
            }
            var leading = leadingStart < 0 ? "" : content.substringFromBytes(leadingStart, node.getStartByte());
            leadingStart = -1;
            items.add(readItem(node, leading, content));
        }
        if (leadingStart >= 0) {
            var trailing = content.substringFromBytes(leadingStart, content.byteLength()).strip();
            items.add(new Plain(ItemKind.OTHER, null, trailing, trailing));
        }
        return items;
    }

    private static RustItem readItem(TSNode node, String leading, SourceContent content) {
        var text = leading + content.substringFrom(node);
        return switch (node.getType()) {
            case "inner_attribute_item" -> new InnerAttribute(text.strip());
            case "use_declaration" -> new Import(text, importPaths(node, content));
            case "foreign_mod_item" -> readForeignBlock(node, leading, content);
            case "function_item" -> plain(ItemKind.FUNCTION, node, leading, content);
            case "static_item" -> plain(ItemKind.STATIC, node, leading, content);
            default -> new Plain(ItemKind.OTHER, nameOf(node, content), text, text);
        };
    }

    private static Plain plain(ItemKind kind, TSNode node, String leading, SourceContent content) {
        var text = leading + content.substringFrom(node);
        var visibility = ASTTraversalUtils.firstChildOfType(node, "visibility_modifier");
        var withoutVisibility = text;
        if (visibility != null) {
            var before = content.substringFromBytes(node.getStartByte(), visibility.getStartByte());
            var after = content.substringFromBytes(visibility.getEndByte(), node.getEndByte()).stripLeading();
            withoutVisibility = leading + before + after;
        }
        return new Plain(kind, nameOf(node, content), text, withoutVisibility);
    }

    private static @Nullable String nameOf(TSNode node, SourceContent content) {
        var name = field(node, "name");
        return name == null ? null : extractNodeText(name, content);
    }

    private static RustItem readForeignBlock(TSNode node, String leading, SourceContent content) {
        var body = field(node, "body");
        if (body == null) {
            // `extern "C";` declares nothing
            var text = leading + content.substringFrom(node);
            return new Plain(ItemKind.OTHER, null, text, text);
        }
        var header = content.substringFromBytes(node.getStartByte(), body.getStartByte()).strip();
        var entries = new ArrayList<ForeignEntry>();
        int entryLeadingStart = -1;
        for (TSNode child : namedChildren(body)) {
            if ("attribute_item".equals(child.getType()) || ASTTraversalUtils.isComment(child)) {
                if (entryLeadingStart < 0) {
                    entryLeadingStart = child.getStartByte();
                }
                continue;
            }
            int start = entryLeadingStart < 0 ? child.getStartByte() : entryLeadingStart;
            entryLeadingStart = -1;
            var text = content.substringFromBytes(start, child.getEndByte()).strip();
            boolean function = "function_signature_item".equals(child.getType());
            entries.add(new ForeignEntry(nameOf(child, content), function, text));
        }
        return new ForeignBlock(leading, header, entries);
    }

    /** Flattens the tree of a {@code use} declaration into full paths. */
    static List<String> importPaths(TSNode useDeclaration, SourceContent content) {
        var paths = new ArrayList<String>();
        var argument = field(useDeclaration, "argument");
        if (argument != null) {
            flatten(argument, "", content, paths);
        }
        return paths;
    }

    private static void flatten(TSNode node, String prefix, SourceContent content, List<String> out) {
        switch (node.getType()) {
            case "use_wildcard" -> {
                var path = compact(extractNodeText(node, content));
                path = path.substring(0, path.length() - 1);
                if (path.endsWith("::")) {
                    path = path.substring(0, path.length() - 2);
                }
                out.add(join(prefix, path) + (prefix.isEmpty() && path.isEmpty() ? "*" : "::*"));
            }
            case "use_as_clause" -> {
                var path = compact(extractNodeText(field(node, "path"), content));
                var alias = extractNodeText(field(node, "alias"), content);
                out.add(join(prefix, path) + " as " + alias);
            }
            case "scoped_use_list" -> {
                var path = compact(extractNodeText(field(node, "path"), content));
                var list = field(node, "list");
                if (list != null) {
                    flatten(list, join(prefix, path), content, out);
                }
            }
            case "use_list" -> {
                for (TSNode child : namedChildren(node)) {
                    if (!ASTTraversalUtils.isComment(child)) {
                        flatten(child, prefix, content, out);
                    }
                }
            }
            default -> {
                var path = compact(extractNodeText(node, content));
                // `use a::{self}` imports `a` itself
                out.add("self".equals(path) && !prefix.isEmpty() ? prefix : join(prefix, path));
            }
        }
    }

    private static String join(String prefix, String path) {
        if (prefix.isEmpty()) {
            return path;
        }
        return path.isEmpty() ? prefix : prefix + "::" + path;
    }

    private static String compact(String path) {
        return path.replaceAll("\\s+", "");
    }
}
