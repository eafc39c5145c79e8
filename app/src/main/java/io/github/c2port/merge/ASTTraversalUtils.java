package io.github.c2port.merge;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Small helpers over tree-sitter nodes, shared by the Rust item readers. */
public final class ASTTraversalUtils {
    private ASTTraversalUtils() {}

    /** Named children of {@code node} in source order. */
    public static List<TSNode> namedChildren(TSNode node) {
        var result = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (child != null && !child.isNull()) {
                result.add(child);
            }
        }
        return result;
    }

    /** The first direct child of the given type, named or not. */
    public static @Nullable TSNode firstChildOfType(TSNode node, String type) {
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (child != null && !child.isNull() && type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return child == null || child.isNull() ? null : child;
    }

    /** Text of {@code node}, trimmed; empty for a missing node. */
    public static String extractNodeText(@Nullable TSNode node, SourceContent sourceContent) {
        if (node == null || node.isNull()) {
            return "";
        }
        return sourceContent.substringFrom(node).trim();
    }

    public static boolean isComment(TSNode node) {
        var type = node.getType();
        return "line_comment".equals(type) || "block_comment".equals(type);
    }
}
