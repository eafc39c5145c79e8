package io.github.c2port.merge;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A top-level item of a translated Rust file, as far as merging needs to know it. Every variant's text includes
 * the outer attributes and comments that directly precede it.
 */
public sealed interface RustItem {

    String text();

    /** A crate-level {@code #![...]} attribute. */
    record InnerAttribute(String text) implements RustItem {}

    /**
     * A {@code use} declaration.
     *
     * @param paths the imported paths, flattened; a glob import ends in {@code ::*}, a renaming one reads
     *     {@code path as alias}
     */
    record Import(String text, List<String> paths) implements RustItem {}

    /**
     * An {@code extern} block.
     *
     * @param leading attributes and comments before the block
     * @param header everything from {@code extern} (or a qualifier before it) up to the opening brace
     */
    record ForeignBlock(String leading, String header, List<ForeignEntry> entries) implements RustItem {
        @Override
        public String text() {
            return ForeignBlockMerger.render(leading, header, entries);
        }
    }

    /** One declaration inside an {@code extern} block. */
    record ForeignEntry(@Nullable String name, boolean function, String text) {}

    enum ItemKind {
        FUNCTION,
        STATIC,
        OTHER
    }

    /**
     * Any other item.
     *
     * @param withoutVisibility the same text with the item's visibility modifier removed
     */
    record Plain(ItemKind kind, @Nullable String name, String text, String withoutVisibility) implements RustItem {}
}
