package io.github.c2port.merge;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/**
 * The UTF-8 bytes of a source text. Tree-sitter reports byte offsets, so node text is cut from the
 * bytes rather than from the string.
 */
public final class SourceContent {
    private static final Logger logger = LogManager.getLogger(SourceContent.class);

    private final byte[] utf8Bytes;

    private SourceContent(byte[] utf8Bytes) {
        this.utf8Bytes = utf8Bytes;
    }

    public static SourceContent of(String src) {
        return new SourceContent(src.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extracts the text between UTF-8 byte offsets [startByte, endByte). Out-of-range requests yield the empty
     * string; an end past the text is truncated.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte || startByte > utf8Bytes.length) {
            logger.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    utf8Bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        int end = Math.min(endByte, utf8Bytes.length);
        return new String(utf8Bytes, startByte, end - startByte, StandardCharsets.UTF_8);
    }

    public String substringFrom(TSNode node) {
        if (node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    public int byteLength() {
        return utf8Bytes.length;
    }
}
