package com.nevis.xray.model;

/**
 * A contiguous slice of the source text sent in one provider call.
 *
 * @param index       1-based position within the session
 * @param startOffset inclusive byte offset into the source
 * @param endOffset   exclusive byte offset into the source
 * @param text        sanitized text, safe for transmission
 */
public record Chunk(
    int index,
    long startOffset,
    long endOffset,
    String text
) {
    public long byteLength() {
        return endOffset - startOffset;
    }
}
