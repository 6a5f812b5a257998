package com.nevis.xray.model;

/**
 * Read-only access to the UTF-8 bytes of a document. The engine never knows how the
 * bytes were extracted, only that a range read is contiguous.
 */
public interface TextSource {

    long length();

    /**
     * @param from inclusive byte offset
     * @param to   exclusive byte offset
     */
    byte[] read(long from, long to);
}
