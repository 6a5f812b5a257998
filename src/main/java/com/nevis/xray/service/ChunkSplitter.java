package com.nevis.xray.service;

import com.nevis.xray.config.AnalysisProperties;
import com.nevis.xray.model.Chunk;
import com.nevis.xray.model.TextSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cuts a byte range of a document into size-bounded chunks whose boundaries never
 * fall inside a UTF-8 multi-byte sequence.
 */
@Component
@Slf4j
public class ChunkSplitter {

    public static final int DEFAULT_CHUNK_SIZE = 25_000;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F]");

    private final int chunkSize;

    @Autowired
    public ChunkSplitter(AnalysisProperties properties) {
        this(properties.chunkSize());
    }

    public ChunkSplitter(int chunkSize) {
        if (chunkSize < 4) {
            throw new IllegalArgumentException("Chunk size too small: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    public int chunkSize() {
        return chunkSize;
    }

    /**
     * Splits {@code [start, end)} into chunks. An empty or inverted range yields no chunks.
     */
    public List<Chunk> split(TextSource source, long start, long end) {
        long limit = Math.min(end, source.length());
        if (start < 0 || start >= limit) {
            return Collections.emptyList();
        }

        byte[] range = source.read(start, limit);
        List<Chunk> chunks = new ArrayList<>();
        int position = 0;

        while (position < range.length) {
            int boundary = (int) Math.min((long) position + chunkSize, range.length);
            int candidate = boundary;
            while (candidate > position && candidate < range.length && isContinuation(range[candidate])) {
                candidate--;
            }
            if (candidate == position) {
                // continuation run longer than a chunk, only possible in malformed input
                candidate = boundary;
                while (candidate < range.length && isContinuation(range[candidate])) {
                    candidate++;
                }
            }

            String text = sanitize(range, position, candidate - position);
            chunks.add(new Chunk(chunks.size() + 1, start + position, start + candidate, text));
            position = candidate;
        }

        log.debug("Split [{}, {}) into {} chunks of at most {} bytes", start, limit, chunks.size(), chunkSize);
        return chunks;
    }

    /**
     * Moves {@code offset} back to the nearest lead or ASCII byte.
     */
    public static long alignBackward(TextSource source, long offset) {
        long length = source.length();
        if (offset >= length) {
            return length;
        }
        long aligned = Math.max(0, offset);
        while (aligned > 0 && isContinuation(source.read(aligned, aligned + 1)[0])) {
            aligned--;
        }
        return aligned;
    }

    /**
     * Moves {@code offset} forward past any continuation bytes.
     */
    public static long alignForward(TextSource source, long offset) {
        long length = source.length();
        long aligned = Math.max(0, offset);
        while (aligned < length && isContinuation(source.read(aligned, aligned + 1)[0])) {
            aligned++;
        }
        return Math.min(aligned, length);
    }

    static boolean isContinuation(byte b) {
        return (b & 0xC0) == 0x80;
    }

    static String sanitize(byte[] bytes, int offset, int length) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            CharBuffer decoded = decoder.decode(ByteBuffer.wrap(bytes, offset, length));
            return CONTROL_CHARS.matcher(decoded).replaceAll("");
        } catch (CharacterCodingException e) {
            // unreachable with IGNORE actions
            throw new IllegalStateException("UTF-8 decoding failed", e);
        }
    }
}
