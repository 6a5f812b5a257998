package com.nevis.xray.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public final class SourceText implements TextSource {

    private final byte[] bytes;

    private SourceText(byte[] bytes) {
        this.bytes = bytes;
    }

    public static SourceText of(String text) {
        return new SourceText(text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public long length() {
        return bytes.length;
    }

    @Override
    public byte[] read(long from, long to) {
        if (from < 0 || to > bytes.length || from > to) {
            throw new IndexOutOfBoundsException("Range [" + from + ", " + to + ") outside 0.." + bytes.length);
        }
        return Arrays.copyOfRange(bytes, (int) from, (int) to);
    }
}
