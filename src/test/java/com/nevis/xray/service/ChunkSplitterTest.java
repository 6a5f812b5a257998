package com.nevis.xray.service;

import com.nevis.xray.model.Chunk;
import com.nevis.xray.model.SourceText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkSplitterTest {

    @Test
    @DisplayName("100,000 bytes read to 40% become two chunks of 25,000 and 15,000 bytes")
    void shouldSplitFortyPercentOfHundredThousandBytesIntoTwoChunks() {
        SourceText source = SourceText.of("a".repeat(100_000));
        ChunkSplitter splitter = new ChunkSplitter(25_000);

        long targetByte = ChunkSplitter.alignBackward(source, source.length() * 40 / 100);
        List<Chunk> chunks = splitter.split(source, 0, targetByte);

        assertThat(targetByte).isEqualTo(40_000);
        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).byteLength()).isEqualTo(25_000);
        assertThat(chunks.get(1).byteLength()).isEqualTo(15_000);
        assertThat(chunks.get(1).startOffset()).isEqualTo(25_000);
        assertThat(chunks.get(1).endOffset()).isEqualTo(40_000);
        assertThat(chunks).extracting(Chunk::index).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Chunk boundaries never split a multi-byte character and cover the range exactly")
    void shouldKeepMultiByteCharactersIntact() {
        String text = "约翰走进了房间。Mary said hello. 他笑了。".repeat(40);
        SourceText source = SourceText.of(text);
        ChunkSplitter splitter = new ChunkSplitter(10);

        List<Chunk> chunks = splitter.split(source, 0, source.length());

        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        long expectedStart = 0;
        for (Chunk chunk : chunks) {
            assertThat(chunk.startOffset()).isEqualTo(expectedStart);
            assertThat(chunk.byteLength()).isBetween(1L, 10L);
            if (chunk.endOffset() < source.length()) {
                assertThat(ChunkSplitter.isContinuation(source.read(chunk.endOffset(), chunk.endOffset() + 1)[0])).isFalse();
            }
            joined.writeBytes(chunk.text().getBytes(StandardCharsets.UTF_8));
            expectedStart = chunk.endOffset();
        }
        assertThat(expectedStart).isEqualTo(source.length());
        assertThat(joined.toString(StandardCharsets.UTF_8)).isEqualTo(text);
    }

    @Test
    @DisplayName("Chunks carry absolute offsets when the range starts mid-document")
    void shouldUseAbsoluteOffsetsForResumedRange() {
        SourceText source = SourceText.of("x".repeat(1_000));
        ChunkSplitter splitter = new ChunkSplitter(300);

        List<Chunk> chunks = splitter.split(source, 400, 1_000);

        assertThat(chunks).extracting(Chunk::startOffset).containsExactly(400L, 700L);
        assertThat(chunks).extracting(Chunk::endOffset).containsExactly(700L, 1_000L);
    }

    @Test
    void shouldReturnNoChunksForEmptyRange() {
        SourceText source = SourceText.of("abc");
        ChunkSplitter splitter = new ChunkSplitter(16);

        assertThat(splitter.split(source, 2, 2)).isEmpty();
        assertThat(splitter.split(source, 3, 1)).isEmpty();
        assertThat(splitter.split(SourceText.of(""), 0, 0)).isEmpty();
    }

    @Test
    void shouldAlignOffsetsToCharacterBoundaries() {
        // "a" + U+7EA6 (3 bytes: E7 BA A6) + "b"
        SourceText source = SourceText.of("a约b");

        assertThat(ChunkSplitter.alignBackward(source, 2)).isEqualTo(1);
        assertThat(ChunkSplitter.alignBackward(source, 3)).isEqualTo(1);
        assertThat(ChunkSplitter.alignForward(source, 2)).isEqualTo(4);
        assertThat(ChunkSplitter.alignForward(source, 1)).isEqualTo(1);
        assertThat(ChunkSplitter.alignBackward(source, 99)).isEqualTo(source.length());
    }

    @Test
    void shouldStripControlCharacters() {
        SourceText source = SourceText.of("line\u0001one\nline\ttwo\u001F");
        ChunkSplitter splitter = new ChunkSplitter(1_024);

        List<Chunk> chunks = splitter.split(source, 0, source.length());

        assertThat(chunks).singleElement()
            .extracting(Chunk::text)
            .isEqualTo("lineone\nline\ttwo");
    }

    @Test
    void shouldRejectTinyChunkSize() {
        assertThatThrownBy(() -> new ChunkSplitter(3))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
