package com.libragraph.pack.util.buffer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class SliceBinaryDataTest {

    @TempDir
    Path tempDir;

    private Path writeFile(String content) throws Exception {
        Path file = tempDir.resolve("slice.bin");
        Files.writeString(file, content, StandardCharsets.US_ASCII);
        return file;
    }

    @Test
    void shouldExposeOnlyTheWindow() throws Exception {
        Path file = writeFile("headerPAYLOADtrailer");

        try (SliceBinaryData slice = SliceBinaryData.open(file, 6, 7)) {
            assertThat(slice.size()).isEqualTo(7);
            assertThat(slice.offset()).isEqualTo(6);
            assertThat(new String(slice.readAll(), StandardCharsets.US_ASCII)).isEqualTo("PAYLOAD");
        }
    }

    @Test
    void shouldStopAtWindowEnd() throws Exception {
        Path file = writeFile("0123456789");

        try (SliceBinaryData slice = SliceBinaryData.open(file, 2, 3)) {
            ByteBuffer dst = ByteBuffer.allocate(10);
            int n = slice.read(dst);

            assertThat(n).isEqualTo(3);
            assertThat(slice.read(dst)).isEqualTo(-1);
            dst.flip();
            assertThat(StandardCharsets.US_ASCII.decode(dst).toString()).isEqualTo("234");
        }
    }

    @Test
    void shouldSeekRelativeToWindow() throws Exception {
        Path file = writeFile("0123456789");

        try (SliceBinaryData slice = SliceBinaryData.open(file, 4, 6)) {
            assertThat(slice.readFully(2, 2)).containsExactly('6', '7');
            assertThat(slice.position()).isEqualTo(4);
        }
    }

    @Test
    void shouldReportEofPastBackingFile() throws Exception {
        Path file = writeFile("0123");

        try (SliceBinaryData slice = SliceBinaryData.open(file, 2, 10)) {
            assertThatThrownBy(slice::readAll)
                    .isInstanceOf(java.io.EOFException.class);
        }
    }

    @Test
    void shouldRejectNegativeWindow() throws Exception {
        Path file = writeFile("0123");

        assertThatThrownBy(() -> SliceBinaryData.open(file, -1, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
