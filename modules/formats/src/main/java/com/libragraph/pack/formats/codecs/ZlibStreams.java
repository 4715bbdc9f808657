package com.libragraph.pack.formats.codecs;

import org.apache.commons.compress.compressors.deflate.DeflateCompressorInputStream;
import org.apache.commons.compress.compressors.deflate.DeflateCompressorOutputStream;
import org.apache.commons.compress.compressors.deflate.DeflateParameters;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Zlib (RFC 1950) framing helpers shared by the index and entry codecs.
 */
public final class ZlibStreams {

    /** Deflate compression method in the low nibble of CMF. */
    private static final int CM_DEFLATE = 8;

    private ZlibStreams() {
    }

    /**
     * True if the two bytes at {@code offset} form a zlib header: compression
     * method 8 and {@code (CMF << 8 | FLG)} divisible by 31.
     */
    public static boolean isZlibHeader(byte[] data, int offset) {
        if (offset < 0 || offset + 2 > data.length) {
            return false;
        }
        int cmf = data[offset] & 0xFF;
        int flg = data[offset + 1] & 0xFF;
        if ((cmf & 0x0F) != CM_DEFLATE) {
            return false;
        }
        return ((cmf << 8) | flg) % 31 == 0;
    }

    /**
     * Inflates the zlib stream starting at {@code offset}. Bytes after the end
     * of the stream are ignored.
     *
     * @throws IOException if the stream is truncated or corrupt
     */
    public static byte[] inflate(byte[] data, int offset) throws IOException {
        DeflateParameters parameters = new DeflateParameters();
        parameters.setWithZlibHeader(true);
        try (DeflateCompressorInputStream in = new DeflateCompressorInputStream(
                new ByteArrayInputStream(data, offset, data.length - offset), parameters)) {
            return in.readAllBytes();
        }
    }

    /**
     * Deflates {@code data} into a zlib stream.
     */
    public static byte[] deflate(byte[] data) throws IOException {
        DeflateParameters parameters = new DeflateParameters();
        parameters.setWithZlibHeader(true);
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(data.length / 2, 64));
        try (DeflateCompressorOutputStream deflate = new DeflateCompressorOutputStream(out, parameters)) {
            deflate.write(data);
        }
        return out.toByteArray();
    }
}
