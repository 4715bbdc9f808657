package com.libragraph.pack.formats.gpk;

import org.apache.commons.compress.utils.ByteUtils;

import java.nio.charset.StandardCharsets;

/**
 * The fixed 23-byte little-endian record that follows each entry name.
 *
 * <pre>
 * subVersion:u16 version:u16 zero:u16 offset:u32 compressedLength:u32
 * tag:4 bytes uncompressedLength:u32 subHeaderLength:u8
 * </pre>
 */
public record EntryRecord(
        int subVersion,
        int version,
        int zero,
        long offset,
        long compressedLength,
        String tag,
        long uncompressedLength,
        int subHeaderLength
) {

    public static final int SIZE = 23;

    /** Tag of entries stored as a 4-byte size prefix followed by a zlib stream. */
    public static final String DEFLATE_TAG = "DFLT";

    /**
     * Decodes the record at {@code pos}. The caller guarantees 23 bytes are available.
     */
    public static EntryRecord parse(byte[] data, int pos) {
        return new EntryRecord(
                (int) ByteUtils.fromLittleEndian(data, pos, 2),
                (int) ByteUtils.fromLittleEndian(data, pos + 2, 2),
                (int) ByteUtils.fromLittleEndian(data, pos + 4, 2),
                ByteUtils.fromLittleEndian(data, pos + 6, 4),
                ByteUtils.fromLittleEndian(data, pos + 10, 4),
                new String(data, pos + 14, 4, StandardCharsets.ISO_8859_1),
                ByteUtils.fromLittleEndian(data, pos + 18, 4),
                data[pos + 22] & 0xFF);
    }

    /**
     * Encodes this record into 23 bytes.
     */
    public byte[] toBytes() {
        byte[] out = new byte[SIZE];
        ByteUtils.toLittleEndian(out, subVersion, 0, 2);
        ByteUtils.toLittleEndian(out, version, 2, 2);
        ByteUtils.toLittleEndian(out, zero, 4, 2);
        ByteUtils.toLittleEndian(out, offset, 6, 4);
        ByteUtils.toLittleEndian(out, compressedLength, 10, 4);
        byte[] tagBytes = tag.getBytes(StandardCharsets.ISO_8859_1);
        System.arraycopy(tagBytes, 0, out, 14, Math.min(4, tagBytes.length));
        ByteUtils.toLittleEndian(out, uncompressedLength, 18, 4);
        out[22] = (byte) subHeaderLength;
        return out;
    }

    /** Absolute end offset of the entry data. */
    public long end() {
        return offset + compressedLength;
    }

    /** True if the stored bytes are a size prefix plus zlib stream. */
    public boolean isCompressed() {
        return DEFLATE_TAG.equals(tag) && uncompressedLength > 0;
    }
}
