package com.libragraph.pack.formats.ogg;

/**
 * The Ogg page checksum: CRC-32 with polynomial {@code 0x04C11DB7}, MSB-first,
 * initial value 0 and no final XOR. Over a page, the 4 checksum bytes
 * (offset 22) count as zero. The value is stored little-endian.
 */
public final class OggCrc {

    private static final int POLYNOMIAL = 0x04C11DB7;
    private static final int[] TABLE = new int[256];

    static {
        for (int i = 0; i < 256; i++) {
            int r = i << 24;
            for (int bit = 0; bit < 8; bit++) {
                r = (r & 0x80000000) != 0 ? (r << 1) ^ POLYNOMIAL : r << 1;
            }
            TABLE[i] = r;
        }
    }

    private OggCrc() {
    }

    /**
     * Plain CRC over {@code length} bytes at {@code offset}.
     */
    public static long compute(byte[] data, int offset, int length) {
        int crc = 0;
        for (int i = offset; i < offset + length; i++) {
            crc = update(crc, data[i]);
        }
        return crc & 0xFFFFFFFFL;
    }

    /**
     * Checksum of the page occupying {@code [offset, offset + length)}, with
     * the checksum field read as zero.
     */
    public static long pageChecksum(byte[] data, int offset, int length) {
        int crc = 0;
        int fieldStart = offset + OggPages.CHECKSUM_OFFSET;
        int fieldEnd = fieldStart + 4;
        for (int i = offset; i < offset + length; i++) {
            crc = update(crc, i >= fieldStart && i < fieldEnd ? 0 : data[i]);
        }
        return crc & 0xFFFFFFFFL;
    }

    private static int update(int crc, int b) {
        return (crc << 8) ^ TABLE[((crc >>> 24) ^ b) & 0xFF];
    }
}
