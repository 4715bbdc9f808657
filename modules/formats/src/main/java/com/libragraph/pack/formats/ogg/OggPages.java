package com.libragraph.pack.formats.ogg;

import com.libragraph.pack.util.AnchorScanner;
import org.apache.commons.compress.utils.ByteUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Ogg page header layout and accessors.
 *
 * <pre>
 * 0  "OggS"         4  version        5  header flags   6  granule (8)
 * 14 serial (4)     18 sequence (4)   22 checksum (4)   26 segment count
 * 27 segment table
 * </pre>
 */
public final class OggPages {

    public static final byte[] CAPTURE_PATTERN = "OggS".getBytes(StandardCharsets.US_ASCII);

    public static final int VERSION_OFFSET = 4;
    public static final int FLAGS_OFFSET = 5;
    public static final int GRANULE_OFFSET = 6;
    public static final int SERIAL_OFFSET = 14;
    public static final int SEQUENCE_OFFSET = 18;
    public static final int CHECKSUM_OFFSET = 22;
    public static final int SEGMENT_COUNT_OFFSET = 26;
    public static final int HEADER_SIZE = 27;

    /** Header flag of the first page of a logical stream. */
    public static final int FLAG_BEGINNING_OF_STREAM = 0x02;

    private OggPages() {
    }

    public static boolean hasMarkerAt(byte[] data, int pos) {
        return AnchorScanner.matchesAt(data, pos, CAPTURE_PATTERN);
    }

    /**
     * Length of the page at {@code pos} from its segment table, or -1 if the
     * header or segment table is incomplete.
     */
    public static int pageLength(byte[] data, int pos) {
        if (pos < 0 || pos + HEADER_SIZE > data.length) {
            return -1;
        }
        int segments = data[pos + SEGMENT_COUNT_OFFSET] & 0xFF;
        if (pos + HEADER_SIZE + segments > data.length) {
            return -1;
        }
        int length = HEADER_SIZE + segments;
        for (int i = 0; i < segments; i++) {
            length += data[pos + HEADER_SIZE + i] & 0xFF;
        }
        return length;
    }

    public static long storedChecksum(byte[] data, int pos) {
        return ByteUtils.fromLittleEndian(data, pos + CHECKSUM_OFFSET, 4);
    }

    /**
     * True if the page at {@code [pos, pos + length)} fits in {@code data} and
     * its stored checksum matches.
     */
    public static boolean checksumValid(byte[] data, int pos, int length) {
        if (pos < 0 || length < HEADER_SIZE || pos + length > data.length) {
            return false;
        }
        return storedChecksum(data, pos) == OggCrc.pageChecksum(data, pos, length);
    }

    /**
     * Recomputes and stores the checksum of the page at {@code [pos, pos + length)}, in place.
     */
    public static void writeChecksum(byte[] data, int pos, int length) {
        ByteUtils.toLittleEndian(data, OggCrc.pageChecksum(data, pos, length), pos + CHECKSUM_OFFSET, 4);
    }

    /**
     * Returns a copy of {@code data} with the first page's checksum recomputed.
     * Data without a complete first page at offset 0 is copied unchanged.
     */
    public static byte[] rewriteChecksum(byte[] data) {
        byte[] copy = Arrays.copyOf(data, data.length);
        if (hasMarkerAt(copy, 0)) {
            int length = pageLength(copy, 0);
            if (length > 0 && length <= copy.length) {
                writeChecksum(copy, 0, length);
            }
        }
        return copy;
    }
}
