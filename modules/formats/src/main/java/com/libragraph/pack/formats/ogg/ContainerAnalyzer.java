package com.libragraph.pack.formats.ogg;

import com.libragraph.pack.util.AnchorScanner;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Classifies buffers that should contain an Ogg Vorbis stream.
 *
 * A buffer is {@link ContainerStatus#VALID} when it starts with a version-0
 * page whose checksum verifies, or whose layout matches a Vorbis first page
 * (BOS flag, "vorbis" right after the segment table, second page 58 to 70
 * bytes in). Stale checksums alone do not make a buffer invalid.
 */
public class ContainerAnalyzer {

    static final byte[] CODEC_ID = "vorbis".getBytes(StandardCharsets.US_ASCII);

    /** Size of the canonical Vorbis first page: 27-byte header, 1 lacing byte, 30-byte packet. */
    static final int FIRST_PAGE_SIZE = 58;

    private static final int CODEC_ID_WINDOW_START = 25;
    private static final int CODEC_ID_WINDOW_END = 35;
    private static final int SECOND_PAGE_WINDOW_END = 70;

    public ContainerAnalysis analyze(byte[] data) {
        if (data.length < OggPages.CAPTURE_PATTERN.length) {
            return new ContainerAnalysis(ContainerStatus.NO_MARKER_FOUND, -1, -1, -1, false,
                    "Data too short for analysis (" + data.length + " bytes)");
        }

        List<Integer> markers = AnchorScanner.findAll(data, OggPages.CAPTURE_PATTERN);
        int codecId = AnchorScanner.indexOf(data, CODEC_ID, 0);
        boolean sane = isStructureSane(data);

        if (markers.isEmpty()) {
            return new ContainerAnalysis(ContainerStatus.NO_MARKER_FOUND, -1, -1, codecId, sane,
                    "No capture pattern found");
        }

        int first = markers.get(0);
        int second = markers.size() > 1 ? markers.get(1) : -1;

        if (first == 0) {
            if (data.length > OggPages.VERSION_OFFSET && data[OggPages.VERSION_OFFSET] == 0) {
                if (isFirstPageChecksumValid(data)) {
                    return new ContainerAnalysis(ContainerStatus.VALID, first, second, codecId, sane,
                            "Valid first page with correct checksum");
                }
                if (sane) {
                    return new ContainerAnalysis(ContainerStatus.VALID, first, second, codecId, true,
                            "Valid first page layout (checksum does not match)");
                }
            }
            return new ContainerAnalysis(ContainerStatus.CORRUPTED_HEADER, first, second, codecId, sane,
                    "Capture pattern at 0 but the first page header is damaged");
        }

        int versionAt = first + OggPages.VERSION_OFFSET;
        if (versionAt < data.length && data[versionAt] == 0 && isValidFirstPage(withLeadingMarker(data))) {
            return new ContainerAnalysis(ContainerStatus.MISSING_LEADING_MARKER, first, second, codecId, sane,
                    "Leading capture pattern missing, first page is intact after it");
        }
        return new ContainerAnalysis(ContainerStatus.CORRUPTED_HEADER, first, second, codecId, sane,
                "First capture pattern at " + first + " and the first page is damaged");
    }

    /**
     * True if {@code data} starts with a version-0 page that is either
     * checksum-valid or structurally sane.
     */
    boolean isValidFirstPage(byte[] data) {
        return OggPages.hasMarkerAt(data, 0)
                && data.length > OggPages.VERSION_OFFSET
                && data[OggPages.VERSION_OFFSET] == 0
                && (isFirstPageChecksumValid(data) || isStructureSane(data));
    }

    /**
     * Checksum check of the page at 0, first over the canonical 58 bytes, then
     * over the length given by its segment table.
     */
    static boolean isFirstPageChecksumValid(byte[] data) {
        if (data.length < OggPages.HEADER_SIZE) {
            return false;
        }
        if (data.length >= FIRST_PAGE_SIZE && OggPages.checksumValid(data, 0, FIRST_PAGE_SIZE)) {
            return true;
        }
        int length = OggPages.pageLength(data, 0);
        return length > 0 && OggPages.checksumValid(data, 0, length);
    }

    static boolean isStructureSane(byte[] data) {
        if (data.length < FIRST_PAGE_SIZE || !OggPages.hasMarkerAt(data, 0)) {
            return false;
        }
        if (data[OggPages.VERSION_OFFSET] != 0 || data[OggPages.FLAGS_OFFSET] != OggPages.FLAG_BEGINNING_OF_STREAM) {
            return false;
        }
        return containedIn(data, CODEC_ID, CODEC_ID_WINDOW_START, CODEC_ID_WINDOW_END)
                && containedIn(data, OggPages.CAPTURE_PATTERN, FIRST_PAGE_SIZE, SECOND_PAGE_WINDOW_END);
    }

    /** True if {@code pattern} occurs entirely inside {@code [from, to)}. */
    private static boolean containedIn(byte[] data, byte[] pattern, int from, int to) {
        int pos = AnchorScanner.indexOf(data, pattern, from, to);
        return pos >= 0 && pos + pattern.length <= to;
    }

    static byte[] withLeadingMarker(byte[] data) {
        byte[] out = new byte[OggPages.CAPTURE_PATTERN.length + data.length];
        System.arraycopy(OggPages.CAPTURE_PATTERN, 0, out, 0, OggPages.CAPTURE_PATTERN.length);
        System.arraycopy(data, 0, out, OggPages.CAPTURE_PATTERN.length, data.length);
        return out;
    }
}
