package com.libragraph.pack.formats.ogg;

import org.apache.commons.compress.utils.ByteUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Builds small Ogg Vorbis streams for tests: a 58-byte first page carrying
 * the identification packet, then a second page.
 */
public final class TestOggPages {

    public static final int SERIAL = 0x1234ABCD;

    private TestOggPages() {
    }

    /** 30-byte Vorbis identification packet: stereo, 44.1 kHz. */
    public static byte[] identificationPacket() {
        byte[] packet = new byte[30];
        packet[0] = 0x01;
        System.arraycopy("vorbis".getBytes(StandardCharsets.US_ASCII), 0, packet, 1, 6);
        // version 0 at 7..10
        packet[11] = 2;
        ByteUtils.toLittleEndian(packet, 44100, 12, 4);
        ByteUtils.toLittleEndian(packet, 128000, 20, 4);
        packet[28] = (byte) 0xB8;
        packet[29] = 0x01;
        return packet;
    }

    public static byte[] firstPage() {
        byte[] page = header(0x02, 0, new int[]{30});
        byte[] out = Arrays.copyOf(page, page.length + 30);
        System.arraycopy(identificationPacket(), 0, out, page.length, 30);
        OggPages.writeChecksum(out, 0, out.length);
        return out;
    }

    public static byte[] secondPage() {
        byte[] payload = "comment header payload".getBytes(StandardCharsets.US_ASCII);
        byte[] page = header(0x00, 1, new int[]{payload.length});
        byte[] out = Arrays.copyOf(page, page.length + payload.length);
        System.arraycopy(payload, 0, out, page.length, payload.length);
        OggPages.writeChecksum(out, 0, out.length);
        return out;
    }

    /** First page followed by second page. */
    public static byte[] stream() {
        byte[] first = firstPage();
        byte[] second = secondPage();
        byte[] out = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, out, first.length, second.length);
        return out;
    }

    public static byte[] concat(byte[]... parts) {
        int total = 0;
        for (byte[] part : parts) {
            total += part.length;
        }
        byte[] out = new byte[total];
        int pos = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, out, pos, part.length);
            pos += part.length;
        }
        return out;
    }

    private static byte[] header(int flags, int sequence, int[] segments) {
        byte[] page = new byte[OggPages.HEADER_SIZE + segments.length];
        System.arraycopy(OggPages.CAPTURE_PATTERN, 0, page, 0, 4);
        page[OggPages.FLAGS_OFFSET] = (byte) flags;
        ByteUtils.toLittleEndian(page, SERIAL, OggPages.SERIAL_OFFSET, 4);
        ByteUtils.toLittleEndian(page, sequence, OggPages.SEQUENCE_OFFSET, 4);
        page[OggPages.SEGMENT_COUNT_OFFSET] = (byte) segments.length;
        for (int i = 0; i < segments.length; i++) {
            page[OggPages.HEADER_SIZE + i] = (byte) segments[i];
        }
        return page;
    }
}
