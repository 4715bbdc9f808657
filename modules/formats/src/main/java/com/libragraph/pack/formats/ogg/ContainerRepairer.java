package com.libragraph.pack.formats.ogg;

import com.libragraph.pack.util.AnchorScanner;
import org.apache.commons.compress.utils.ByteUtils;
import org.jboss.logging.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;

/**
 * Repairs damaged Ogg Vorbis first pages.
 *
 * <ul>
 *   <li>Valid input is returned untouched.</li>
 *   <li>Input missing only its leading "OggS" gets it prepended.</li>
 *   <li>Anything else with a Vorbis identification packet gets a canonical
 *       first page rebuilt in front of the packet, with a fresh checksum.</li>
 * </ul>
 *
 * Every repaired buffer is analyzed again and discarded unless it comes back
 * valid, so repairing twice gives the same bytes as repairing once.
 */
public class ContainerRepairer {

    private static final Logger log = Logger.getLogger(ContainerRepairer.class);

    static final byte[] DEFAULT_SERIAL = {0x2A, 0x00, 0x00, 0x00};

    /** Identification header packet type. */
    static final int IDENTIFICATION_PACKET = 0x01;

    /** Identification packet length: type byte, "vorbis", 23 bytes of fields. */
    static final int IDENTIFICATION_PACKET_SIZE = 30;

    private final ContainerAnalyzer analyzer;

    public ContainerRepairer() {
        this(new ContainerAnalyzer());
    }

    public ContainerRepairer(ContainerAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public byte[] repair(byte[] data) {
        return repairDetailed(data).data();
    }

    public RepairResult repairDetailed(byte[] data) {
        ContainerAnalysis analysis = analyzer.analyze(data);
        OptionalLong checksum = recoverChecksum(data, analysis.firstMarker());

        switch (analysis.status()) {
            case VALID:
                return new RepairResult(data, analysis, RepairAction.NONE, OptionalLong.empty());

            case MISSING_LEADING_MARKER: {
                byte[] repaired = ContainerAnalyzer.withLeadingMarker(data);
                return verified(data, repaired, analysis, RepairAction.PREPENDED_MARKER, checksum);
            }

            default: {
                byte[] rebuilt = reconstruct(data);
                if (rebuilt == null) {
                    log.debugf("Cannot rebuild first page: %s", analysis.description());
                    return new RepairResult(data, analysis, RepairAction.UNREPAIRABLE, checksum);
                }
                return verified(data, rebuilt, analysis, RepairAction.RECONSTRUCTED, checksum);
            }
        }
    }

    private RepairResult verified(byte[] original, byte[] repaired, ContainerAnalysis analysis,
                                  RepairAction action, OptionalLong checksum) {
        ContainerAnalysis check = analyzer.analyze(repaired);
        if (!check.isValid()) {
            log.warnf("Repair (%s) did not produce a valid stream: %s", action, check.description());
            return new RepairResult(original, analysis, RepairAction.UNREPAIRABLE, checksum);
        }
        log.debugf("Repaired %s stream (%s), %d -> %d bytes",
                analysis.status(), action, original.length, repaired.length);
        return new RepairResult(repaired, analysis, action, checksum);
    }

    /**
     * Builds a canonical first page in front of the identification packet, or
     * returns null when no complete packet is present.
     */
    byte[] reconstruct(byte[] data) {
        int codecId = locateCodecId(data);
        int packetBody = IDENTIFICATION_PACKET_SIZE - 1;
        if (codecId < 0 || data.length - codecId < packetBody) {
            return null;
        }

        int pageHeader = OggPages.HEADER_SIZE + 1;
        byte[] out = new byte[pageHeader + 1 + data.length - codecId];
        System.arraycopy(OggPages.CAPTURE_PATTERN, 0, out, 0, OggPages.CAPTURE_PATTERN.length);
        out[OggPages.VERSION_OFFSET] = 0;
        out[OggPages.FLAGS_OFFSET] = OggPages.FLAG_BEGINNING_OF_STREAM;
        // granule, sequence and checksum stay zero
        System.arraycopy(recoverSerial(data), 0, out, OggPages.SERIAL_OFFSET, 4);
        out[OggPages.SEGMENT_COUNT_OFFSET] = 1;
        out[OggPages.HEADER_SIZE] = IDENTIFICATION_PACKET_SIZE;
        out[pageHeader] = IDENTIFICATION_PACKET;
        System.arraycopy(data, codecId, out, pageHeader + 1, data.length - codecId);

        OggPages.writeChecksum(out, 0, ContainerAnalyzer.FIRST_PAGE_SIZE);
        return out;
    }

    /**
     * First "vorbis" preceded by the identification packet type, else the first "vorbis".
     */
    static int locateCodecId(byte[] data) {
        int first = AnchorScanner.indexOf(data, ContainerAnalyzer.CODEC_ID, 0);
        int pos = first;
        while (pos >= 0) {
            if (pos > 0 && data[pos - 1] == IDENTIFICATION_PACKET) {
                return pos;
            }
            pos = AnchorScanner.indexOf(data, ContainerAnalyzer.CODEC_ID, pos + 1);
        }
        return first;
    }

    /**
     * Serial of the first page whose checksum verifies, else of the first
     * marker with room for one, else {@link #DEFAULT_SERIAL}.
     */
    static byte[] recoverSerial(byte[] data) {
        List<Integer> markers = AnchorScanner.findAll(data, OggPages.CAPTURE_PATTERN);
        for (int marker : markers) {
            if (OggPages.checksumValid(data, marker, OggPages.pageLength(data, marker))) {
                return serialAt(data, marker);
            }
        }
        for (int marker : markers) {
            if (marker + OggPages.SERIAL_OFFSET + 4 <= data.length) {
                return serialAt(data, marker);
            }
        }
        return DEFAULT_SERIAL.clone();
    }

    private static byte[] serialAt(byte[] data, int marker) {
        return Arrays.copyOfRange(data, marker + OggPages.SERIAL_OFFSET, marker + OggPages.SERIAL_OFFSET + 4);
    }

    static OptionalLong recoverChecksum(byte[] data, int firstMarker) {
        if (firstMarker < 0 || firstMarker + OggPages.CHECKSUM_OFFSET + 4 > data.length) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(ByteUtils.fromLittleEndian(data, firstMarker + OggPages.CHECKSUM_OFFSET, 4));
    }
}
