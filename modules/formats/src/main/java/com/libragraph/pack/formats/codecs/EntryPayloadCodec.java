package com.libragraph.pack.formats.codecs;

import com.libragraph.pack.formats.api.Codec;
import com.libragraph.pack.formats.api.CodecException;
import org.apache.commons.compress.utils.ByteUtils;
import org.jboss.logging.Logger;

import java.io.IOException;

/**
 * Codec for entries tagged {@code DFLT}: a 4-byte little-endian size prefix
 * followed by a zlib stream.
 */
public class EntryPayloadCodec implements Codec {

    private static final Logger log = Logger.getLogger(EntryPayloadCodec.class);

    public static final int SIZE_PREFIX_LENGTH = 4;

    @Override
    public boolean matches(byte[] header, String name) {
        return ZlibStreams.isZlibHeader(header, SIZE_PREFIX_LENGTH);
    }

    @Override
    public byte[] decode(byte[] input) {
        if (input.length < SIZE_PREFIX_LENGTH + 2) {
            throw new CodecException("Compressed entry too short: " + input.length + " bytes");
        }
        byte[] output;
        try {
            output = ZlibStreams.inflate(input, SIZE_PREFIX_LENGTH);
        } catch (IOException e) {
            throw new CodecException("Failed to inflate entry payload", e);
        }
        long declared = ByteUtils.fromLittleEndian(input, 0, SIZE_PREFIX_LENGTH);
        if (declared != output.length) {
            log.debugf("Entry size prefix says %d bytes, inflated %d", declared, output.length);
        }
        return output;
    }
}
