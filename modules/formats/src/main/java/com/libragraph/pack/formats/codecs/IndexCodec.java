package com.libragraph.pack.formats.codecs;

import com.libragraph.pack.formats.api.Codec;
import com.libragraph.pack.formats.gpk.IndexDecodeException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Codec for the compressed package index (PIDX section).
 *
 * The index is stored with Qt {@code qCompress} framing: a 4-byte big-endian
 * uncompressed size followed by a zlib stream. It may or may not still be
 * enciphered; the loader passes a hint from the signature check, and the codec
 * finds the stream by probing for a zlib header at offset 0 and offset 4,
 * deciphering only when the hinted form has none.
 *
 * The size prefix is informational only; the inflated length wins.
 */
public class IndexCodec implements Codec {

    private static final Logger log = Logger.getLogger(IndexCodec.class);

    /** Length of the big-endian size prefix in front of the zlib stream. */
    public static final int SIZE_PREFIX_LENGTH = 4;

    @Override
    public boolean matches(byte[] header, String name) {
        return probe(header) >= 0 || probe(XorStreamCipher.applyToCopy(header)) >= 0;
    }

    /**
     * Decodes an index whose encryption state is unknown.
     */
    @Override
    public byte[] decode(byte[] input) {
        return decode(input, false);
    }

    /**
     * Decodes the index section.
     *
     * @param raw          index bytes as stored in the package (not modified)
     * @param preDecrypted true when the signature validated without deciphering,
     *                     a hint that the index is stored in plain form
     * @return the inflated entry table
     * @throws IndexDecodeException {@code NO_VALID_STREAM} if no zlib header is
     *                              found, {@code STREAM_CORRUPT} if inflation fails
     */
    public byte[] decode(byte[] raw, boolean preDecrypted) {
        byte[] data = null;
        int start = -1;

        if (preDecrypted) {
            start = probe(raw);
            if (start >= 0) {
                data = raw;
                log.debugf("Index stream found in plain form at offset %d", start);
            }
        }

        if (data == null) {
            byte[] deciphered = XorStreamCipher.applyToCopy(raw);
            start = probe(deciphered);
            if (start >= 0) {
                data = deciphered;
                log.debugf("Index stream found after deciphering at offset %d", start);
            }
        }

        if (data == null) {
            throw new IndexDecodeException(IndexDecodeException.Failure.NO_VALID_STREAM,
                    "no zlib header at offset 0 or " + SIZE_PREFIX_LENGTH
                            + " (" + raw.length + " index bytes, preDecrypted=" + preDecrypted + ")");
        }

        byte[] table;
        try {
            table = ZlibStreams.inflate(data, start);
        } catch (IOException e) {
            throw new IndexDecodeException(IndexDecodeException.Failure.STREAM_CORRUPT,
                    "index stream at offset " + start + " failed to inflate", e);
        }

        if (start == SIZE_PREFIX_LENGTH) {
            long declared = ByteBuffer.wrap(data, 0, SIZE_PREFIX_LENGTH)
                    .order(ByteOrder.BIG_ENDIAN).getInt() & 0xFFFFFFFFL;
            if (declared != table.length) {
                log.debugf("Index size prefix says %d bytes, inflated %d", declared, table.length);
            }
        }
        return table;
    }

    /**
     * Produces an index section in {@code qCompress} framing, optionally enciphered.
     */
    public byte[] encode(byte[] table, boolean encipher) {
        byte[] stream;
        try {
            stream = ZlibStreams.deflate(table);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress index", e);
        }
        byte[] out = new byte[SIZE_PREFIX_LENGTH + stream.length];
        ByteBuffer.wrap(out).order(ByteOrder.BIG_ENDIAN).putInt(table.length);
        System.arraycopy(stream, 0, out, SIZE_PREFIX_LENGTH, stream.length);
        if (encipher) {
            XorStreamCipher.apply(out);
        }
        return out;
    }

    /**
     * Returns the offset of the zlib stream (0 or 4), or -1.
     */
    static int probe(byte[] data) {
        if (ZlibStreams.isZlibHeader(data, 0)) {
            return 0;
        }
        if (ZlibStreams.isZlibHeader(data, SIZE_PREFIX_LENGTH)) {
            return SIZE_PREFIX_LENGTH;
        }
        return -1;
    }
}
