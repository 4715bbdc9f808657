package com.libragraph.pack.formats.gpk;

import com.libragraph.pack.formats.codecs.XorStreamCipher;
import org.apache.commons.compress.utils.ByteUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * The 32-byte package trailer: identifier A, the index length, identifier B.
 *
 * <pre>
 * [12 bytes "STKFile0PIDX"][u32 LE index length][16 bytes "STKFile0PACKFILE"]
 * </pre>
 *
 * @param indexLength  length in bytes of the index section right before the trailer
 * @param preDecrypted true when the trailer validated as stored (not enciphered),
 *                     a hint that the index section is stored in plain form too
 */
public record Signature(long indexLength, boolean preDecrypted) {

    public static final int SIZE = 32;

    static final byte[] IDENT_A = "STKFile0PIDX".getBytes(StandardCharsets.US_ASCII);
    static final byte[] IDENT_B = "STKFile0PACKFILE".getBytes(StandardCharsets.US_ASCII);

    private static final int LENGTH_OFFSET = IDENT_A.length;
    private static final int IDENT_B_OFFSET = LENGTH_OFFSET + 4;

    /**
     * Parses a trailer, trying the deciphered form first and the stored form second.
     *
     * @param trailer the last 32 bytes of the package (not modified)
     * @return the signature, or empty if neither form carries both identifiers
     */
    public static Optional<Signature> read(byte[] trailer) {
        if (trailer.length != SIZE) {
            return Optional.empty();
        }

        byte[] deciphered = XorStreamCipher.applyToCopy(trailer);
        if (hasIdentifiers(deciphered)) {
            return Optional.of(new Signature(indexLength(deciphered), false));
        }
        if (hasIdentifiers(trailer)) {
            return Optional.of(new Signature(indexLength(trailer), true));
        }
        return Optional.empty();
    }

    /**
     * Builds a stored trailer for the given index length.
     */
    public static byte[] encode(long indexLength, boolean encipher) {
        byte[] trailer = new byte[SIZE];
        System.arraycopy(IDENT_A, 0, trailer, 0, IDENT_A.length);
        ByteUtils.toLittleEndian(trailer, indexLength, LENGTH_OFFSET, 4);
        System.arraycopy(IDENT_B, 0, trailer, IDENT_B_OFFSET, IDENT_B.length);
        if (encipher) {
            XorStreamCipher.apply(trailer);
        }
        return trailer;
    }

    private static boolean hasIdentifiers(byte[] trailer) {
        return Arrays.equals(trailer, 0, IDENT_A.length, IDENT_A, 0, IDENT_A.length)
                && Arrays.equals(trailer, IDENT_B_OFFSET, SIZE, IDENT_B, 0, IDENT_B.length);
    }

    private static long indexLength(byte[] trailer) {
        return ByteUtils.fromLittleEndian(trailer, LENGTH_OFFSET, 4);
    }
}
