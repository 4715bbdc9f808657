package com.libragraph.pack.formats.api;

/**
 * Interface for transport-level transformations applied to package data.
 * Examples: the package cipher, zlib-framed index and entry payloads.
 *
 * Codecs work on whole in-memory buffers and never modify their input.
 */
public interface Codec {
    /**
     * Checks if this codec can handle the given data.
     *
     * @param header First bytes of the data (at least the codec's framing prefix)
     * @param name   Entry or file name, may be null
     * @return true if {@link #decode(byte[])} is expected to succeed
     */
    boolean matches(byte[] header, String name);

    /**
     * Decodes (decrypts/decompresses) the input.
     *
     * @param input Encoded bytes
     * @return Decoded bytes in a new array
     * @throws CodecException if the input cannot be decoded
     */
    byte[] decode(byte[] input);
}
