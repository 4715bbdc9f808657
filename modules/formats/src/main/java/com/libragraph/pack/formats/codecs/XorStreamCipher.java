package com.libragraph.pack.formats.codecs;

import java.util.Arrays;

/**
 * The package cipher: each byte is XORed with a fixed 16-byte key at
 * {@code position mod 16}. Applying it twice restores the input.
 */
public final class XorStreamCipher {

    private static final byte[] KEY = {
            (byte) 0x82, (byte) 0xEE, (byte) 0x1D, (byte) 0xB3,
            (byte) 0x57, (byte) 0xE9, (byte) 0x2C, (byte) 0xC2,
            (byte) 0x2F, (byte) 0x54, (byte) 0x7B, (byte) 0x10,
            (byte) 0x4C, (byte) 0x9A, (byte) 0x75, (byte) 0x49
    };

    public static final int KEY_LENGTH = KEY.length;

    private XorStreamCipher() {
    }

    /**
     * Enciphers or deciphers {@code data} in place, keyed from position 0.
     */
    public static void apply(byte[] data) {
        apply(data, 0);
    }

    /**
     * Enciphers or deciphers {@code data} in place, where {@code data[0]} sits
     * at {@code keyOffset} in the enciphered section.
     */
    public static void apply(byte[] data, int keyOffset) {
        int k = Math.floorMod(keyOffset, KEY_LENGTH);
        for (int i = 0; i < data.length; i++) {
            data[i] ^= KEY[(k + i) % KEY_LENGTH];
        }
    }

    /**
     * Returns a deciphered copy, leaving {@code data} untouched.
     */
    public static byte[] applyToCopy(byte[] data) {
        byte[] copy = Arrays.copyOf(data, data.length);
        apply(copy);
        return copy;
    }

    /**
     * Returns a copy of the key.
     */
    public static byte[] key() {
        return KEY.clone();
    }
}
