package com.libragraph.pack.formats.ogg;

/**
 * Classification of a buffer expected to hold an Ogg Vorbis stream.
 */
public enum ContainerStatus {
    /** Usable as is. */
    VALID,
    /** The first 4 bytes ("OggS") of the first page are missing. */
    MISSING_LEADING_MARKER,
    /** A capture pattern exists but the first page is damaged. */
    CORRUPTED_HEADER,
    /** No capture pattern anywhere. */
    NO_MARKER_FOUND
}
