package com.libragraph.pack.formats.ogg;

public enum RepairAction {
    /** Input was already valid and is returned as is. */
    NONE,
    /** "OggS" was prepended; the rest of the input is unchanged. */
    PREPENDED_MARKER,
    /** The first page was rebuilt from the canonical Vorbis template. */
    RECONSTRUCTED,
    /** No repair produced a valid stream; the input is returned as is. */
    UNREPAIRABLE
}
