package com.libragraph.pack.formats.ogg;

/**
 * What {@link ContainerAnalyzer} found in a buffer.
 *
 * @param status         classification
 * @param firstMarker    offset of the first "OggS", or -1
 * @param secondMarker   offset of the second "OggS", or -1
 * @param codecIdOffset  offset of the first "vorbis", or -1
 * @param structureSane  the buffer starts with a plausible Vorbis first page
 *                       (checksum not considered)
 * @param description    human-readable summary
 */
public record ContainerAnalysis(
        ContainerStatus status,
        int firstMarker,
        int secondMarker,
        int codecIdOffset,
        boolean structureSane,
        String description
) {

    public boolean isValid() {
        return status == ContainerStatus.VALID;
    }
}
