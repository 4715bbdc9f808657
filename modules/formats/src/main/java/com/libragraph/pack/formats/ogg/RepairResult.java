package com.libragraph.pack.formats.ogg;

import java.util.OptionalLong;

/**
 * Outcome of {@link ContainerRepairer#repairDetailed(byte[])}.
 *
 * @param data               repaired bytes, or the input array itself for
 *                           {@link RepairAction#NONE} and {@link RepairAction#UNREPAIRABLE}
 * @param analysis           analysis of the input
 * @param action             what was done
 * @param recoveredChecksum  checksum stored in the damaged input's first page, when one was found
 */
public record RepairResult(
        byte[] data,
        ContainerAnalysis analysis,
        RepairAction action,
        OptionalLong recoveredChecksum
) {

    /** True if {@link #data()} differs from the input. */
    public boolean changed() {
        return action == RepairAction.PREPENDED_MARKER || action == RepairAction.RECONSTRUCTED;
    }
}
