package com.libragraph.pack.formats.gpk;

import java.util.List;

/**
 * Result of parsing an inflated index: the entries in stored order and why
 * parsing stopped.
 */
public record EntryTable(List<PackageEntry> entries, Termination termination) {

    public enum Termination {
        /** A zero name length was reached. */
        END_MARKER,
        /** The table bytes ran out on an entry boundary. */
        END_OF_DATA,
        /** An invalid name length was found and no entry start was found after it. */
        RESYNC_FAILED,
        /** The table ended inside a name or record. */
        TRUNCATED
    }

    public EntryTable {
        entries = List.copyOf(entries);
    }

    /**
     * True if the table ended where a well-formed table ends.
     */
    public boolean terminatedCleanly() {
        return termination == Termination.END_MARKER || termination == Termination.END_OF_DATA;
    }
}
