package com.libragraph.pack.core.extract;

/**
 * Failure to extract one entry. Bulk extraction collects these per entry
 * instead of aborting.
 */
public class ExtractException extends RuntimeException {

    public enum Reason {
        ENTRY_NOT_FOUND,
        OUT_OF_RANGE,
        IO_FAILURE
    }

    private final Reason reason;
    private final String entryName;

    public ExtractException(Reason reason, String entryName, String message) {
        super(reason + " [" + entryName + "]: " + message);
        this.reason = reason;
        this.entryName = entryName;
    }

    public ExtractException(Reason reason, String entryName, String message, Throwable cause) {
        super(reason + " [" + entryName + "]: " + message, cause);
        this.reason = reason;
        this.entryName = entryName;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * The entry name as stored in the package, or the requested name for
     * {@link Reason#ENTRY_NOT_FOUND}.
     */
    public String entryName() {
        return entryName;
    }
}
