package com.libragraph.pack.formats.gpk;

import java.nio.file.Path;

/**
 * Thrown when a package cannot be opened. Archive-fatal: no partially
 * loaded archive is ever returned alongside it.
 */
public class PackageLoadException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        SIGNATURE_INVALID,
        INDEX_DECODE_FAILED,
        TABLE_CORRUPT,
        IO_FAILURE
    }

    private final Reason reason;
    private final Path path;

    public PackageLoadException(Reason reason, Path path, String message) {
        super(message(reason, path, message));
        this.reason = reason;
        this.path = path;
    }

    public PackageLoadException(Reason reason, Path path, String message, Throwable cause) {
        super(message(reason, path, message), cause);
        this.reason = reason;
        this.path = path;
    }

    private static String message(Reason reason, Path path, String message) {
        return reason + (path != null ? " [" + path + "]" : "") + ": " + message;
    }

    public Reason reason() {
        return reason;
    }

    /**
     * The package path, or null when decoding bytes that did not come from a file.
     */
    public Path path() {
        return path;
    }
}
