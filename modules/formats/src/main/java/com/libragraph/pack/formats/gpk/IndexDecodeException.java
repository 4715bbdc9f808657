package com.libragraph.pack.formats.gpk;

import java.nio.file.Path;

/**
 * The compressed index could not be turned into table bytes.
 */
public class IndexDecodeException extends PackageLoadException {

    public enum Failure {
        /** No zlib header at offset 0 or 4, with or without decryption. */
        NO_VALID_STREAM,
        /** A header was found but inflation failed. */
        STREAM_CORRUPT
    }

    private final Failure failure;

    public IndexDecodeException(Failure failure, String message) {
        this(failure, null, message, null);
    }

    public IndexDecodeException(Failure failure, String message, Throwable cause) {
        this(failure, null, message, cause);
    }

    public IndexDecodeException(Failure failure, Path path, String message, Throwable cause) {
        super(Reason.INDEX_DECODE_FAILED, path, failure + ": " + message, cause);
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
