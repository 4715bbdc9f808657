package com.libragraph.pack.core.extract;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of one entry in a bulk extraction.
 *
 * @param index        position of the entry in the catalog
 * @param entryName    entry name as stored
 * @param output       file written, or null if the entry failed before a path was known
 * @param bytesWritten bytes written to {@code output}
 * @param failure      null on success
 */
public record ExtractionResult(int index, String entryName, Path output, long bytesWritten,
                               ExtractException failure) {

    static ExtractionResult success(ExtractionJob job, long bytesWritten) {
        return new ExtractionResult(job.index(), job.entry().name(), job.destination(), bytesWritten, null);
    }

    static ExtractionResult failure(int index, String entryName, Path output, ExtractException failure) {
        return new ExtractionResult(index, entryName, output, 0, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<ExtractException> error() {
        return Optional.ofNullable(failure);
    }
}
