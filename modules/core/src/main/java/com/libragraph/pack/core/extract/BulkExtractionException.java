package com.libragraph.pack.core.extract;

import java.util.List;

/**
 * Raised by {@link ExtractionReport#throwIfFailed()} when any entry failed.
 * Each entry failure is attached as a suppressed exception.
 */
public class BulkExtractionException extends RuntimeException {

    private final List<ExtractException> failures;

    public BulkExtractionException(String archiveName, int total, List<ExtractException> failures) {
        super(failures.size() + " of " + total + " entries failed to extract from " + archiveName);
        this.failures = List.copyOf(failures);
        for (ExtractException failure : this.failures) {
            addSuppressed(failure);
        }
    }

    public int failureCount() {
        return failures.size();
    }

    public List<ExtractException> failures() {
        return failures;
    }
}
