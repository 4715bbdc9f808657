package com.libragraph.pack.core.extract;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * Aggregate result of {@link ExtractionService#extractAll}. Results are in
 * catalog order regardless of which worker produced them.
 */
public record ExtractionReport(Path archive, Path outputDir, List<ExtractionResult> results, Duration elapsed) {

    public ExtractionReport {
        results = results.stream()
                .sorted(Comparator.comparingInt(ExtractionResult::index))
                .toList();
    }

    public int total() {
        return results.size();
    }

    public int successCount() {
        return (int) results.stream().filter(ExtractionResult::isSuccess).count();
    }

    public List<ExtractionResult> failures() {
        return results.stream().filter(r -> !r.isSuccess()).toList();
    }

    public boolean isSuccess() {
        return results.stream().allMatch(ExtractionResult::isSuccess);
    }

    public long bytesWritten() {
        return results.stream().mapToLong(ExtractionResult::bytesWritten).sum();
    }

    /**
     * @throws BulkExtractionException if any entry failed
     */
    public void throwIfFailed() {
        List<ExtractionResult> failed = failures();
        if (!failed.isEmpty()) {
            throw new BulkExtractionException(String.valueOf(archive.getFileName()), total(),
                    failed.stream().map(ExtractionResult::failure).toList());
        }
    }
}
