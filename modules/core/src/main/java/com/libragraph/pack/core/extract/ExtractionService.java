package com.libragraph.pack.core.extract;

import com.libragraph.pack.core.config.PackConfig;
import com.libragraph.pack.formats.api.Codec;
import com.libragraph.pack.formats.api.CodecException;
import com.libragraph.pack.formats.codecs.EntryPayloadCodec;
import com.libragraph.pack.formats.gpk.PackageArchive;
import com.libragraph.pack.formats.gpk.PackageEntry;
import com.libragraph.pack.formats.ogg.ContainerRepairer;
import com.libragraph.pack.formats.ogg.RepairAction;
import com.libragraph.pack.formats.ogg.RepairResult;
import org.jboss.logging.Logger;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Copies entries out of a loaded package.
 *
 * <p>{@link #extract} returns the stored bytes of one entry, verbatim.
 * {@link #extractAll} writes every entry under an output directory using a
 * fixed pool of platform threads. All jobs are queued before the workers
 * start; each worker opens its own read handle on the package, takes jobs
 * until the queue is empty and pushes one result per job. A failing entry
 * never stops its siblings; failures are reported in the
 * {@link ExtractionReport}. Each output file belongs to exactly one entry:
 * a later entry resolving to an already claimed path, ignoring case, fails.
 *
 * <p>When enabled in {@link PackConfig}, bulk extraction inflates
 * {@code DFLT} entries and runs audio entries through the Ogg repair engine
 * before writing. Single-entry extraction never post-processes.
 */
public class ExtractionService {

    private static final Logger log = Logger.getLogger(ExtractionService.class);

    private final PackConfig config;
    private final Codec payloadCodec;
    private final ContainerRepairer repairer;

    public ExtractionService() {
        this(PackConfig.load());
    }

    public ExtractionService(PackConfig config) {
        this(config, new EntryPayloadCodec(), new ContainerRepairer());
    }

    public ExtractionService(PackConfig config, Codec payloadCodec, ContainerRepairer repairer) {
        this.config = config;
        this.payloadCodec = payloadCodec;
        this.repairer = repairer;
    }

    public PackConfig config() {
        return config;
    }

    /**
     * Returns the stored bytes of {@code entry}.
     *
     * @throws ExtractException {@code OUT_OF_RANGE} if the entry extends past the
     *                          end of the package, {@code IO_FAILURE} if reading fails
     */
    public byte[] extract(PackageArchive archive, PackageEntry entry) {
        if (!archive.inRange(entry)) {
            throw outOfRange(entry, archive.fileSize());
        }
        try {
            return archive.read(entry);
        } catch (IOException e) {
            throw new ExtractException(ExtractException.Reason.IO_FAILURE, entry.name(),
                    "read failed: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the stored bytes of the entry called {@code name}, ignoring case.
     *
     * @throws ExtractException {@code ENTRY_NOT_FOUND} if no entry has that name
     */
    public byte[] extract(PackageArchive archive, String name) {
        PackageEntry entry = archive.find(name).orElseThrow(() -> new ExtractException(
                ExtractException.Reason.ENTRY_NOT_FOUND, name, "not in " + archive.path().getFileName()));
        return extract(archive, entry);
    }

    /**
     * Writes every entry of {@code archive} under {@code outputDir}, one file
     * per entry, with {@code \} in names mapped to directory separators.
     *
     * @return per-entry results; use {@link ExtractionReport#throwIfFailed()} to
     *         turn partial failure into an exception
     * @throws ExtractException {@code IO_FAILURE} if {@code outputDir} cannot be
     *                          created, or if the calling thread is interrupted
     */
    public ExtractionReport extractAll(PackageArchive archive, Path outputDir) {
        long start = System.nanoTime();
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ExtractException(ExtractException.Reason.IO_FAILURE, "",
                    "cannot create output directory " + outputDir, e);
        }

        List<PackageEntry> entries = archive.entries();
        BlockingQueue<ExtractionJob> jobs = new LinkedBlockingQueue<>();
        Queue<ExtractionResult> results = new ConcurrentLinkedQueue<>();

        // Output path, lower-cased, to the index of the entry that owns it
        Map<String, Integer> claimed = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            PackageEntry entry = entries.get(i);
            Path destination = null;
            try {
                destination = resolveOutput(outputDir, entry.name());
                Integer owner = claimed.putIfAbsent(destination.toString().toLowerCase(Locale.ROOT), i);
                if (owner != null) {
                    throw new ExtractException(ExtractException.Reason.IO_FAILURE, entry.name(),
                            "output path already taken by entry " + owner + " (" + entries.get(owner).name() + ")");
                }
                jobs.add(new ExtractionJob(i, entry, destination));
            } catch (ExtractException e) {
                log.warnf("Skipping %s: %s", entry.name(), e.getMessage());
                results.add(ExtractionResult.failure(i, entry.name(), destination, e));
            }
        }

        int workerCount = config.workerCount(jobs.size(), Runtime.getRuntime().availableProcessors());
        log.debugf("Extracting %s: %d entries, %d workers",
                archive.path().getFileName(), entries.size(), workerCount);

        List<Thread> workers = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            Thread worker = new Thread(() -> workerLoop(archive, jobs, results), "extract-worker-" + i);
            worker.start();
            workers.add(worker);
        }

        try {
            for (Thread worker : workers) {
                worker.join();
            }
        } catch (InterruptedException e) {
            jobs.clear();
            Thread.currentThread().interrupt();
            throw new ExtractException(ExtractException.Reason.IO_FAILURE, "",
                    "interrupted while extracting " + archive.path().getFileName(), e);
        }

        ExtractionReport report = new ExtractionReport(archive.path(), outputDir, new ArrayList<>(results),
                Duration.ofNanos(System.nanoTime() - start));
        if (report.isSuccess()) {
            log.infof("Extracted %d entries from %s to %s in %d ms",
                    report.total(), archive.path().getFileName(), outputDir, report.elapsed().toMillis());
        } else {
            log.warnf("Extracted %d of %d entries from %s to %s in %d ms, %d failed",
                    report.successCount(), report.total(), archive.path().getFileName(), outputDir,
                    report.elapsed().toMillis(), report.failures().size());
        }
        return report;
    }

    private void workerLoop(PackageArchive archive, BlockingQueue<ExtractionJob> jobs,
                            Queue<ExtractionResult> results) {
        FileChannel channel;
        try {
            channel = FileChannel.open(archive.path(), StandardOpenOption.READ);
        } catch (IOException e) {
            log.errorf(e, "Worker cannot open %s", archive.path());
            ExtractionJob job;
            while ((job = jobs.poll()) != null) {
                results.add(ExtractionResult.failure(job.index(), job.entry().name(), job.destination(),
                        new ExtractException(ExtractException.Reason.IO_FAILURE, job.entry().name(),
                                "cannot open package", e)));
            }
            return;
        }

        try {
            ExtractionJob job;
            while ((job = jobs.poll()) != null) {
                results.add(process(job, channel, archive.fileSize()));
            }
        } finally {
            try {
                channel.close();
            } catch (IOException e) {
                log.warnf(e, "Failed to close read handle on %s", archive.path());
            }
        }
    }

    private ExtractionResult process(ExtractionJob job, FileChannel channel, long fileSize) {
        PackageEntry entry = job.entry();
        try {
            if (entry.end() > fileSize) {
                throw outOfRange(entry, fileSize);
            }
            byte[] data = postProcess(entry, read(channel, entry));
            Path parent = job.destination().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(job.destination(), data);
            return ExtractionResult.success(job, data.length);
        } catch (ExtractException e) {
            log.warnf("Skipping %s: %s", entry.name(), e.getMessage());
            return ExtractionResult.failure(job.index(), entry.name(), job.destination(), e);
        } catch (IOException | RuntimeException e) {
            log.warnf(e, "Failed to extract %s", entry.name());
            return ExtractionResult.failure(job.index(), entry.name(), job.destination(),
                    new ExtractException(ExtractException.Reason.IO_FAILURE, entry.name(),
                            "extraction failed: " + e.getMessage(), e));
        }
    }

    private static byte[] read(FileChannel channel, PackageEntry entry) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(Math.toIntExact(entry.compressedLength()));
        long pos = entry.offset();
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, pos);
            if (n < 0) {
                throw new EOFException("Unexpected end of package at " + pos);
            }
            pos += n;
        }
        return buffer.array();
    }

    /**
     * Applies the configured decoding and repair to one entry's bytes.
     * Failed decoding or repair keeps the bytes as they were.
     */
    byte[] postProcess(PackageEntry entry, byte[] data) {
        byte[] out = data;

        if (config.decodeCompressed() && entry.isCompressed()) {
            if (payloadCodec.matches(out, entry.name())) {
                try {
                    out = payloadCodec.decode(out);
                } catch (CodecException e) {
                    log.warnf("Keeping stored bytes of %s: %s", entry.name(), e.getMessage());
                }
            } else {
                log.debugf("%s is tagged compressed but has no zlib stream, keeping stored bytes", entry.name());
            }
        }

        if (config.repairAudio() && config.isAudio(entry.extension())) {
            RepairResult result = repairer.repairDetailed(out);
            if (result.changed()) {
                log.debugf("Repaired %s (%s)", entry.name(), result.action());
            } else if (result.action() == RepairAction.UNREPAIRABLE) {
                log.warnf("Could not repair %s: %s", entry.name(), result.analysis().description());
            }
            out = result.data();
        }
        return out;
    }

    /**
     * Maps an entry name to a file under {@code outputDir}.
     *
     * @throws ExtractException {@code IO_FAILURE} if the name is empty or
     *                          resolves outside {@code outputDir}
     */
    static Path resolveOutput(Path outputDir, String name) {
        String normalized = name.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        Path base = outputDir.toAbsolutePath().normalize();
        Path target;
        try {
            target = base.resolve(normalized).normalize();
        } catch (InvalidPathException e) {
            throw new ExtractException(ExtractException.Reason.IO_FAILURE, name, "invalid output path", e);
        }
        if (normalized.isEmpty() || !target.startsWith(base) || target.equals(base)) {
            throw new ExtractException(ExtractException.Reason.IO_FAILURE, name,
                    "output path escapes " + outputDir);
        }
        return target;
    }

    private static ExtractException outOfRange(PackageEntry entry, long fileSize) {
        return new ExtractException(ExtractException.Reason.OUT_OF_RANGE, entry.name(),
                "ends at " + entry.end() + ", package is " + fileSize + " bytes");
    }
}
