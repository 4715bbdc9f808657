package com.libragraph.pack.core.config;

import com.libragraph.pack.formats.gpk.EntryTableParser;
import com.libragraph.pack.formats.gpk.PackageLoader;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Settings for loading and extracting packages.
 *
 * <p>Read from MicroProfile Config under the {@code pack.} prefix; defaults
 * live in {@code META-INF/microprofile-config.properties} and are repeated
 * here so a config without them still works.
 *
 * @param maxWorkers       upper bound on extraction threads
 * @param workersPerCore   extraction threads per available processor
 * @param decodeCompressed inflate {@code DFLT} entries when writing them out
 * @param repairAudio      run the Ogg repair engine on audio entries when writing them out
 * @param audioExtensions  lower-case extensions (no dot) treated as audio
 * @param resyncWindow     bytes scanned forward when the index parser resynchronizes
 */
public record PackConfig(
        int maxWorkers,
        int workersPerCore,
        boolean decodeCompressed,
        boolean repairAudio,
        Set<String> audioExtensions,
        int resyncWindow
) {

    public static final String MAX_WORKERS = "pack.extract.max-workers";
    public static final String WORKERS_PER_CORE = "pack.extract.workers-per-core";
    public static final String DECODE_COMPRESSED = "pack.extract.decode-compressed";
    public static final String REPAIR_AUDIO = "pack.extract.repair-audio";
    public static final String AUDIO_EXTENSIONS = "pack.extract.audio-extensions";
    public static final String RESYNC_WINDOW = "pack.index.resync-window";

    public PackConfig {
        requirePositive(MAX_WORKERS, maxWorkers);
        requirePositive(WORKERS_PER_CORE, workersPerCore);
        requirePositive(RESYNC_WINDOW, resyncWindow);
        Set<String> normalized = new LinkedHashSet<>();
        for (String ext : audioExtensions) {
            String trimmed = ext.trim();
            if (trimmed.startsWith(".")) {
                trimmed = trimmed.substring(1);
            }
            if (!trimmed.isEmpty()) {
                normalized.add(trimmed.toLowerCase(Locale.ROOT));
            }
        }
        audioExtensions = Set.copyOf(normalized);
    }

    public static PackConfig defaults() {
        return new PackConfig(10, 2, false, false, Set.of("ogg"), EntryTableParser.DEFAULT_RESYNC_WINDOW);
    }

    /**
     * Reads the settings from the default config sources (system properties,
     * environment, {@code META-INF/microprofile-config.properties}).
     */
    public static PackConfig load() {
        return from(ConfigProvider.getConfig());
    }

    public static PackConfig from(Config config) {
        PackConfig defaults = defaults();
        List<String> extensions = config.getOptionalValues(AUDIO_EXTENSIONS, String.class)
                .orElse(List.copyOf(defaults.audioExtensions()));
        return new PackConfig(
                config.getOptionalValue(MAX_WORKERS, Integer.class).orElse(defaults.maxWorkers()),
                config.getOptionalValue(WORKERS_PER_CORE, Integer.class).orElse(defaults.workersPerCore()),
                config.getOptionalValue(DECODE_COMPRESSED, Boolean.class).orElse(defaults.decodeCompressed()),
                config.getOptionalValue(REPAIR_AUDIO, Boolean.class).orElse(defaults.repairAudio()),
                new LinkedHashSet<>(extensions),
                config.getOptionalValue(RESYNC_WINDOW, Integer.class).orElse(defaults.resyncWindow()));
    }

    public PackConfig withDecodeCompressed(boolean value) {
        return new PackConfig(maxWorkers, workersPerCore, value, repairAudio, audioExtensions, resyncWindow);
    }

    public PackConfig withRepairAudio(boolean value) {
        return new PackConfig(maxWorkers, workersPerCore, decodeCompressed, value, audioExtensions, resyncWindow);
    }

    public PackConfig withMaxWorkers(int value) {
        return new PackConfig(value, workersPerCore, decodeCompressed, repairAudio, audioExtensions, resyncWindow);
    }

    /**
     * Worker threads for {@code jobs} jobs: {@code min(jobs, workersPerCore * cores, maxWorkers)}.
     */
    public int workerCount(int jobs, int processors) {
        long perCore = (long) workersPerCore * Math.max(1, processors);
        return (int) Math.max(0, Math.min(jobs, Math.min(perCore, maxWorkers)));
    }

    /**
     * A loader whose index parser uses {@link #resyncWindow()}.
     */
    public PackageLoader packageLoader() {
        return new PackageLoader(new EntryTableParser(resyncWindow));
    }

    public boolean isAudio(String extension) {
        return audioExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
    }
}
