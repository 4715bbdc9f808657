package com.libragraph.pack.formats.gpk;

import java.util.Locale;

/**
 * One named file in a package.
 *
 * @param name   path inside the package as stored (usually with {@code \} separators)
 * @param record location and storage details
 */
public record PackageEntry(String name, EntryRecord record) {

    public long offset() {
        return record.offset();
    }

    public long compressedLength() {
        return record.compressedLength();
    }

    public long end() {
        return record.end();
    }

    public boolean isCompressed() {
        return record.isCompressed();
    }

    /**
     * Lower-case extension without the dot, or empty if the name has none.
     */
    public String extension() {
        String normalized = name.replace('\\', '/');
        String base = normalized.substring(normalized.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        return dot < 0 ? "" : base.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
