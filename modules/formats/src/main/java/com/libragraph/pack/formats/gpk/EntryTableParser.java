package com.libragraph.pack.formats.gpk;

import com.libragraph.pack.util.AnchorScanner;
import org.apache.commons.compress.utils.ByteUtils;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses an inflated package index into entries.
 *
 * Each entry is a u16 LE name length (in UTF-16 code units), the UTF-16LE
 * name, a 23-byte {@link EntryRecord}, then {@code subHeaderLength} extra bytes.
 * A zero length ends the table.
 *
 * Real packages contain damaged tables, so the parser tolerates them: after
 * each entry it peeks the next length, and if it is zero or implausible it
 * scans a short window forward for something that looks like an entry start
 * (a sane length and a name with a path separator and a dot). If nothing is
 * found, the entries parsed so far are returned. The parser never throws for
 * table content.
 *
 * Instances are stateless and thread-safe.
 */
public class EntryTableParser {

    private static final Logger log = Logger.getLogger(EntryTableParser.class);

    /** Longest plausible name, in UTF-16 code units. */
    public static final int MAX_NAME_LENGTH = 1024;

    public static final int DEFAULT_RESYNC_WINDOW = 32;

    private final int resyncWindow;

    public EntryTableParser() {
        this(DEFAULT_RESYNC_WINDOW);
    }

    public EntryTableParser(int resyncWindow) {
        if (resyncWindow <= 0) {
            throw new IllegalArgumentException("resyncWindow must be positive: " + resyncWindow);
        }
        this.resyncWindow = resyncWindow;
    }

    public int resyncWindow() {
        return resyncWindow;
    }

    public EntryTable parse(byte[] table) {
        List<PackageEntry> entries = new ArrayList<>();
        int pos = 0;

        while (true) {
            if (pos + 2 > table.length) {
                return finish(entries, EntryTable.Termination.END_OF_DATA);
            }

            int nameLength = u16(table, pos);
            if (nameLength == 0) {
                return finish(entries, EntryTable.Termination.END_MARKER);
            }
            if (nameLength > MAX_NAME_LENGTH) {
                int next = resync(table, pos);
                if (next < 0) {
                    log.warnf("Invalid name length %d at table offset %d, no entry start found", nameLength, pos);
                    return finish(entries, EntryTable.Termination.RESYNC_FAILED);
                }
                log.warnf("Invalid name length %d at table offset %d, resuming at %d", nameLength, pos, next);
                pos = next;
                continue;
            }

            int nameStart = pos + 2;
            int recordStart = nameStart + nameLength * 2;
            if (recordStart + EntryRecord.SIZE > table.length) {
                log.warnf("Table ends inside entry %d at offset %d", entries.size(), pos);
                return finish(entries, EntryTable.Termination.TRUNCATED);
            }

            String name = new String(table, nameStart, nameLength * 2, StandardCharsets.UTF_16LE);
            EntryRecord record = EntryRecord.parse(table, recordStart);
            entries.add(new PackageEntry(name, record));

            pos = recordStart + EntryRecord.SIZE + record.subHeaderLength();
            if (pos > table.length) {
                log.debugf("Sub-header of '%s' runs past the table end", name);
                return finish(entries, EntryTable.Termination.END_OF_DATA);
            }
            if (pos + 2 > table.length) {
                return finish(entries, EntryTable.Termination.END_OF_DATA);
            }

            int peek = u16(table, pos);
            if (peek == 0 || peek > MAX_NAME_LENGTH) {
                int next = resync(table, pos);
                if (next < 0) {
                    if (peek == 0) {
                        return finish(entries, EntryTable.Termination.END_MARKER);
                    }
                    log.warnf("Entry '%s' is followed by invalid name length %d at offset %d, no entry start found",
                            name, peek, pos);
                    return finish(entries, EntryTable.Termination.RESYNC_FAILED);
                }
                log.debugf("Skipped %d bytes after '%s' to the next entry start", next - pos, name);
                pos = next;
            }
        }
    }

    private EntryTable finish(List<PackageEntry> entries, EntryTable.Termination termination) {
        log.debugf("Parsed %d entries (%s)", entries.size(), termination);
        return new EntryTable(entries, termination);
    }

    /**
     * Returns the next plausible entry start after {@code pos}, or -1.
     */
    private int resync(byte[] table, int pos) {
        return AnchorScanner.find(table, pos + 1, resyncWindow, offset -> isPlausibleEntryStart(table, offset));
    }

    static boolean isPlausibleEntryStart(byte[] table, int offset) {
        if (offset + 2 > table.length) {
            return false;
        }
        int nameLength = u16(table, offset);
        if (nameLength == 0 || nameLength > MAX_NAME_LENGTH) {
            return false;
        }
        int nameBytes = nameLength * 2;
        if (offset + 2 + nameBytes + EntryRecord.SIZE > table.length) {
            return false;
        }
        String name = new String(table, offset + 2, nameBytes, StandardCharsets.UTF_16LE);
        return name.indexOf('\0') < 0
                && (name.indexOf('/') >= 0 || name.indexOf('\\') >= 0)
                && name.indexOf('.') >= 0;
    }

    private static int u16(byte[] data, int pos) {
        return (int) ByteUtils.fromLittleEndian(data, pos, 2);
    }
}
