package com.libragraph.pack.formats.gpk;

import com.libragraph.pack.util.buffer.BinaryData;
import com.libragraph.pack.util.buffer.SliceBinaryData;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A loaded package: its entry catalog plus a read handle on the file.
 *
 * The catalog is immutable and may be shared between threads. {@link #read}
 * uses positional reads on the held handle and is safe to call concurrently;
 * {@link #open} returns a reader with its own handle.
 *
 * Obtain instances from {@link PackageLoader#load(Path)}.
 */
public class PackageArchive implements Closeable {

    private final Path path;
    private final FileChannel channel;
    private final Signature signature;
    private final EntryTable table;
    private final long fileSize;

    PackageArchive(Path path, FileChannel channel, Signature signature, EntryTable table, long fileSize) {
        this.path = path;
        this.channel = channel;
        this.signature = signature;
        this.table = table;
        this.fileSize = fileSize;
    }

    public Path path() {
        return path;
    }

    public Signature signature() {
        return signature;
    }

    /** Size of the package file in bytes. */
    public long fileSize() {
        return fileSize;
    }

    /** Why index parsing stopped. */
    public EntryTable.Termination termination() {
        return table.termination();
    }

    /** Entries in stored order. */
    public List<PackageEntry> entries() {
        return table.entries();
    }

    /** Number of entries. */
    public int size() {
        return table.entries().size();
    }

    /**
     * Finds an entry by name, ignoring case.
     */
    public Optional<PackageEntry> find(String name) {
        for (PackageEntry entry : table.entries()) {
            if (entry.name().equalsIgnoreCase(name)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /**
     * Lists entry names matching a wildcard pattern ({@code *} any run,
     * {@code ?} one character), ignoring case. A null, empty or {@code *}
     * pattern lists everything.
     */
    public List<String> list(String pattern) {
        if (pattern == null || pattern.isEmpty() || pattern.equals("*")) {
            return table.entries().stream().map(PackageEntry::name).toList();
        }
        Pattern regex = toRegex(pattern);
        return table.entries().stream()
                .map(PackageEntry::name)
                .filter(name -> regex.matcher(name).matches())
                .toList();
    }

    /**
     * Package file name without directory and extension.
     */
    public String baseName() {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Reads the stored bytes of an entry.
     *
     * @throws EOFException if the entry extends past the end of the file
     */
    public byte[] read(PackageEntry entry) throws IOException {
        checkRange(entry);
        ByteBuffer buffer = ByteBuffer.allocate((int) entry.compressedLength());
        long pos = entry.offset();
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, pos);
            if (n < 0) {
                throw new EOFException("Unexpected end of package while reading " + entry.name());
            }
            pos += n;
        }
        return buffer.array();
    }

    /**
     * Opens a reader over one entry with its own file handle. The caller closes it.
     *
     * @throws EOFException if the entry extends past the end of the file
     */
    public BinaryData open(PackageEntry entry) throws IOException {
        checkRange(entry);
        return SliceBinaryData.open(path, entry.offset(), entry.compressedLength());
    }

    /**
     * True if the entry's bytes lie inside the package file.
     */
    public boolean inRange(PackageEntry entry) {
        return entry.end() <= fileSize;
    }

    private void checkRange(PackageEntry entry) throws EOFException {
        if (!inRange(entry)) {
            throw new EOFException("Entry " + entry.name() + " ends at " + entry.end()
                    + ", past the end of the package (" + fileSize + " bytes)");
        }
        if (entry.compressedLength() > Integer.MAX_VALUE) {
            throw new EOFException("Entry " + entry.name() + " is too large: " + entry.compressedLength());
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private static Pattern toRegex(String pattern) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "PackageArchive[%s, %d entries]", path, size());
    }
}
