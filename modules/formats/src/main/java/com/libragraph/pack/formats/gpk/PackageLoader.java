package com.libragraph.pack.formats.gpk;

import com.libragraph.pack.formats.codecs.IndexCodec;
import com.libragraph.pack.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Opens package files.
 *
 * Layout: {@code [entry data][index N bytes][signature 32 bytes]}. Loading
 * reads the signature, decodes the index and parses the entry table. It
 * either returns a fully usable {@link PackageArchive} or throws
 * {@link PackageLoadException}; on failure the file handle is closed.
 */
public class PackageLoader {

    private static final Logger log = Logger.getLogger(PackageLoader.class);

    /** Largest index read into memory; the length field is an unsigned 32-bit value. */
    static final long MAX_INDEX_LENGTH = Integer.MAX_VALUE - 8;

    private final IndexCodec indexCodec;
    private final EntryTableParser parser;

    public PackageLoader() {
        this(new EntryTableParser());
    }

    public PackageLoader(EntryTableParser parser) {
        this(new IndexCodec(), parser);
    }

    public PackageLoader(IndexCodec indexCodec, EntryTableParser parser) {
        this.indexCodec = indexCodec;
        this.parser = parser;
    }

    public PackageArchive load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PackageLoadException(PackageLoadException.Reason.NOT_FOUND, path, "no such file");
        }

        FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        } catch (NoSuchFileException e) {
            throw new PackageLoadException(PackageLoadException.Reason.NOT_FOUND, path, "no such file", e);
        } catch (IOException e) {
            throw new PackageLoadException(PackageLoadException.Reason.IO_FAILURE, path, "cannot open", e);
        }

        try {
            PackageArchive archive = load(path, channel);
            log.debugf("Loaded %s: %d entries (%s)", path, archive.size(), archive.termination());
            return archive;
        } catch (PackageLoadException e) {
            closeAfterFailure(channel, e);
            throw e;
        } catch (IOException e) {
            PackageLoadException failure = new PackageLoadException(
                    PackageLoadException.Reason.IO_FAILURE, path, "read failed", e);
            closeAfterFailure(channel, failure);
            throw failure;
        } catch (RuntimeException e) {
            closeAfterFailure(channel, e);
            throw e;
        }
    }

    private PackageArchive load(Path path, FileChannel channel) throws IOException {
        // Not closed here: the archive takes over the channel
        BinaryData data = BinaryData.wrap(channel);
        long fileSize = data.size();
        if (fileSize < Signature.SIZE) {
            throw new PackageLoadException(PackageLoadException.Reason.SIGNATURE_INVALID, path,
                    "file is " + fileSize + " bytes, shorter than the signature");
        }

        byte[] trailer = data.readFully(fileSize - Signature.SIZE, Signature.SIZE);
        Signature signature = Signature.read(trailer).orElseThrow(() -> new PackageLoadException(
                PackageLoadException.Reason.SIGNATURE_INVALID, path,
                "trailer identifiers do not match, raw or deciphered"));

        long indexEnd = fileSize - Signature.SIZE;
        if (signature.indexLength() > indexEnd) {
            throw new IndexDecodeException(IndexDecodeException.Failure.NO_VALID_STREAM, path,
                    "index length " + signature.indexLength() + " exceeds the " + indexEnd
                            + " bytes before the signature", null);
        }
        if (signature.indexLength() > MAX_INDEX_LENGTH) {
            throw new IndexDecodeException(IndexDecodeException.Failure.NO_VALID_STREAM, path,
                    "index length " + signature.indexLength() + " is larger than " + MAX_INDEX_LENGTH, null);
        }

        byte[] index = data.readFully(indexEnd - signature.indexLength(), (int) signature.indexLength());
        byte[] tableBytes;
        try {
            tableBytes = indexCodec.decode(index, signature.preDecrypted());
        } catch (IndexDecodeException e) {
            throw new IndexDecodeException(e.failure(), path, "index could not be decoded", e);
        }

        EntryTable table = parser.parse(tableBytes);
        if (table.entries().isEmpty() && !table.terminatedCleanly()) {
            throw new PackageLoadException(PackageLoadException.Reason.TABLE_CORRUPT, path,
                    "no entries could be parsed (" + table.termination() + ")");
        }

        for (PackageEntry entry : table.entries()) {
            if (entry.end() > fileSize) {
                log.warnf("Entry %s in %s ends at %d, past the end of the file (%d bytes)",
                        entry.name(), path.getFileName(), entry.end(), fileSize);
            }
        }
        return new PackageArchive(path, channel, signature, table, fileSize);
    }

    private static void closeAfterFailure(FileChannel channel, Exception failure) {
        try {
            channel.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
