package com.libragraph.pack.util.buffer;

import org.apache.commons.compress.utils.IOUtils;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Read-only binary data backed by a file, an archive entry, or RAM.
 *
 * Implements SeekableByteChannel, so every variant offers the same four
 * capabilities: read, seek (position), size and close.
 *
 * Variants:
 * - {@link #wrap(SeekableByteChannel)} / {@link #open(Path)}: a whole channel or file
 * - {@link #of(byte[])}: in-memory bytes
 * - {@link SliceBinaryData}: a window of another channel (one archive entry)
 */
public abstract class BinaryData implements SeekableByteChannel {

    /**
     * Wraps an existing SeekableByteChannel as BinaryData.
     */
    public static BinaryData wrap(SeekableByteChannel channel) {
        return new WrappedBinaryData(channel);
    }

    /**
     * Opens a file on disk for reading.
     */
    public static BinaryData open(Path path) throws IOException {
        return new WrappedBinaryData(FileChannel.open(path, StandardOpenOption.READ));
    }

    /**
     * Wraps an in-memory byte array. The array is not copied.
     */
    public static BinaryData of(byte[] data) {
        return new WrappedBinaryData(new SeekableInMemoryByteChannel(data));
    }

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Reads exactly {@code length} bytes starting at {@code pos}.
     *
     * @throws java.io.EOFException if the data ends before {@code length} bytes were read
     */
    public byte[] readFully(long pos, int length) throws IOException {
        position(pos);
        ByteBuffer buffer = ByteBuffer.allocate(length);
        IOUtils.readFully(this, buffer);
        return buffer.array();
    }

    /**
     * Reads the whole content from position 0.
     */
    public byte[] readAll() throws IOException {
        long size = size();
        if (size > Integer.MAX_VALUE) {
            throw new IOException("Data too large to read into memory: " + size + " bytes");
        }
        return readFully(0, (int) size);
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        throw new NonWritableChannelException();
    }

    @Override
    public SeekableByteChannel truncate(long size) throws IOException {
        throw new NonWritableChannelException();
    }
}
