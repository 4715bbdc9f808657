package com.libragraph.pack.util.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * BinaryData view of a fixed window {@code [offset, offset + length)} of a
 * larger channel. Positions are relative to the window start; reads stop at
 * the window end even if the underlying channel continues.
 *
 * <p>The slice owns its channel: {@link #close()} closes it. Use
 * {@link #open(Path, long, long)} to get a slice with a private file handle,
 * so several slices of the same file can be read concurrently.
 */
public class SliceBinaryData extends BinaryData {

    private final SeekableByteChannel channel;
    private final long offset;
    private final long length;
    private long position;

    public SliceBinaryData(SeekableByteChannel channel, long offset, long length) {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid slice: offset=" + offset + " length=" + length);
        }
        this.channel = channel;
        this.offset = offset;
        this.length = length;
    }

    /**
     * Opens a new read handle on {@code file} and returns the given window of it.
     */
    public static SliceBinaryData open(Path file, long offset, long length) throws IOException {
        FileChannel channel = FileChannel.open(file, StandardOpenOption.READ);
        try {
            return new SliceBinaryData(channel, offset, length);
        } catch (IllegalArgumentException e) {
            channel.close();
            throw e;
        }
    }

    public long offset() {
        return offset;
    }

    @Override
    public long size() {
        return length;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        if (position >= length) {
            return -1;  // EOF
        }

        long remaining = length - position;
        int toRead = (int) Math.min(remaining, dst.remaining());
        if (toRead == 0) {
            return 0;
        }

        ByteBuffer window = dst.duplicate();
        window.limit(window.position() + toRead);

        channel.position(offset + position);
        int n = channel.read(window);
        if (n > 0) {
            dst.position(dst.position() + n);
            position += n;
        }
        return n;
    }

    @Override
    public long position() throws IOException {
        return position;
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        this.position = newPosition;
        return this;
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
