package com.zenz.respkv;

import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Output;
import com.zenz.respkv.frames.Frame;
import com.zenz.respkv.frames.FrameDecoder;
import com.zenz.respkv.frames.MalformedFrameException;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.nio.channels.Channels;

/**
 * Frame-oriented view of a duplex byte channel.
 * <p>
 * Reads accumulate in a growable buffer until {@link FrameDecoder} reports a
 * complete frame; only that frame's bytes are then discarded, so bytes that
 * already belong to the next frame stay buffered. Writes are collected in a
 * Kryo {@link Output} and flushed once per frame.
 */
public class Connection implements Closeable {
    public static final int DEFAULT_BUFFER_SIZE = 4096;

    private final ByteChannel channel;
    private final Output output;

    // Kept in write mode: position marks the end of buffered data.
    private ByteBuffer readBuffer;

    public Connection(ByteChannel channel) {
        this(channel, DEFAULT_BUFFER_SIZE);
    }

    public Connection(ByteChannel channel, int bufferSize) {
        this.channel = channel;
        this.readBuffer = ByteBuffer.allocate(bufferSize);
        this.output = new Output(Channels.newOutputStream(channel), bufferSize);
    }

    /**
     * Reads the next complete frame.
     *
     * @return the frame, or {@code null} once the peer has closed cleanly
     * between frames
     * @throws ConnectionResetException if the peer closed mid-frame
     * @throws MalformedFrameException  if the buffered bytes are not a valid frame
     */
    public Frame readFrame() throws IOException {
        while (true) {
            Frame frame = parseFrame();
            if (frame != null) {
                return frame;
            }

            if (!readBuffer.hasRemaining()) {
                grow();
            }

            int bytesRead = channel.read(readBuffer);
            if (bytesRead == -1) {
                if (readBuffer.position() == 0) {
                    return null;
                }
                throw new ConnectionResetException("connection reset by peer");
            }
        }
    }

    private Frame parseFrame() throws MalformedFrameException {
        ByteBuffer view = readBuffer.duplicate();
        view.flip();

        if (!FrameDecoder.check(view)) {
            return null;
        }

        int length = view.position();
        view.rewind();
        Frame frame = FrameDecoder.parse(view);

        readBuffer.flip();
        readBuffer.position(length);
        readBuffer.compact();
        return frame;
    }

    private void grow() {
        ByteBuffer larger = ByteBuffer.allocate(readBuffer.capacity() * 2);
        readBuffer.flip();
        larger.put(readBuffer);
        readBuffer = larger;
    }

    /**
     * Encodes {@code frame} and flushes it to the channel before returning.
     */
    public void writeFrame(Frame frame) throws IOException {
        try {
            frame.writeTo(output);
            output.flush();
        } catch (KryoException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IOException("Failed to write frame", e);
        }
    }

    int bufferedBytes() {
        return readBuffer.position();
    }

    int bufferCapacity() {
        return readBuffer.capacity();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
