package com.zenz.respkv.frames;

import com.esotericsoftware.kryo.io.Output;

import java.nio.charset.StandardCharsets;

/**
 * Absence of a value, written as {@code $-1\r\n}.
 */
public record NullFrame() implements Frame {
    public static final NullFrame INSTANCE = new NullFrame();

    private static final byte[] ENCODED = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    @Override
    public FrameType type() {
        return FrameType.NULL;
    }

    @Override
    public void writeTo(Output output) {
        output.writeBytes(ENCODED);
    }
}
