package com.zenz.respkv.frames;

import com.esotericsoftware.kryo.io.Output;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Length-prefixed binary payload. The payload may hold any byte, CR and LF
 * included.
 */
public record BulkFrame(byte[] value) implements Frame {

    public static BulkFrame of(String value) {
        return new BulkFrame(value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public FrameType type() {
        return FrameType.BULK;
    }

    @Override
    public void writeTo(Output output) {
        FrameEncoding.writeDecimalLine(output, FrameType.BULK, value.length);
        output.writeBytes(value);
        FrameEncoding.writeCrlf(output);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BulkFrame other)) return false;
        return Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "BulkFrame[" + new String(value, StandardCharsets.UTF_8) + "]";
    }
}
