package com.zenz.respkv.frames;

import com.esotericsoftware.kryo.io.Output;

/**
 * Short status text. Never holds CR or LF, so it always fits on one line.
 */
public record SimpleFrame(String value) implements Frame {
    public static final SimpleFrame OK = new SimpleFrame("OK");

    public SimpleFrame {
        FrameEncoding.requireSingleLine(value);
    }

    @Override
    public FrameType type() {
        return FrameType.SIMPLE;
    }

    @Override
    public void writeTo(Output output) {
        FrameEncoding.writeLine(output, FrameType.SIMPLE, value);
    }
}
