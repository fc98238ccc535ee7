package com.zenz.respkv.frames;

import com.esotericsoftware.kryo.io.Output;

public record IntegerFrame(long value) implements Frame {

    @Override
    public FrameType type() {
        return FrameType.INTEGER;
    }

    @Override
    public void writeTo(Output output) {
        FrameEncoding.writeDecimalLine(output, FrameType.INTEGER, value);
    }
}
