package com.zenz.respkv.frames;

import com.esotericsoftware.kryo.io.Output;

import java.util.ArrayList;
import java.util.List;

public record ArrayFrame(List<Frame> elements) implements Frame {

    public ArrayFrame {
        elements = List.copyOf(elements);
    }

    public static ArrayFrame of(Frame... elements) {
        return new ArrayFrame(List.of(elements));
    }

    /**
     * Builds the request shape clients send: every part as a bulk string.
     */
    public static ArrayFrame ofBulk(byte[]... parts) {
        List<Frame> elements = new ArrayList<>(parts.length);
        for (byte[] part : parts) {
            elements.add(new BulkFrame(part));
        }
        return new ArrayFrame(elements);
    }

    public int size() {
        return elements.size();
    }

    @Override
    public FrameType type() {
        return FrameType.ARRAY;
    }

    @Override
    public void writeTo(Output output) {
        FrameEncoding.writeDecimalLine(output, FrameType.ARRAY, elements.size());
        for (Frame element : elements) {
            element.writeTo(output);
        }
    }
}
