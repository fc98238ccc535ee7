package com.zenz.respkv.frames;

import com.esotericsoftware.kryo.io.Output;

/**
 * One self-delimited protocol message, either a request or a reply.
 */
public interface Frame {

    FrameType type();

    /**
     * Appends the wire form of this frame to {@code output}. Array frames
     * write their elements recursively. Nothing is flushed.
     */
    void writeTo(Output output);

    default byte[] serialize() {
        Output output = new Output(64, -1);
        writeTo(output);
        return output.toBytes();
    }
}
