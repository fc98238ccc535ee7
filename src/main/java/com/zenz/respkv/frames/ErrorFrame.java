package com.zenz.respkv.frames;

import com.esotericsoftware.kryo.io.Output;

/**
 * Error text. Never holds CR or LF; build replies that quote client input
 * through {@link #sanitized(String)}.
 */
public record ErrorFrame(String message) implements Frame {

    public ErrorFrame {
        FrameEncoding.requireSingleLine(message);
    }

    /**
     * Error frame whose control characters, CR and LF included, are replaced
     * by spaces.
     */
    public static ErrorFrame sanitized(String message) {
        return new ErrorFrame(sanitize(message));
    }

    /**
     * Makes client-supplied text safe to quote inside an error line.
     */
    public static String sanitize(String text) {
        return FrameEncoding.stripControlChars(text);
    }

    @Override
    public FrameType type() {
        return FrameType.ERROR;
    }

    @Override
    public void writeTo(Output output) {
        FrameEncoding.writeLine(output, FrameType.ERROR, message);
    }
}
