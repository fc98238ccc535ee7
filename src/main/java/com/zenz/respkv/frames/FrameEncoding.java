package com.zenz.respkv.frames;

import com.esotericsoftware.kryo.io.Output;

import java.nio.charset.StandardCharsets;

final class FrameEncoding {
    static final byte CR = '\r';
    static final byte LF = '\n';
    private static final byte[] CRLF = {CR, LF};

    private FrameEncoding() {
    }

    static void requireSingleLine(String text) {
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("line frame text must not contain CR or LF");
        }
    }

    /**
     * Replaces ASCII control characters with spaces.
     */
    static String stripControlChars(String text) {
        StringBuilder builder = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x20 || c == 0x7f) {
                if (builder == null) builder = new StringBuilder(text);
                builder.setCharAt(i, ' ');
            }
        }
        return (builder == null) ? text : builder.toString();
    }

    static void writeLine(Output output, FrameType type, String text) {
        output.writeByte(type.getPrefix());
        output.writeBytes(text.getBytes(StandardCharsets.UTF_8));
        output.writeBytes(CRLF);
    }

    static void writeDecimalLine(Output output, FrameType type, long value) {
        output.writeByte(type.getPrefix());
        output.writeBytes(Long.toString(value).getBytes(StandardCharsets.US_ASCII));
        output.writeBytes(CRLF);
    }

    static void writeCrlf(Output output) {
        output.writeBytes(CRLF);
    }
}
