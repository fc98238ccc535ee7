package com.zenz.respkv.frames;

/**
 * Wire prefix of each frame variant.
 * <p>
 * Null shares the bulk prefix; the decoder tells the two apart by the
 * declared length ({@code $-1}).
 */
public enum FrameType {
    SIMPLE('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK('$'),
    NULL('$'),
    ARRAY('*');

    private final byte prefix;

    private FrameType(char prefix) {
        this.prefix = (byte) prefix;
    }

    public byte getPrefix() {
        return prefix;
    }

    public static FrameType fromPrefix(byte prefix) throws MalformedFrameException {
        for (FrameType type : FrameType.values()) {
            if (type.prefix == prefix) return type;
        }

        throw new MalformedFrameException("invalid frame type byte `" + (prefix & 0xff) + "`");
    }

    @Override
    public String toString() {
        return name();
    }
}
