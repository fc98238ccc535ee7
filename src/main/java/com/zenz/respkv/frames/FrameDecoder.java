package com.zenz.respkv.frames;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes frames from a byte cursor in two passes.
 * <p>
 * {@link #check(ByteBuffer)} walks the buffered bytes and reports whether a
 * whole frame is present without building it. On success the cursor sits just
 * past the frame, so the caller knows how many bytes to discard. {@link
 * #parse(ByteBuffer)} then re-reads the same bytes from the frame start and
 * builds the typed value. Both methods move the buffer's position, never its
 * limit or contents.
 */
public final class FrameDecoder {
    public static final long MAX_BULK_LENGTH = 512L * 1024 * 1024;
    public static final int MAX_NESTING_DEPTH = 1024;

    private FrameDecoder() {
    }

    /**
     * @return {@code true} if a complete frame starts at the cursor, in which
     * case the cursor is left just past it; {@code false} if more bytes are
     * needed, in which case the cursor position is unspecified
     * @throws MalformedFrameException if the bytes can never form a frame
     */
    public static boolean check(ByteBuffer buffer) throws MalformedFrameException {
        return check(buffer, 0);
    }

    private static boolean check(ByteBuffer buffer, int depth) throws MalformedFrameException {
        if (depth > MAX_NESTING_DEPTH) {
            throw new MalformedFrameException("arrays nested deeper than " + MAX_NESTING_DEPTH);
        }
        if (!buffer.hasRemaining()) return false;

        FrameType type = FrameType.fromPrefix(buffer.get());
        switch (type) {
            case SIMPLE, ERROR -> {
                int end = findLineEnd(buffer);
                if (end < 0) return false;
                for (int i = buffer.position(); i < end; i++) {
                    byte b = buffer.get(i);
                    if (b == FrameEncoding.CR || b == FrameEncoding.LF) {
                        throw new MalformedFrameException("stray CR or LF in " + type + " line");
                    }
                }
                requireUtf8(buffer, buffer.position(), end);
                buffer.position(end + 2);
                return true;
            }
            case INTEGER -> {
                int end = findLineEnd(buffer);
                if (end < 0) return false;
                parseDecimal(buffer, buffer.position(), end);
                buffer.position(end + 2);
                return true;
            }
            case BULK -> {
                int end = findLineEnd(buffer);
                if (end < 0) return false;
                long length = parseLength(buffer, end);
                buffer.position(end + 2);
                if (length < 0) return true;

                if (buffer.remaining() < length + 2) return false;
                int dataEnd = buffer.position() + (int) length;
                if (buffer.get(dataEnd) != FrameEncoding.CR || buffer.get(dataEnd + 1) != FrameEncoding.LF) {
                    throw new MalformedFrameException("bulk payload is not terminated by CRLF");
                }
                buffer.position(dataEnd + 2);
                return true;
            }
            case ARRAY -> {
                int end = findLineEnd(buffer);
                if (end < 0) return false;
                long count = parseCount(buffer, end);
                buffer.position(end + 2);

                for (long i = 0; i < count; i++) {
                    if (!check(buffer, depth + 1)) return false;
                }
                return true;
            }
            default -> throw new MalformedFrameException("unexpected frame type " + type);
        }
    }

    /**
     * Builds the frame starting at the cursor. Only valid once {@link
     * #check(ByteBuffer)} has accepted the same bytes.
     */
    public static Frame parse(ByteBuffer buffer) throws MalformedFrameException {
        FrameType type = FrameType.fromPrefix(buffer.get());
        switch (type) {
            case SIMPLE -> {
                return new SimpleFrame(readLine(buffer));
            }
            case ERROR -> {
                return new ErrorFrame(readLine(buffer));
            }
            case INTEGER -> {
                int end = findLineEnd(buffer);
                long value = parseDecimal(buffer, buffer.position(), end);
                buffer.position(end + 2);
                return new IntegerFrame(value);
            }
            case BULK -> {
                int end = findLineEnd(buffer);
                long length = parseLength(buffer, end);
                buffer.position(end + 2);
                if (length < 0) return NullFrame.INSTANCE;

                byte[] data = new byte[(int) length];
                buffer.get(data);
                buffer.position(buffer.position() + 2);
                return new BulkFrame(data);
            }
            case ARRAY -> {
                int end = findLineEnd(buffer);
                int count = (int) parseCount(buffer, end);
                buffer.position(end + 2);

                List<Frame> elements = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    elements.add(parse(buffer));
                }
                return new ArrayFrame(elements);
            }
            default -> throw new MalformedFrameException("unexpected frame type " + type);
        }
    }

    /**
     * Index of the CR of the first CRLF at or after the cursor, or -1.
     */
    private static int findLineEnd(ByteBuffer buffer) {
        int limit = buffer.limit();
        for (int i = buffer.position(); i + 1 < limit; i++) {
            if (buffer.get(i) == FrameEncoding.CR && buffer.get(i + 1) == FrameEncoding.LF) {
                return i;
            }
        }
        return -1;
    }

    private static String readLine(ByteBuffer buffer) {
        int start = buffer.position();
        int end = findLineEnd(buffer);
        byte[] line = new byte[end - start];
        buffer.get(line);
        buffer.position(end + 2);
        return new String(line, StandardCharsets.UTF_8);
    }

    private static void requireUtf8(ByteBuffer buffer, int start, int end) throws MalformedFrameException {
        ByteBuffer line = buffer.duplicate();
        line.limit(end).position(start);
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(line);
        } catch (CharacterCodingException e) {
            throw new MalformedFrameException("line is not valid UTF-8", e);
        }
    }

    /**
     * Bulk length field. Returns -1 for the null bulk, rejects any other
     * negative value.
     */
    private static long parseLength(ByteBuffer buffer, int end) throws MalformedFrameException {
        int start = buffer.position();
        if (start < end && buffer.get(start) == '-') {
            if (end - start == 2 && buffer.get(start + 1) == '1') return -1;
            throw new MalformedFrameException("invalid bulk length " + text(buffer, start, end));
        }

        long length = parseDecimal(buffer, start, end);
        if (length > MAX_BULK_LENGTH) {
            throw new MalformedFrameException("bulk length " + length + " exceeds " + MAX_BULK_LENGTH);
        }
        return length;
    }

    private static long parseCount(ByteBuffer buffer, int end) throws MalformedFrameException {
        int start = buffer.position();
        long count = parseDecimal(buffer, start, end);
        if (count < 0 || count > Integer.MAX_VALUE) {
            throw new MalformedFrameException("invalid array length " + text(buffer, start, end));
        }
        return count;
    }

    /**
     * Parses the ASCII decimal in {@code [start, end)}, accepting an optional
     * leading minus sign. Accumulates negatively so that Long.MIN_VALUE fits.
     */
    private static long parseDecimal(ByteBuffer buffer, int start, int end) throws MalformedFrameException {
        boolean negative = start < end && buffer.get(start) == '-';
        int i = negative ? start + 1 : start;
        if (i >= end) {
            throw new MalformedFrameException("invalid frame format: empty number");
        }

        long value = 0;
        try {
            for (; i < end; i++) {
                byte b = buffer.get(i);
                if (b < '0' || b > '9') {
                    throw new MalformedFrameException("invalid frame format: not a number "
                            + text(buffer, start, end));
                }
                value = Math.subtractExact(Math.multiplyExact(value, 10L), b - '0');
            }
            return negative ? value : Math.negateExact(value);
        } catch (ArithmeticException e) {
            throw new MalformedFrameException("number out of range " + text(buffer, start, end), e);
        }
    }

    private static String text(ByteBuffer buffer, int start, int end) {
        byte[] bytes = new byte[Math.min(end - start, 32)];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = buffer.get(start + i);
        }
        return "'" + new String(bytes, StandardCharsets.UTF_8) + "'";
    }
}
