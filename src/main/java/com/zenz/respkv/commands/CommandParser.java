package com.zenz.respkv.commands;

import com.zenz.respkv.frames.ArrayFrame;
import com.zenz.respkv.frames.BulkFrame;
import com.zenz.respkv.frames.Frame;
import com.zenz.respkv.frames.SimpleFrame;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Cursor over the elements of a request array. Simple and bulk elements are
 * both accepted where a string is expected.
 */
public class CommandParser {
    private final List<Frame> elements;
    private int index;

    public CommandParser(Frame frame) throws CommandException {
        if (!(frame instanceof ArrayFrame array)) {
            throw new CommandException("ERR Protocol error: expected array, got " + frame.type());
        }
        if (array.size() == 0) {
            throw new CommandException("ERR Protocol error: empty command");
        }
        this.elements = array.elements();
        this.index = 0;
    }

    public int size() {
        return elements.size();
    }

    public String nextString() throws CommandException {
        Frame frame = next();
        if (frame instanceof SimpleFrame simple) return simple.value();
        if (frame instanceof BulkFrame bulk) return decode(bulk.value());

        throw new CommandException("ERR Protocol error: expected simple or bulk string, got " + frame.type());
    }

    public byte[] nextBytes() throws CommandException {
        Frame frame = next();
        if (frame instanceof SimpleFrame simple) return simple.value().getBytes(StandardCharsets.UTF_8);
        if (frame instanceof BulkFrame bulk) return bulk.value();

        throw new CommandException("ERR Protocol error: expected simple or bulk string, got " + frame.type());
    }

    /**
     * Ensures every element has been consumed.
     */
    public void finish() throws CommandException {
        if (index < elements.size()) {
            throw new CommandException("ERR Protocol error: expected end of frame, but there was more");
        }
    }

    private static String decode(byte[] bytes) throws CommandException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CommandException("ERR Protocol error: invalid string");
        }
    }

    private Frame next() throws CommandException {
        if (index >= elements.size()) {
            throw new CommandException("ERR Protocol error: attempting to extract a value failed due to end of frame");
        }
        return elements.get(index++);
    }
}
