package com.zenz.respkv.commands;

import com.zenz.respkv.frames.ArrayFrame;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

public record SetCommand(String key, byte[] value) implements Command {

    @Override
    public CommandType type() {
        return CommandType.SET;
    }

    @Override
    public ArrayFrame toFrame() {
        return ArrayFrame.ofBulk(
                type().getValue().getBytes(StandardCharsets.UTF_8),
                key.getBytes(StandardCharsets.UTF_8),
                value);
    }

    static SetCommand parseFrames(CommandParser parser) throws CommandException {
        String key = parser.nextString();
        byte[] value = parser.nextBytes();
        parser.finish();
        return new SetCommand(key, value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SetCommand other)) return false;
        return Objects.equals(key, other.key) && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(key) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "SetCommand[key=" + key + ", value=" + value.length + " bytes]";
    }
}
