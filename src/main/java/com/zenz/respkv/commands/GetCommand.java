package com.zenz.respkv.commands;

import com.zenz.respkv.frames.ArrayFrame;

import java.nio.charset.StandardCharsets;

public record GetCommand(String key) implements Command {

    @Override
    public CommandType type() {
        return CommandType.GET;
    }

    @Override
    public ArrayFrame toFrame() {
        return ArrayFrame.ofBulk(
                type().getValue().getBytes(StandardCharsets.UTF_8),
                key.getBytes(StandardCharsets.UTF_8));
    }

    static GetCommand parseFrames(CommandParser parser) throws CommandException {
        String key = parser.nextString();
        parser.finish();
        return new GetCommand(key);
    }
}
