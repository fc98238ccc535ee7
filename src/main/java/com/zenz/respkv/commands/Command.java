package com.zenz.respkv.commands;

import com.zenz.respkv.frames.ArrayFrame;
import com.zenz.respkv.frames.Frame;

public interface Command {

    CommandType type();

    /**
     * @return the request frame a client sends for this command
     */
    ArrayFrame toFrame();

    /**
     * Translates a request frame into a command. The frame is only read.
     *
     * @throws CommandException for unknown names, wrong arity or a frame
     *                          that is not an array of strings
     */
    static Command fromFrame(Frame frame) throws CommandException {
        CommandParser parser = new CommandParser(frame);
        String name = parser.nextString();
        CommandType type = CommandType.fromValue(name);

        if (parser.size() != type.getArity()) {
            throw new CommandException("ERR wrong number of arguments for '" + type.getValue() + "' command");
        }

        return switch (type) {
            case GET -> GetCommand.parseFrames(parser);
            case SET -> SetCommand.parseFrames(parser);
        };
    }
}
