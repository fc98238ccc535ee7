package com.zenz.respkv.command_handlers;

import com.zenz.respkv.commands.Command;
import com.zenz.respkv.frames.Frame;

public interface BaseCommandHandler {
    /**
     * Executes {@code command} and returns the reply frame to send back.
     */
    Frame handleCommand(Command command);
}
