package com.zenz.respkv.command_handlers;

import com.zenz.respkv.commands.Command;
import com.zenz.respkv.commands.GetCommand;
import com.zenz.respkv.commands.SetCommand;
import com.zenz.respkv.frames.BulkFrame;
import com.zenz.respkv.frames.Frame;
import com.zenz.respkv.frames.NullFrame;
import com.zenz.respkv.frames.SimpleFrame;
import com.zenz.respkv.store.ShardedStore;

import java.util.Optional;

/**
 * Applies commands directly to the shared {@link ShardedStore}.
 */
public class CommandHandler implements BaseCommandHandler {
    private final ShardedStore store;

    public CommandHandler(ShardedStore store) {
        this.store = store;
    }

    @Override
    public Frame handleCommand(Command command) {
        return switch (command.type()) {
            case SET -> set((SetCommand) command);
            case GET -> get((GetCommand) command);
        };
    }

    private Frame set(SetCommand command) {
        store.set(command.key(), command.value());
        return SimpleFrame.OK;
    }

    private Frame get(GetCommand command) {
        Optional<byte[]> value = store.get(command.key());
        if (value.isEmpty()) {
            return NullFrame.INSTANCE;
        }
        return new BulkFrame(value.get());
    }

    public ShardedStore getStore() {
        return store;
    }
}
