package com.zenz.respkv.commands;

import com.zenz.respkv.frames.ErrorFrame;

import java.util.Locale;

public enum CommandType {
    GET("get", 2),
    SET("set", 3);

    private final String value;
    private final int arity;

    private CommandType(String value, int arity) {
        this.value = value;
        this.arity = arity;
    }

    public String getValue() {
        return value;
    }

    /**
     * Number of array elements a well-formed request carries, the command
     * name included.
     */
    public int getArity() {
        return arity;
    }

    /**
     * Case-insensitive lookup by command name.
     */
    public static CommandType fromValue(String value) throws CommandException {
        String lowered = value.toLowerCase(Locale.ROOT);
        for (CommandType type : CommandType.values()) {
            if (type.value.equals(lowered)) return type;
        }

        throw new CommandException("ERR unknown command '" + ErrorFrame.sanitize(value) + "'");
    }

    @Override
    public String toString() {
        return name();
    }
}
