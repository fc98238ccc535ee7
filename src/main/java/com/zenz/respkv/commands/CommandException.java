package com.zenz.respkv.commands;

/**
 * A well-formed frame that does not describe a command this server runs.
 * Recoverable: the message is sent back as an error reply and the connection
 * stays open.
 */
public class CommandException extends Exception {
    public CommandException(String message) {
        super(message);
    }
}
