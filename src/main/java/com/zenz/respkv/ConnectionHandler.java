package com.zenz.respkv;

import com.zenz.respkv.command_handlers.BaseCommandHandler;
import com.zenz.respkv.commands.Command;
import com.zenz.respkv.commands.CommandException;
import com.zenz.respkv.frames.ErrorFrame;
import com.zenz.respkv.frames.Frame;
import com.zenz.respkv.frames.MalformedFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Serves one client session: read a frame, run it, reply, repeat.
 * <p>
 * Requests on a connection are handled strictly in arrival order. Any
 * failure ends this session only; the socket is closed and the server is
 * notified through {@code onClose}.
 */
public class ConnectionHandler implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandler.class);

    private final Connection connection;
    private final BaseCommandHandler commandHandler;
    private final String clientAddress;
    private final Consumer<ConnectionHandler> onClose;

    public ConnectionHandler(Connection connection, BaseCommandHandler commandHandler, String clientAddress,
                             Consumer<ConnectionHandler> onClose) {
        this.connection = connection;
        this.commandHandler = commandHandler;
        this.clientAddress = clientAddress;
        this.onClose = onClose;
    }

    @Override
    public void run() {
        logger.debug("Client connected: {}", clientAddress);

        try {
            Frame frame;
            while ((frame = connection.readFrame()) != null) {
                connection.writeFrame(process(frame));
            }
            logger.debug("Client disconnected: {}", clientAddress);
        } catch (MalformedFrameException e) {
            logger.warn("Protocol error from {}: {}", clientAddress, e.getMessage());
            sendProtocolError(e);
        } catch (ConnectionResetException e) {
            logger.debug("Client {} closed mid-frame: {}", clientAddress, e.getMessage());
        } catch (IOException e) {
            logger.warn("Connection error for {}: {}", clientAddress, e.getMessage());
        } finally {
            close();
        }
    }

    /**
     * Maps one request frame to its reply. Command errors become error
     * replies and never end the session.
     */
    Frame process(Frame frame) {
        try {
            Command command = Command.fromFrame(frame);
            logger.trace("Received command from {}: {}", clientAddress, command);
            return commandHandler.handleCommand(command);
        } catch (CommandException e) {
            logger.debug("Rejected request from {}: {}", clientAddress, e.getMessage());
            return ErrorFrame.sanitized(e.getMessage());
        }
    }

    private void sendProtocolError(MalformedFrameException e) {
        try {
            connection.writeFrame(ErrorFrame.sanitized("ERR Protocol error: " + e.getMessage()));
        } catch (IOException writeError) {
            logger.debug("Could not report protocol error to {}: {}", clientAddress, writeError.getMessage());
        }
    }

    /**
     * Closes the underlying socket. Safe to call from another thread to
     * interrupt a blocked read.
     */
    public void close() {
        try {
            connection.close();
        } catch (IOException e) {
            logger.debug("Error closing connection to {}: {}", clientAddress, e.getMessage());
        }
        onClose.accept(this);
    }

    public String getClientAddress() {
        return clientAddress;
    }
}
