package com.zenz.respkv.client;

import com.zenz.respkv.Connection;
import com.zenz.respkv.commands.Command;
import com.zenz.respkv.commands.CommandException;
import com.zenz.respkv.commands.GetCommand;
import com.zenz.respkv.commands.SetCommand;
import com.zenz.respkv.frames.BulkFrame;
import com.zenz.respkv.frames.ErrorFrame;
import com.zenz.respkv.frames.Frame;
import com.zenz.respkv.frames.NullFrame;
import com.zenz.respkv.frames.SimpleFrame;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Blocking client for the server. Each call writes one request frame and
 * reads exactly one reply on a single long-lived connection; instances are
 * not thread-safe.
 */
public class KVClient implements Closeable {
    private final Connection connection;

    private KVClient(Connection connection) {
        this.connection = connection;
    }

    public static KVClient connect(String host, int port) throws IOException {
        SocketChannel channel = SocketChannel.open();
        try {
            channel.connect(new InetSocketAddress(host, port));
            channel.socket().setTcpNoDelay(true);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        return new KVClient(new Connection(channel));
    }

    public void set(String key, byte[] value) throws IOException, CommandException {
        Frame reply = request(new SetCommand(key, value));
        if (!(reply instanceof SimpleFrame simple) || !"OK".equals(simple.value())) {
            throw new IOException("Unexpected reply to SET: " + reply);
        }
    }

    public Optional<byte[]> get(String key) throws IOException, CommandException {
        Frame reply = request(new GetCommand(key));
        if (reply instanceof BulkFrame bulk) return Optional.of(bulk.value());
        if (reply instanceof NullFrame) return Optional.empty();
        if (reply instanceof SimpleFrame simple) return Optional.of(simple.value().getBytes(StandardCharsets.UTF_8));

        throw new IOException("Unexpected reply to GET: " + reply);
    }

    /**
     * Sends {@code command} and waits for its reply.
     *
     * @throws CommandException if the server answered with an error frame
     */
    public Frame request(Command command) throws IOException, CommandException {
        return roundTrip(command.toFrame());
    }

    /**
     * Sends an arbitrary frame and returns the raw reply. Error replies are
     * turned into {@link CommandException}.
     */
    public Frame roundTrip(Frame request) throws IOException, CommandException {
        connection.writeFrame(request);
        Frame reply = connection.readFrame();

        if (reply == null) {
            throw new IOException("Server closed the connection");
        }
        if (reply instanceof ErrorFrame error) {
            throw new CommandException(error.message());
        }
        return reply;
    }

    @Override
    public void close() throws IOException {
        connection.close();
    }
}
