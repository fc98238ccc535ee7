package com.zenz.respkv;

import com.zenz.respkv.command_handlers.BaseCommandHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP server speaking the RESP-style frame protocol.
 * <p>
 * The accept loop hands every socket to its own {@link ConnectionHandler}
 * thread and never waits on per-connection work. All handlers share the one
 * {@link BaseCommandHandler}, and through it the one store.
 */
public class KVServer {
    private static final Logger logger = LoggerFactory.getLogger(KVServer.class);

    private final ServerConfig config;
    private final BaseCommandHandler commandHandler;
    private final ExecutorService workers;
    private final Set<ConnectionHandler> connections = ConcurrentHashMap.newKeySet();
    private final CountDownLatch started = new CountDownLatch(1);

    private volatile ServerSocketChannel serverChannel;
    private volatile boolean running = true;

    public KVServer(ServerConfig config, BaseCommandHandler commandHandler) {
        this.config = config;
        this.commandHandler = commandHandler;

        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread th = new Thread(r, "respkv-conn-" + threadCount.incrementAndGet());
            th.setDaemon(true);
            return th;
        });
    }

    /**
     * Binds and serves until {@link #stop()} is called. Blocks the caller.
     */
    public void start() throws IOException {
        serverChannel = ServerSocketChannel.open();
        serverChannel.bind(new InetSocketAddress(config.getHost(), config.getPort()));
        started.countDown();

        logger.info("KV Server started on {}", serverChannel.getLocalAddress());

        while (running) {
            SocketChannel client;
            try {
                client = serverChannel.accept();
            } catch (ClosedChannelException e) {
                if (!running) break;
                throw e;
            } catch (IOException e) {
                logger.error("Failed to accept connection: {}", e.getMessage());
                continue;
            }

            handleAccept(client);
        }

        logger.info("KV Server stopped");
    }

    private void handleAccept(SocketChannel client) {
        String address = "unknown";
        try {
            client.socket().setTcpNoDelay(true);
            client.socket().setKeepAlive(true);
            address = String.valueOf(client.getRemoteAddress());

            ConnectionHandler handler = new ConnectionHandler(
                    new Connection(client, config.getBufferSize()), commandHandler, address, connections::remove);
            connections.add(handler);
            workers.execute(handler);
        } catch (IOException | RejectedExecutionException e) {
            logger.warn("Dropping connection from {}: {}", address, e.getMessage());
            try {
                client.close();
            } catch (IOException closeError) {
                logger.debug("Error closing rejected connection: {}", closeError.getMessage());
            }
        }
    }

    /**
     * Waits until the listening socket is bound.
     */
    public boolean awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
        return started.await(timeout, unit);
    }

    /**
     * @return the bound port, which differs from the configured one when the
     * configuration asked for port 0
     */
    public int getPort() throws IOException {
        return ((InetSocketAddress) serverChannel.getLocalAddress()).getPort();
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public void stop() throws IOException {
        running = false;

        if (serverChannel != null) {
            serverChannel.close();
        }

        for (ConnectionHandler handler : connections) {
            handler.close();
        }

        workers.shutdown();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
