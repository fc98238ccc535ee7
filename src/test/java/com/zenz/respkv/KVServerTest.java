package com.zenz.respkv;

import com.zenz.respkv.client.KVClient;
import com.zenz.respkv.command_handlers.CommandHandler;
import com.zenz.respkv.commands.CommandException;
import com.zenz.respkv.commands.GetCommand;
import com.zenz.respkv.commands.SetCommand;
import com.zenz.respkv.frames.ArrayFrame;
import com.zenz.respkv.frames.BulkFrame;
import com.zenz.respkv.frames.ErrorFrame;
import com.zenz.respkv.frames.Frame;
import com.zenz.respkv.frames.NullFrame;
import com.zenz.respkv.frames.SimpleFrame;
import com.zenz.respkv.store.ShardedStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class KVServerTest {

    private static final String TEST_HOST = "127.0.0.1";

    private static ExecutorService serverExecutor;
    private static KVServer server;
    private static int port;

    @BeforeAll
    static void startServer() throws Exception {
        ServerConfig config = new ServerConfig.Builder()
                .setHost(TEST_HOST)
                .setPort(0)
                .setNumShards(ShardedStore.DEFAULT_SHARDS)
                .build();
        server = new KVServer(config, new CommandHandler(new ShardedStore(config.getNumShards())));

        serverExecutor = Executors.newSingleThreadExecutor();
        serverExecutor.submit(() -> {
            server.start();
            return null;
        });

        assertTrue(server.awaitStarted(5, TimeUnit.SECONDS), "server did not start");
        port = server.getPort();
    }

    @AfterAll
    static void stopServer() throws IOException {
        server.stop();
        serverExecutor.shutdown();
        try {
            serverExecutor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static KVClient connectClient() throws IOException {
        return KVClient.connect(TEST_HOST, port);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    // --- Basic commands ---

    @Test
    void set_thenGet_returnsValue() throws Exception {
        try (KVClient client = connectClient()) {
            assertEquals(SimpleFrame.OK, client.request(new SetCommand("hello", bytes("world"))));
            assertEquals(BulkFrame.of("world"), client.request(new GetCommand("hello")));
        }
    }

    @Test
    void get_missingKey_returnsNull() throws Exception {
        try (KVClient client = connectClient()) {
            assertEquals(NullFrame.INSTANCE, client.request(new GetCommand("never-written-key")));
            assertEquals(Optional.empty(), client.get("never-written-key"));
        }
    }

    @Test
    void set_emptyValue_isNotNull() throws Exception {
        try (KVClient client = connectClient()) {
            client.set("empty_key", new byte[0]);

            assertEquals(new BulkFrame(new byte[0]), client.request(new GetCommand("empty_key")));
        }
    }

    @Test
    void set_overwrite_lastWriteWins() throws Exception {
        try (KVClient client = connectClient()) {
            client.set("overwrite_key", bytes("initial"));
            assertArrayEquals(bytes("initial"), client.get("overwrite_key").orElseThrow());

            client.set("overwrite_key", bytes("updated"));
            assertArrayEquals(bytes("updated"), client.get("overwrite_key").orElseThrow());
        }
    }

    @Test
    void set_manyKeys_allRetrievable() throws Exception {
        try (KVClient client = connectClient()) {
            for (int i = 1; i <= 50; i++) {
                client.set("sharded_key" + i, bytes("value" + i));
            }
            for (int i = 1; i <= 50; i++) {
                assertArrayEquals(bytes("value" + i), client.get("sharded_key" + i).orElseThrow());
            }
        }
    }

    @Test
    void set_largeValue() throws Exception {
        byte[] value = new byte[256 * 1024];
        Arrays.fill(value, (byte) 'x');

        try (KVClient client = connectClient()) {
            client.set("large_key", value);
            assertArrayEquals(value, client.get("large_key").orElseThrow());
        }
    }

    @Test
    void set_nonAsciiValue() throws Exception {
        String special = "Hello, 世界! ñáéíóú";

        try (KVClient client = connectClient()) {
            client.set("special_key", bytes(special));
            assertEquals(special, new String(client.get("special_key").orElseThrow(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void set_binaryValueWithCrlf() throws Exception {
        byte[] value = {0, '\r', '\n', '$', '-', '1', '\r', '\n', (byte) 0xff};

        try (KVClient client = connectClient()) {
            client.set("binary_key", value);
            assertArrayEquals(value, client.get("binary_key").orElseThrow());
        }
    }

    @Test
    void commandName_isCaseInsensitive() throws Exception {
        try (KVClient client = connectClient()) {
            assertEquals(SimpleFrame.OK, client.roundTrip(ArrayFrame.ofBulk(bytes("set"), bytes("ci"), bytes("v"))));
            assertEquals(BulkFrame.of("v"), client.roundTrip(ArrayFrame.ofBulk(bytes("GeT"), bytes("ci"))));
        }
    }

    // --- Error replies ---

    @Test
    void unknownCommand_repliesError_andKeepsConnection() throws Exception {
        try (KVClient client = connectClient()) {
            CommandException e = assertThrows(CommandException.class,
                    () -> client.roundTrip(ArrayFrame.ofBulk(bytes("DEL"), bytes("k"))));
            assertEquals("ERR unknown command 'DEL'", e.getMessage());

            client.set("after_error", bytes("still here"));
            assertArrayEquals(bytes("still here"), client.get("after_error").orElseThrow());
        }
    }

    @Test
    void wrongArity_repliesError_andKeepsConnection() throws Exception {
        try (KVClient client = connectClient()) {
            CommandException e = assertThrows(CommandException.class,
                    () -> client.roundTrip(ArrayFrame.ofBulk(bytes("GET"))));
            assertEquals("ERR wrong number of arguments for 'get' command", e.getMessage());

            assertEquals(Optional.empty(), client.get("arity_missing"));
        }
    }

    @Test
    void nonArrayRequest_repliesError_andKeepsConnection() throws Exception {
        try (KVClient client = connectClient()) {
            CommandException e = assertThrows(CommandException.class, () -> client.roundTrip(BulkFrame.of("GET")));
            assertTrue(e.getMessage().startsWith("ERR Protocol error"));

            assertEquals(Optional.empty(), client.get("non_array_missing"));
        }
    }

    @Test
    void malformedFrame_repliesProtocolError_thenCloses() throws Exception {
        try (SocketChannel channel = SocketChannel.open(new InetSocketAddress(TEST_HOST, port))) {
            Connection connection = new Connection(channel);
            channel.write(ByteBuffer.wrap(bytes("?garbage\r\n")));

            Frame reply = connection.readFrame();
            assertInstanceOf(ErrorFrame.class, reply);
            assertTrue(((ErrorFrame) reply).message().startsWith("ERR Protocol error"));
            assertNull(connection.readFrame());
        }
    }

    @Test
    void truncatedFrame_thenPeerClose_endsSession() throws Exception {
        try (Socket socket = new Socket(TEST_HOST, port)) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(bytes("*2\r\n$3\r\nGET\r\n$100\r\nshort"));
            out.flush();
            socket.shutdownOutput();

            InputStream in = socket.getInputStream();
            try {
                assertEquals(-1, in.read());
            } catch (SocketTimeoutException e) {
                fail("server kept a truncated session open");
            }
        }

        try (KVClient client = connectClient()) {
            client.set("after_truncated", bytes("ok"));
            assertArrayEquals(bytes("ok"), client.get("after_truncated").orElseThrow());
        }
    }

    // --- Multiple clients ---

    @Test
    void writes_areVisibleAcrossConnections() throws Exception {
        try (KVClient client1 = connectClient(); KVClient client2 = connectClient()) {
            client1.set("k", bytes("v1"));
            assertArrayEquals(bytes("v1"), client2.get("k").orElseThrow());

            client2.set("key2", bytes("value2"));
            assertArrayEquals(bytes("value2"), client1.get("key2").orElseThrow());
        }
    }

    @Test
    void concurrentClients_eachSeeOwnWrites() throws Exception {
        ExecutorService clients = Executors.newFixedThreadPool(10);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < 10; i++) {
                String key = "concurrent_key_" + i;
                String value = "concurrent_value_" + i;
                futures.add(clients.submit(() -> {
                    try (KVClient client = connectClient()) {
                        for (int j = 0; j < 20; j++) {
                            client.set(key, bytes(value + j));
                            assertArrayEquals(bytes(value + j), client.get(key).orElseThrow());
                        }
                    }
                    return null;
                }));
            }

            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            clients.shutdownNow();
        }
    }

    @Test
    void pipelinedRequests_areAnsweredInOrder() throws Exception {
        try (SocketChannel channel = SocketChannel.open(new InetSocketAddress(TEST_HOST, port))) {
            Connection connection = new Connection(channel);

            byte[] set = new SetCommand("pipelined", bytes("p")).toFrame().serialize();
            byte[] get = new GetCommand("pipelined").toFrame().serialize();
            byte[] bad = ArrayFrame.ofBulk(bytes("NOPE")).serialize();
            byte[] batch = new byte[set.length + bad.length + get.length];
            System.arraycopy(set, 0, batch, 0, set.length);
            System.arraycopy(bad, 0, batch, set.length, bad.length);
            System.arraycopy(get, 0, batch, set.length + bad.length, get.length);
            channel.write(ByteBuffer.wrap(batch));

            assertEquals(SimpleFrame.OK, connection.readFrame());
            assertEquals(new ErrorFrame("ERR unknown command 'NOPE'"), connection.readFrame());
            assertEquals(BulkFrame.of("p"), connection.readFrame());
        }
    }
}
