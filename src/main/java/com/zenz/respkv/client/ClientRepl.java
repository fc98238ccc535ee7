package com.zenz.respkv.client;

import com.zenz.respkv.ServerConfig;
import com.zenz.respkv.commands.CommandException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Line-oriented example client. Each {@code key:value} line is stored and
 * then read back from the server.
 */
public class ClientRepl {
    private final KVClient client;
    private final PrintStream out;

    public ClientRepl(KVClient client, PrintStream out) {
        this.client = client;
        this.out = out;
    }

    public static void main(String[] args) throws IOException {
        String host = args.length > 0 ? args[0] : ServerConfig.DEFAULT_HOST;
        int port = args.length > 1 ? Integer.parseInt(args[1]) : ServerConfig.DEFAULT_PORT;

        try (KVClient client = KVClient.connect(host, port)) {
            new ClientRepl(client, System.out).run(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
    }

    public void run(Reader input) throws IOException {
        BufferedReader reader = new BufferedReader(input);
        String line;
        while ((line = reader.readLine()) != null) {
            handleLine(line.trim());
        }
    }

    void handleLine(String line) throws IOException {
        if (line.isEmpty()) return;

        int sep = line.indexOf(':');
        if (sep < 0) {
            out.println("expected <key>:<value>");
            return;
        }

        String key = line.substring(0, sep);
        String value = line.substring(sep + 1);

        try {
            client.set(key, value.getBytes(StandardCharsets.UTF_8));
            Optional<byte[]> result = client.get(key);
            if (result.isPresent()) {
                out.println("got value from the server; result=" + new String(result.get(), StandardCharsets.UTF_8));
            }
        } catch (CommandException e) {
            out.println("server error: " + e.getMessage());
        }
    }
}
