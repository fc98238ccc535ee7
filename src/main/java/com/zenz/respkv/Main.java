package com.zenz.respkv;

import com.zenz.respkv.command_handlers.CommandHandler;
import com.zenz.respkv.store.ShardedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws IOException {
        ServerConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        logger.info("Starting KV Server with {}", config);
        ShardedStore store = new ShardedStore(config.getNumShards());
        KVServer server = new KVServer(config, new CommandHandler(store));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.stop();
            } catch (IOException e) {
                logger.warn("Error during shutdown: {}", e.getMessage());
            }
        }, "respkv-shutdown"));

        server.start();
    }

    static ServerConfig parseArgs(String[] args) {
        ServerConfig.Builder builder = new ServerConfig.Builder();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-h", "--host" -> builder.setHost(requireValue(args, i++));
                case "-p", "--port" -> builder.setPort(parseNumber(args[i], requireValue(args, i++)));
                case "-s", "--shards" -> builder.setNumShards(parseNumber(args[i], requireValue(args, i++)));
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        return builder.build();
    }

    private static String requireValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(args[i] + " requires a value");
        }
        return args[i + 1];
    }

    private static int parseNumber(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " must be a valid number");
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar resp-kv-store.jar [options]");
        System.out.println("Options:");
        System.out.println("\t-h, --host <host>      Host address to bind to (default: 127.0.0.1)");
        System.out.println("\t-p, --port <port>      Port to listen on (default: 6969)");
        System.out.println("\t-s, --shards <count>   Number of store shards (default: 32)");
    }
}
