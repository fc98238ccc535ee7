package com.zenz.respkv;

import com.zenz.respkv.store.ShardedStore;

/**
 * Immutable server settings. Build through {@link Builder}.
 */
public class ServerConfig {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6969;

    private final String host;
    private final int port;
    private final int numShards;
    private final int bufferSize;

    private ServerConfig(Builder builder) {
        host = builder.host;
        port = builder.port;
        numShards = builder.numShards;
        bufferSize = builder.bufferSize;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getNumShards() {
        return numShards;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    @Override
    public String toString() {
        return "ServerConfig[host=" + host + ", port=" + port + ", shards=" + numShards
                + ", bufferSize=" + bufferSize + "]";
    }

    public static class Builder {
        private String host;
        private int port;
        private int numShards;
        private int bufferSize;

        public Builder() {
            host = DEFAULT_HOST;
            port = DEFAULT_PORT;
            numShards = ShardedStore.DEFAULT_SHARDS;
            bufferSize = Connection.DEFAULT_BUFFER_SIZE;
        }

        public Builder setHost(String host) {
            this.host = host;
            return this;
        }

        public Builder setPort(int port) {
            this.port = port;
            return this;
        }

        public Builder setNumShards(int numShards) {
            this.numShards = numShards;
            return this;
        }

        public Builder setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public ServerConfig build() {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("Host must not be empty");
            }
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port must be between 0 and 65535, got " + port);
            }
            if (numShards <= 0) {
                throw new IllegalArgumentException("Number of shards must be positive, got " + numShards);
            }
            if (bufferSize <= 0) {
                throw new IllegalArgumentException("Buffer size must be positive, got " + bufferSize);
            }
            return new ServerConfig(this);
        }
    }
}
