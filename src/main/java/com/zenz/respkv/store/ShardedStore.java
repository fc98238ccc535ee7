package com.zenz.respkv.store;

import java.util.Objects;
import java.util.Optional;

/**
 * In-memory key/value store split into a fixed number of shards.
 * <p>
 * A key always lands in the same shard for the lifetime of the store, so
 * operations on keys in different shards never contend. The shard count is
 * fixed at construction.
 */
public class ShardedStore {
    public static final int DEFAULT_SHARDS = 32;

    private final Shard[] shards;

    public ShardedStore() {
        this(DEFAULT_SHARDS);
    }

    public ShardedStore(int numShards) {
        if (numShards <= 0) {
            throw new IllegalArgumentException("Number of shards must be positive, got " + numShards);
        }

        shards = new Shard[numShards];
        for (int i = 0; i < numShards; i++) {
            shards[i] = new Shard();
        }
    }

    /**
     * @return a copy of the value stored under {@code key}, or empty if the
     * key was never set
     */
    public Optional<byte[]> get(String key) {
        return shardFor(key).get(key);
    }

    /**
     * Inserts or silently overwrites {@code key}. The value is copied.
     */
    public void set(String key, byte[] value) {
        Objects.requireNonNull(value, "value");
        shardFor(key).set(key, value);
    }

    /**
     * Returns a non-negative shard index.
     * Note: Forcing the sign bit to 0.
     */
    public int shardIndex(String key) {
        int hash = key.hashCode();
        hash ^= (hash >>> 16);
        return (hash & 0x7fffffff) % shards.length;
    }

    public int getNumShards() {
        return shards.length;
    }

    public int size() {
        int total = 0;
        for (Shard shard : shards) {
            total += shard.size();
        }
        return total;
    }

    Shard getShard(int index) {
        return shards[index];
    }

    private Shard shardFor(String key) {
        return shards[shardIndex(Objects.requireNonNull(key, "key"))];
    }
}
