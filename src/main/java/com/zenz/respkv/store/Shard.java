package com.zenz.respkv.store;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One independently locked partition of the key space. The lock is held only
 * for the duration of the map access.
 */
public class Shard {
    private final Map<String, byte[]> map = new HashMap<>();
    final ReentrantLock lock = new ReentrantLock();

    public Optional<byte[]> get(String key) {
        lock.lock();
        try {
            byte[] value = map.get(key);
            return (value == null) ? Optional.empty() : Optional.of(value.clone());
        } finally {
            lock.unlock();
        }
    }

    public void set(String key, byte[] value) {
        byte[] copy = value.clone();
        lock.lock();
        try {
            map.put(key, copy);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return map.size();
        } finally {
            lock.unlock();
        }
    }
}
