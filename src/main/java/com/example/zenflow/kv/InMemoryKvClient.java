package com.example.zenflow.kv;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local store used when the shared store cannot be opened.
 * Values written here are invisible to any other process.
 */
public class InMemoryKvClient implements KvClient {

    private final Map<String, String> values = new HashMap<>();
    private final Map<String, List<String>> lists = new HashMap<>();
    private final Map<String, List<Runnable>> subscribers = new ConcurrentHashMap<>();

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public synchronized Map<String, String> mget(List<String> keys) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String k : keys) {
            result.put(k, values.get(k));
        }
        return result;
    }

    @Override
    public synchronized void mset(Map<String, String> entries) {
        values.putAll(entries);
    }

    @Override
    public synchronized void del(String key) {
        values.remove(key);
        lists.remove(key);
    }

    @Override
    public synchronized void rpush(String key, String value) {
        lists.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }

    @Override
    public synchronized List<String> lrange(String key) {
        return List.copyOf(lists.getOrDefault(key, List.of()));
    }

    @Override
    public void publish(String channel, String message) {
        for (Runnable listener : subscribers.getOrDefault(channel, List.of())) {
            listener.run();
        }
    }

    @Override
    public void subscribe(String channel, Runnable listener) {
        subscribers.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(listener);
    }
}
