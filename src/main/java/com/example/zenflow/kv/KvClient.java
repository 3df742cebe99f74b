package com.example.zenflow.kv;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key/value store shared between the writer and reader processes, plus its broadcast channel.
 * <p>
 * {@link #mset} and {@link #mget} must be atomic: a reader never sees part of one {@code mset}.
 */
public interface KvClient {
    Optional<String> get(String key);
    Map<String, String> mget(List<String> keys);
    void mset(Map<String, String> values);
    void del(String key);
    void rpush(String key, String value);
    List<String> lrange(String key);
    void publish(String channel, String message);
    void subscribe(String channel, Runnable listener);
}
