package com.example.zenflow.kv;

import java.util.*;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

@Component
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer listenerContainer;

    @Autowired
    public RedisKvClient(StringRedisTemplate redis, RedisMessageListenerContainer listenerContainer) {
        this.redis = redis;
        this.listenerContainer = listenerContainer;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public Map<String, String> mget(List<String> keys) {
        List<String> values = redis.opsForValue().multiGet(keys);
        Map<String,String> result = new LinkedHashMap<>();
        int i = 0;
        for (String k : keys) {
            String v = (values != null && i < values.size()) ? values.get(i) : null;
            result.put(k, v);
            i++;
        }
        return result;
    }

    @Override
    public void mset(Map<String, String> values) {
        redis.opsForValue().multiSet(values);
    }

    @Override
    public void del(String key) {
        redis.delete(key);
    }

    @Override
    public void rpush(String key, String value) {
        redis.opsForList().rightPush(key, value);
    }

    @Override
    public List<String> lrange(String key) {
        List<String> values = redis.opsForList().range(key, 0, -1);
        return values == null ? List.of() : values;
    }

    @Override
    public void publish(String channel, String message) {
        redis.convertAndSend(channel, message);
    }

    @Override
    public void subscribe(String channel, Runnable listener) {
        listenerContainer.addMessageListener((message, pattern) -> listener.run(), new ChannelTopic(channel));
    }
}
