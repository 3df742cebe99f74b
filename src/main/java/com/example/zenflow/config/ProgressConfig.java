package com.example.zenflow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ProgressConfig {

    private static final Logger logger = LoggerFactory.getLogger(ProgressConfig.class);

    /**
     * Zone whose calendar days define streak boundaries. Blank means the system zone.
     */
    @Bean
    public ZoneId progressZone(@Value("${zenflow.progress.zone:}") String zone) {
        ZoneId zoneId = zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        logger.info("Streak day boundaries use zone {}", zoneId);
        return zoneId;
    }

    @Bean
    public Clock clock(ZoneId progressZone) {
        return Clock.system(progressZone);
    }

    /**
     * Carries the change broadcast to the reader. Subscriptions are added lazily by the gateway.
     */
    @Bean
    public RedisMessageListenerContainer progressListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }
}
