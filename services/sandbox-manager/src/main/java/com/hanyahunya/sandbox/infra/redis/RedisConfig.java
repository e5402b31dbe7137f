package com.hanyahunya.sandbox.infra.redis;

import org.springframework.boot.autoconfigure.data.redis.JedisClientConfigurationBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPoolConfig;

import java.time.Duration;

@Configuration
public class RedisConfig {

    @Bean
    public JedisClientConfigurationBuilderCustomizer jedisClientConfigurationBuilderCustomizer() {
        return builder -> builder.usePooling().poolConfig(jedisPoolConfig());
    }

    private JedisPoolConfig jedisPoolConfig() {
        JedisPoolConfig config = new JedisPoolConfig();

        // 워커당 요청 스레드 + 스케줄러 4
        config.setMaxTotal(64);
        config.setMaxIdle(16);
        config.setMinIdle(0);
        config.setMaxWait(Duration.ofMillis(4000));
        config.setTimeBetweenEvictionRuns(Duration.ofMillis(30000));
        config.setMinEvictableIdleDuration(Duration.ofMillis(60000));

        return config;
    }
}
