package com.dingdangmaoup.bootsync.config;

import io.lettuce.core.ClientOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConfiguration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisSentinelConfiguration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.util.List;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class RedisConfig {

    private final RedisProperties redisProperties;

    @Bean
    public LettuceConnectionFactory lettuceConnectionFactory() {
        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .commandTimeout(redisProperties.getTimeout())
                .clientOptions(ClientOptions.builder()
                        .autoReconnect(true)
                        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                        .build())
                .build();

        RedisConfiguration redisConfiguration = switch (redisProperties.getMode()) {
            case STANDALONE -> standaloneConfiguration();
            case SENTINEL -> sentinelConfiguration();
        };

        log.info("Initializing Redis connection factory with mode: {}", redisProperties.getMode());
        return new LettuceConnectionFactory(redisConfiguration, clientConfig);
    }

    /**
     * String template used for the region registry, sync records and file locks
     */
    @Bean
    public ReactiveRedisTemplate<String, String> reactiveRedisTemplate(
            LettuceConnectionFactory connectionFactory) {
        RedisSerializer<String> serializer = new StringRedisSerializer();

        RedisSerializationContext<String, String> serializationContext =
                RedisSerializationContext.<String, String>newSerializationContext()
                        .key(serializer)
                        .value(serializer)
                        .hashKey(serializer)
                        .hashValue(serializer)
                        .build();

        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext);
    }

    private RedisStandaloneConfiguration standaloneConfiguration() {
        RedisStandaloneConfiguration config =
                new RedisStandaloneConfiguration(redisProperties.getHost(), redisProperties.getPort());
        config.setDatabase(redisProperties.getDatabase());
        if (redisProperties.hasPassword()) {
            config.setPassword(RedisPassword.of(redisProperties.getPassword()));
        }
        return config;
    }

    private RedisSentinelConfiguration sentinelConfiguration() {
        List<String> sentinelNodes = redisProperties.getSentinel().getNodesList();
        if (sentinelNodes.isEmpty()) {
            throw new IllegalStateException("Redis sentinel nodes are not configured");
        }

        RedisSentinelConfiguration config = new RedisSentinelConfiguration()
                .master(redisProperties.getSentinel().getMaster());
        for (String node : sentinelNodes) {
            String[] parts = node.split(":");
            config.sentinel(parts[0], Integer.parseInt(parts[1]));
        }
        config.setDatabase(redisProperties.getDatabase());
        if (redisProperties.hasPassword()) {
            config.setPassword(RedisPassword.of(redisProperties.getPassword()));
        }
        return config;
    }
}
