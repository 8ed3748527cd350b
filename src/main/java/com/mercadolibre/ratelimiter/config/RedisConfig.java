package com.mercadolibre.ratelimiter.config;

import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Duration;

/**
 * Redis wiring for the distributed store. Activated with the {@code redis} profile, which also switches
 * {@code rate-limiter.storage} to {@code redis}.
 *
 * <p>The Lettuce command timeout follows the {@code rateLimitStore} time limiter, so a command the limiter
 * has already given up on is not left running. While disconnected, commands are rejected instead of
 * queued, which lets the limiter fail open at once.
 */
@Configuration
@Profile("redis")
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {

    static final String CLIENT_NAME = "rate-limiter";

    @Bean
    public ReactiveRedisConnectionFactory reactiveRedisConnectionFactory(RedisProperties props,
                                                                         TimeLimiterRegistry timeLimiters) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(props.getHost(), props.getPort());
        standalone.setDatabase(props.getDatabase());
        if (props.getPassword() != null && !props.getPassword().isEmpty()) {
            standalone.setPassword(RedisPassword.of(props.getPassword()));
        }

        return new LettuceConnectionFactory(standalone, clientConfiguration(props, timeLimiters));
    }

    static LettuceClientConfiguration clientConfiguration(RedisProperties props, TimeLimiterRegistry timeLimiters) {
        Duration commandTimeout = timeLimiters.timeLimiter(RateLimiterConfig.STORE_INSTANCE)
                .getTimeLimiterConfig()
                .getTimeoutDuration();
        Duration connectTimeout = props.getConnectTimeout() != null ? props.getConnectTimeout() : Duration.ofSeconds(1);

        ClientOptions options = ClientOptions.builder()
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .socketOptions(SocketOptions.builder().connectTimeout(connectTimeout).build())
                .build();

        return LettuceClientConfiguration.builder()
                .clientName(CLIENT_NAME)
                .clientOptions(options)
                .commandTimeout(commandTimeout)
                .shutdownTimeout(Duration.ofMillis(100))
                .build();
    }

    @Bean
    public ReactiveStringRedisTemplate reactiveStringRedisTemplate(ReactiveRedisConnectionFactory cf) {
        return new ReactiveStringRedisTemplate(cf);
    }
}
