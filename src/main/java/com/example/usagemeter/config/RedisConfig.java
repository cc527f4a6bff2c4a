package com.example.usagemeter.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.util.List;

@Configuration
public class RedisConfig {

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    /**
     * Fixed-window counter: INCR and, on the first increment of a window, EXPIRE in one script.
     * <p>
     * Loaded once at startup and cached by Spring/Data Redis.
     */
    @Bean
    public DefaultRedisScript<List> fixedWindowScript() {
        DefaultRedisScript<List> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource("lua/fixed_window.lua"));
        script.setResultType(List.class);
        return script;
    }

    /**
     * Sliding-window log: prune, count and conditional append in one script.
     */
    @Bean
    public DefaultRedisScript<List> slidingWindowScript() {
        DefaultRedisScript<List> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource("lua/sliding_window.lua"));
        script.setResultType(List.class);
        return script;
    }

    /**
     * Clock bean for time-based operations.
     * <p>
     * Using UTC clock for consistent time across distributed instances.
     * Can be overridden in tests with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
