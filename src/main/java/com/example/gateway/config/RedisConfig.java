package com.example.gateway.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.List;

@Configuration
@ConditionalOnProperty(prefix = "gateway", name = "counter-store", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    /**
     * Lua script implementing fixed-window check-and-consume.
     * <p>
     * Loaded once at startup and cached by Spring/Data Redis. The script runs atomically on the server.
     */
    @Bean
    public DefaultRedisScript<List> quotaScript() {
        DefaultRedisScript<List> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource("lua/fixed_window_quota.lua"));
        script.setResultType(List.class);
        return script;
    }
}
