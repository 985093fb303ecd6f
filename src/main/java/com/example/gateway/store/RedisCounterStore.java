package com.example.gateway.store;

import com.example.gateway.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Counter store delegating check-and-consume to a Lua script running inside Redis.
 * <p>
 * All concurrency control lives inside the script. This class builds the arguments, translates
 * the script result and maps every Redis failure, timeouts included, to
 * {@link StoreUnavailableException}. The command deadline is the client timeout configured
 * with {@code spring.data.redis.timeout}.
 */
@Component
@ConditionalOnProperty(prefix = "gateway", name = "counter-store", havingValue = "redis", matchIfMissing = true)
public class RedisCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCounterStore.class);

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<List> quotaScript;

    public RedisCounterStore(StringRedisTemplate redisTemplate, DefaultRedisScript<List> quotaScript) {
        this.redisTemplate = redisTemplate;
        this.quotaScript = quotaScript;
    }

    @Override
    public CounterResult consume(String key, long cost, long limit, Duration ttl) {
        List<String> keys = Collections.singletonList(key);
        String ttlMillis = Long.toString(Math.max(1L, ttl.toMillis()));

        Object result;
        try {
            result = redisTemplate.execute(
                    quotaScript,
                    keys,
                    Long.toString(cost),
                    Long.toString(limit),
                    ttlMillis
            );
        } catch (DataAccessException ex) {
            // Covers connection failures, command timeouts and script errors.
            throw new StoreUnavailableException("Redis check-and-consume failed for key " + key, ex);
        }

        if (!(result instanceof List<?> listResult) || listResult.size() < 2) {
            log.error("Unexpected Lua script result for key {}: {}", key, result);
            throw new StoreUnavailableException("Unexpected Lua script result for key " + key);
        }

        long allowedFlag = toLong(listResult.get(0));
        long count = toLong(listResult.get(1));
        return new CounterResult(allowedFlag == 1L, count);
    }

    private long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
