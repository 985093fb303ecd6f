package com.example.gateway.store;

import com.example.gateway.exception.StoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisCounterStoreTest {

    private static final String KEY = "admission:P1:tier:STANDARD:/**:29653980";

    @Mock
    private StringRedisTemplate redisTemplate;

    private final DefaultRedisScript<List> script = new DefaultRedisScript<>("return {1, 1}", List.class);

    @Test
    void shouldTranslateAllowedScriptResult() {
        when(redisTemplate.execute(eq(script), eq(List.of(KEY)), eq("1"), eq("100"), eq("60000")))
                .thenReturn(List.of(1L, 42L));

        CounterResult result = new RedisCounterStore(redisTemplate, script)
                .consume(KEY, 1, 100, Duration.ofMinutes(1));

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getCount()).isEqualTo(42);
    }

    @Test
    void shouldTranslateRefusedScriptResult() {
        when(redisTemplate.execute(eq(script), eq(List.of(KEY)), eq("3"), eq("100"), anyString()))
                .thenReturn(List.of(0L, 99L));

        CounterResult result = new RedisCounterStore(redisTemplate, script)
                .consume(KEY, 3, 100, Duration.ofSeconds(30));

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getCount()).isEqualTo(99);
    }

    @Test
    void shouldMapRedisFailureToStoreUnavailable() {
        when(redisTemplate.execute(eq(script), eq(List.of(KEY)), anyString(), anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        RedisCounterStore store = new RedisCounterStore(redisTemplate, script);

        assertThatThrownBy(() -> store.consume(KEY, 1, 100, Duration.ofMinutes(1)))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    void shouldRejectMalformedScriptResult() {
        when(redisTemplate.execute(eq(script), eq(List.of(KEY)), anyString(), anyString(), anyString()))
                .thenReturn(List.of(1L));

        RedisCounterStore store = new RedisCounterStore(redisTemplate, script);

        assertThatThrownBy(() -> store.consume(KEY, 1, 100, Duration.ofMinutes(1)))
                .isInstanceOf(StoreUnavailableException.class);
    }
}
