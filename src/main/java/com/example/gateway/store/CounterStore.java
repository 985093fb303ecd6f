package com.example.gateway.store;

import com.example.gateway.exception.StoreUnavailableException;

import java.time.Duration;

/**
 * Shared counter state behind the quota ledger.
 * <p>
 * Implementations must perform the check and the increment as one atomic step per key: a
 * read-then-write pair would let concurrent callers overrun the limit.
 */
public interface CounterStore {

    /**
     * Adds {@code cost} to the counter at {@code key} only if the result stays within {@code limit}.
     *
     * @param key counter key of one (principal, rule, bucket)
     * @param cost units to consume, at least 1
     * @param limit effective limit of the window
     * @param ttl time until the bucket closes; the counter is discarded afterwards
     * @throws StoreUnavailableException if the store cannot be reached or does not answer in time
     */
    CounterResult consume(String key, long cost, long limit, Duration ttl);
}
