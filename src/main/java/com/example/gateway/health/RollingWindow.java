package com.example.gateway.health;

import java.util.Arrays;

/**
 * Success and failure counts over the last N seconds, kept in one-second buckets.
 * <p>
 * Not thread-safe; the owning {@link CircuitBreaker} guards access.
 */
final class RollingWindow {

    private final int size;
    private final long[] bucketSecond;
    private final int[] successes;
    private final int[] failures;

    RollingWindow(int seconds) {
        if (seconds < 1) {
            throw new IllegalArgumentException("rolling window must span at least one second");
        }
        this.size = seconds;
        this.bucketSecond = new long[seconds];
        this.successes = new int[seconds];
        this.failures = new int[seconds];
        Arrays.fill(bucketSecond, Long.MIN_VALUE);
    }

    void record(long epochMillis, boolean success) {
        long second = Math.floorDiv(epochMillis, 1000L);
        int slot = (int) Math.floorMod(second, (long) size);
        if (bucketSecond[slot] != second) {
            bucketSecond[slot] = second;
            successes[slot] = 0;
            failures[slot] = 0;
        }
        if (success) {
            successes[slot]++;
        } else {
            failures[slot]++;
        }
    }

    int total(long nowMillis) {
        return successes(nowMillis) + failures(nowMillis);
    }

    int failures(long nowMillis) {
        long oldest = oldestSecond(nowMillis);
        int sum = 0;
        for (int i = 0; i < size; i++) {
            if (bucketSecond[i] >= oldest) {
                sum += failures[i];
            }
        }
        return sum;
    }

    int successes(long nowMillis) {
        long oldest = oldestSecond(nowMillis);
        int sum = 0;
        for (int i = 0; i < size; i++) {
            if (bucketSecond[i] >= oldest) {
                sum += successes[i];
            }
        }
        return sum;
    }

    /**
     * Failure share of the samples still inside the window, 0 when there are none.
     */
    double failureRatio(long nowMillis) {
        int total = total(nowMillis);
        return total == 0 ? 0.0 : (double) failures(nowMillis) / total;
    }

    void reset() {
        Arrays.fill(bucketSecond, Long.MIN_VALUE);
        Arrays.fill(successes, 0);
        Arrays.fill(failures, 0);
    }

    private long oldestSecond(long nowMillis) {
        return Math.floorDiv(nowMillis, 1000L) - size + 1;
    }
}
