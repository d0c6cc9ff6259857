package com.meshgate.gateway.breaker;

import java.time.Duration;

/**
 * Bucketed outcome counters over a trailing time window.
 * <p>
 * Not thread-safe; the owning {@link CircuitBreaker} guards it with its monitor.
 * </p>
 */
final class RollingWindow {
    private final long bucketMs;
    private final Bucket[] buckets;

    RollingWindow(Duration window, int bucketCount) {
        int count = Math.max(1, bucketCount);
        this.bucketMs = Math.max(1, window.toMillis() / count);
        this.buckets = new Bucket[count];
        for (int i = 0; i < count; i++) {
            buckets[i] = new Bucket();
        }
    }

    void recordSuccess(long nowMs) {
        current(nowMs).successes++;
    }

    void recordFailure(long nowMs) {
        current(nowMs).failures++;
    }

    void recordTimeout(long nowMs) {
        current(nowMs).timeouts++;
    }

    void recordRejection(long nowMs) {
        current(nowMs).rejections++;
    }

    Totals totals(long nowMs) {
        long oldestEpoch = nowMs / bucketMs - buckets.length + 1;
        long successes = 0;
        long failures = 0;
        long timeouts = 0;
        long rejections = 0;
        for (Bucket bucket : buckets) {
            if (bucket.epoch >= oldestEpoch) {
                successes += bucket.successes;
                failures += bucket.failures;
                timeouts += bucket.timeouts;
                rejections += bucket.rejections;
            }
        }
        return new Totals(successes, failures, timeouts, rejections);
    }

    void clear() {
        for (Bucket bucket : buckets) {
            bucket.reset(Long.MIN_VALUE);
        }
    }

    private Bucket current(long nowMs) {
        long epoch = nowMs / bucketMs;
        Bucket bucket = buckets[(int) Math.floorMod(epoch, (long) buckets.length)];
        if (bucket.epoch != epoch) {
            bucket.reset(epoch);
        }
        return bucket;
    }

    record Totals(long successes, long failures, long timeouts, long rejections) {

        /**
         * Outcomes of admitted calls; rejections are not outcomes.
         */
        long volume() {
            return successes + failures + timeouts;
        }

        double errorPercentage() {
            long volume = volume();
            return volume == 0 ? 0.0 : (failures + timeouts) * 100.0 / volume;
        }
    }

    private static final class Bucket {
        long epoch = Long.MIN_VALUE;
        long successes;
        long failures;
        long timeouts;
        long rejections;

        void reset(long epoch) {
            this.epoch = epoch;
            successes = 0;
            failures = 0;
            timeouts = 0;
            rejections = 0;
        }
    }
}
