package me.golemcore.jira.ratelimit;

import me.golemcore.jira.domain.exception.ConfigurationException;
import me.golemcore.jira.domain.model.BucketState;
import me.golemcore.jira.domain.model.RateLimitResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenBucketTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);

    private TokenBucket bucket(long capacity, Duration period) {
        return new TokenBucket(capacity, period, nanos::get);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Test
    void tryConsume_allowsBurstUpToCapacity() {
        TokenBucket bucket = bucket(10, Duration.ofMinutes(1));

        for (int i = 0; i < 10; i++) {
            RateLimitResult result = bucket.tryConsume();
            assertTrue(result.isAllowed(), "Request " + (i + 1) + " should be allowed");
            assertEquals(9 - i, result.getRemainingTokens(), 1e-9);
        }
        assertFalse(bucket.tryConsume().isAllowed());
    }

    @Test
    void tryConsume_deniedCallReportsWaitWithoutConsuming() {
        TokenBucket bucket = bucket(2, Duration.ofSeconds(10));
        bucket.tryConsume();
        bucket.tryConsume();

        RateLimitResult denied = bucket.tryConsume();

        assertFalse(denied.isAllowed());
        assertEquals("Rate limit exceeded", denied.getReason());
        assertEquals(Duration.ofSeconds(5), denied.getWaitTime());
        assertEquals(0.0, bucket.getState().getTokens(), 1e-9);
    }

    @Test
    void tryConsume_waitShrinksAsTimePasses() {
        TokenBucket bucket = bucket(1, Duration.ofSeconds(4));
        bucket.tryConsume();

        advance(Duration.ofSeconds(1));
        RateLimitResult denied = bucket.tryConsume();

        assertFalse(denied.isAllowed());
        assertEquals(Duration.ofSeconds(3), denied.getWaitTime());
    }

    @Test
    void tryConsume_allowedAgainAfterReportedWait() {
        TokenBucket bucket = bucket(3, Duration.ofSeconds(3));
        for (int i = 0; i < 3; i++) {
            bucket.tryConsume();
        }

        Duration wait = bucket.tryConsume().getWaitTime();
        advance(wait);

        assertTrue(bucket.tryConsume().isAllowed());
        assertFalse(bucket.tryConsume().isAllowed());
    }

    @Test
    void refill_isCappedAtCapacity() {
        TokenBucket bucket = bucket(5, Duration.ofSeconds(1));
        bucket.tryConsume();

        advance(Duration.ofHours(1));

        BucketState state = bucket.getState();
        assertEquals(5.0, state.getTokens(), 1e-9);
        assertEquals(5, state.getCapacity());
        assertEquals(5.0, state.getRefillRatePerSecond(), 1e-9);
    }

    @Test
    void refill_isProportionalToElapsedTime() {
        TokenBucket bucket = bucket(10, Duration.ofSeconds(10));
        for (int i = 0; i < 10; i++) {
            bucket.tryConsume();
        }

        advance(Duration.ofMillis(2500));

        assertEquals(2.5, bucket.getState().getTokens(), 1e-9);
    }

    @Test
    void steadyState_neverExceedsCapacityPerPeriod() {
        TokenBucket bucket = bucket(5, Duration.ofSeconds(1));
        int allowed = 0;
        // 10 seconds sampled in 10ms steps
        for (int step = 0; step < 1000; step++) {
            while (bucket.tryConsume().isAllowed()) {
                allowed++;
            }
            advance(Duration.ofMillis(10));
        }
        // initial burst of 5 plus 5 per second for 10 seconds
        assertTrue(allowed <= 5 + 50, "allowed " + allowed);
        assertTrue(allowed >= 50, "allowed " + allowed);
    }

    @ParameterizedTest
    @ValueSource(longs = { 3, 7, 60, 1000 })
    void tryConsume_callsSpacedAtPeriodOverCapacityNeverWait(long capacity) {
        Duration period = Duration.ofSeconds(1);
        Duration spacing = period.dividedBy(capacity);
        TokenBucket bucket = bucket(capacity, period);
        for (long i = 0; i < capacity; i++) {
            bucket.tryConsume();
        }

        for (int call = 0; call < 500; call++) {
            advance(spacing);
            RateLimitResult result = bucket.tryConsume();
            assertTrue(result.isAllowed(), "call " + call + " waited " + result.getWaitTime());
        }
        assertFalse(bucket.tryConsume().isAllowed());
    }

    @ParameterizedTest
    @ValueSource(longs = { 3, 7, 60 })
    void tryConsume_firstWaitAfterBurstIsPeriodOverCapacity(long capacity) {
        Duration period = Duration.ofSeconds(1);
        TokenBucket bucket = bucket(capacity, period);
        for (long i = 0; i < capacity; i++) {
            assertTrue(bucket.tryConsume().isAllowed());
        }

        Duration wait = bucket.tryConsume().getWaitTime();

        long expected = period.toNanos() / capacity;
        assertTrue(Math.abs(wait.toNanos() - expected) <= 1, "wait " + wait);
    }

    @Test
    void tryConsume_callsSlightlyFasterThanTheRateAreEventuallyDenied() {
        TokenBucket bucket = bucket(7, Duration.ofSeconds(1));
        for (int i = 0; i < 7; i++) {
            bucket.tryConsume();
        }
        Duration spacing = Duration.ofSeconds(1).dividedBy(7).minusNanos(1000);

        advance(spacing);

        assertFalse(bucket.tryConsume().isAllowed());
    }

    @Test
    void constructor_rejectsLimitTooLargeToCount() {
        assertThrows(ConfigurationException.class, () -> bucket(Long.MAX_VALUE, Duration.ofSeconds(10)));
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThrows(ConfigurationException.class, () -> bucket(0, Duration.ofSeconds(1)));
        assertThrows(ConfigurationException.class, () -> bucket(-3, Duration.ofSeconds(1)));
    }

    @Test
    void constructor_rejectsNonPositivePeriod() {
        assertThrows(ConfigurationException.class, () -> bucket(10, Duration.ZERO));
        assertThrows(ConfigurationException.class, () -> bucket(10, Duration.ofSeconds(-1)));
        assertThrows(ConfigurationException.class, () -> bucket(10, null));
    }
}
