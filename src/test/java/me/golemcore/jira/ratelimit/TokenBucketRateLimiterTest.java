package me.golemcore.jira.ratelimit;

import me.golemcore.jira.domain.exception.RateLimitExceededException;
import me.golemcore.jira.domain.exception.TransportException;
import me.golemcore.jira.domain.model.TrackerErrorKind;
import me.golemcore.jira.infrastructure.config.JiraProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenBucketRateLimiterTest {

    private final AtomicLong nanos = new AtomicLong();
    private final List<Duration> sleeps = new ArrayList<>();

    private TokenBucketRateLimiter limiter(long capacity, Duration period, RateLimitPolicy policy) {
        TokenBucket bucket = new TokenBucket(capacity, period, nanos::get);
        return new TokenBucketRateLimiter(bucket, policy, duration -> {
            sleeps.add(duration);
            nanos.addAndGet(duration.toNanos());
        });
    }

    @Test
    void acquire_returnsZeroWhileTokensAvailable() {
        TokenBucketRateLimiter limiter = limiter(3, Duration.ofSeconds(1), RateLimitPolicy.WAIT);

        for (int i = 0; i < 3; i++) {
            assertEquals(Duration.ZERO, limiter.acquire());
        }
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void acquire_waitsForReportedDurationUnderWaitPolicy() {
        TokenBucketRateLimiter limiter = limiter(2, Duration.ofSeconds(1), RateLimitPolicy.WAIT);
        limiter.acquire();
        limiter.acquire();

        Duration waited = limiter.acquire();

        assertEquals(Duration.ofMillis(500), waited);
        assertEquals(List.of(Duration.ofMillis(500)), sleeps);
    }

    @Test
    void acquire_throwsUnderRejectPolicy() {
        TokenBucketRateLimiter limiter = limiter(1, Duration.ofSeconds(2), RateLimitPolicy.REJECT);
        limiter.acquire();

        RateLimitExceededException e = assertThrows(RateLimitExceededException.class, limiter::acquire);

        assertEquals(Duration.ofSeconds(2), e.getRetryAfter());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void acquire_sustainedCallsAreSpacedByTheRefillInterval() {
        TokenBucketRateLimiter limiter = limiter(10, Duration.ofSeconds(1), RateLimitPolicy.WAIT);
        long start = nanos.get();

        for (int i = 0; i < 30; i++) {
            limiter.acquire();
        }

        // 10 immediate, then one every 100ms
        Duration elapsed = Duration.ofNanos(nanos.get() - start);
        assertTrue(elapsed.compareTo(Duration.ofMillis(1990)) >= 0, "elapsed " + elapsed);
        assertTrue(elapsed.compareTo(Duration.ofMillis(2010)) <= 0, "elapsed " + elapsed);
    }

    @Test
    void acquire_callsSpacedAtTheRefillIntervalNeverSleep() {
        TokenBucketRateLimiter limiter = limiter(7, Duration.ofSeconds(1), RateLimitPolicy.WAIT);
        for (int i = 0; i < 7; i++) {
            limiter.acquire();
        }
        Duration spacing = Duration.ofSeconds(1).dividedBy(7);

        for (int i = 0; i < 100; i++) {
            nanos.addAndGet(spacing.toNanos());
            assertEquals(Duration.ZERO, limiter.acquire(), "call " + i);
        }
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void acquire_interruptedWaitRestoresInterruptFlag() {
        TokenBucket bucket = new TokenBucket(1, Duration.ofSeconds(1), nanos::get);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(bucket, RateLimitPolicy.WAIT, duration -> {
            throw new InterruptedException("stop");
        });
        limiter.acquire();

        TransportException error = assertThrows(TransportException.class, limiter::acquire);
        assertTrue(Thread.interrupted());
        assertEquals(TrackerErrorKind.TRANSPORT, error.getKind());
        assertTrue(error.getCause() instanceof InterruptedException);
    }

    @Test
    void acquire_concurrentCallersNeverExceedCapacityWithinOnePeriod() throws Exception {
        JiraProperties properties = new JiraProperties();
        properties.getRateLimit().setCalls(5);
        properties.getRateLimit().setPeriod(Duration.ofMinutes(10));
        properties.getRateLimit().setPolicy(RateLimitPolicy.REJECT);
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(properties);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        for (int i = 0; i < 40; i++) {
            executor.submit(() -> {
                start.await();
                try {
                    limiter.acquire();
                    granted.incrementAndGet();
                } catch (RateLimitExceededException e) {
                    rejected.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(5, granted.get());
        assertEquals(35, rejected.get());
    }

    @Test
    void getBucketState_reflectsConsumption() {
        TokenBucketRateLimiter limiter = limiter(4, Duration.ofSeconds(1), RateLimitPolicy.WAIT);
        limiter.acquire();

        assertEquals(3.0, limiter.getBucketState().getTokens(), 1e-9);
        assertEquals(4, limiter.getBucketState().getCapacity());
    }
}
