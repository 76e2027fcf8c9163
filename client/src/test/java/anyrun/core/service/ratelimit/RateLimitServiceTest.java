package anyrun.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import anyrun.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import anyrun.adapter.out.ratelimit.memory.TokenBucketRegistry;
import anyrun.core.model.error.RateLimitExceededException;
import anyrun.core.model.ratelimit.RateLimitKey;
import anyrun.core.model.ratelimit.TokenBucketLimit;
import anyrun.core.port.out.Metrics;
import anyrun.core.port.out.RateLimiter;
import anyrun.core.util.Clock;
import anyrun.mock.TestConfigs;

@DisplayName("RateLimitService")
class RateLimitServiceTest {

    private Metrics metrics;
    private RateLimitResolver resolver;

    @BeforeEach
    void setUp() {
        metrics = mock(Metrics.class);
        resolver = new RateLimitResolver(TestConfigs.config().rateLimit());
    }

    private RateLimitService serviceWith(TokenBucketLimit limit) {
        resolver.setLimit(RateLimitKey.ANALYZE, limit);
        var limiter = new InMemoryRateLimiter(new TokenBucketRegistry(), Clock.system(), true);
        return new RateLimitService(limiter, resolver, metrics);
    }

    @Nested
    @DisplayName("acquire")
    class AcquireTests {

        @Test
        @DisplayName("should return immediately while tokens remain")
        void shouldReturnImmediately() {
            var service = serviceWith(new TokenBucketLimit(1, 2));

            service.acquire(RateLimitKey.ANALYZE).await().atMost(Duration.ofMillis(200));
            service.acquire(RateLimitKey.ANALYZE).await().atMost(Duration.ofMillis(200));

            verify(metrics, never()).recordRateLimitWait(any());
        }

        @Test
        @DisplayName("should wait for a refill instead of dropping the call")
        void shouldWaitForRefill() {
            var service = serviceWith(new TokenBucketLimit(10, 1));
            service.acquire(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1));

            var started = System.nanoTime();
            service.acquire(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(2));
            var waitedMillis = (System.nanoTime() - started) / 1_000_000L;

            assertTrue(waitedMillis >= 80, "waited " + waitedMillis + "ms");
            verify(metrics).recordRateLimitWait("analyze");
        }
    }

    @Nested
    @DisplayName("check and tryAcquire")
    class NonBlockingTests {

        @Test
        @DisplayName("should report whether a token was taken")
        void shouldReportCheck() {
            var service = serviceWith(new TokenBucketLimit(0.01, 1));

            assertTrue(service.check(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1)));
            assertFalse(service.check(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1)));
        }

        @Test
        @DisplayName("should fail with the wait when the bucket is empty")
        void shouldFailWithWait() {
            var service = serviceWith(new TokenBucketLimit(0.5, 1));
            service.tryAcquire(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1));

            var error = assertThrows(
                    RateLimitExceededException.class,
                    () -> service.tryAcquire(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1)));

            assertEquals("analyze", error.bucket());
            assertTrue(error.retryAfter().compareTo(Duration.ofMillis(1900)) > 0);
        }

        @Test
        @DisplayName("should refill a bucket on reset")
        void shouldReset() {
            var service = serviceWith(new TokenBucketLimit(0.01, 1));
            service.check(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1));

            service.reset(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1));

            assertTrue(service.check(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1)));
        }
    }

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        @DisplayName("should report remaining tokens without consuming them")
        void shouldReportWithoutConsuming() {
            var service = serviceWith(new TokenBucketLimit(0.001, 2));
            service.acquire(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1));

            var first = service.status(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1));
            var second = service.status(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1));

            assertTrue(first.allowed());
            assertEquals(1.0, first.remaining(), 1e-3);
            assertEquals(1.0, second.remaining(), 1e-3);
            assertTrue(service.check(RateLimitKey.ANALYZE).await().atMost(Duration.ofSeconds(1)));
        }

        @Test
        @DisplayName("should report an open bucket when the limiter fails")
        void shouldFailOpen() {
            var limiter = mock(RateLimiter.class);
            when(limiter.isEnabled()).thenReturn(true);
            when(limiter.getStatus(any(), any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("redis down")));
            var service = new RateLimitService(limiter, resolver, metrics);

            assertTrue(service.status(RateLimitKey.STATUS).await().atMost(Duration.ofSeconds(1)).allowed());
            verify(metrics).recordBackendFailure("ratelimit", "getStatus");
        }
    }

    @Nested
    @DisplayName("Degradation")
    class DegradationTests {

        @Test
        @DisplayName("should allow the call when the limiter fails")
        void shouldFailOpen() {
            var limiter = mock(RateLimiter.class);
            when(limiter.isEnabled()).thenReturn(true);
            when(limiter.checkAndConsume(any(), any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("redis down")));
            var service = new RateLimitService(limiter, resolver, metrics);

            assertTrue(service.check(RateLimitKey.STATUS).await().atMost(Duration.ofSeconds(1)));
            verify(metrics).recordBackendFailure("ratelimit", "checkAndConsume");
        }

        @Test
        @DisplayName("should not consult a disabled limiter")
        void shouldSkipDisabledLimiter() {
            var limiter = mock(RateLimiter.class);
            when(limiter.isEnabled()).thenReturn(false);
            var service = new RateLimitService(limiter, resolver, metrics);

            service.acquire(RateLimitKey.STATUS).await().atMost(Duration.ofSeconds(1));

            verify(limiter, never()).checkAndConsume(any(), any());
        }
    }
}
