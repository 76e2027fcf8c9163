package anyrun.core.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import anyrun.adapter.out.cache.memory.CaffeineCacheBackend;
import anyrun.core.port.out.CacheBackend;
import anyrun.core.port.out.Metrics;
import anyrun.mock.ManualClock;

@DisplayName("ResponseCache")
class ResponseCacheTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private Metrics metrics;

    @BeforeEach
    void setUp() {
        metrics = mock(Metrics.class);
    }

    @Nested
    @DisplayName("Enabled")
    class EnabledTests {

        private ManualClock clock;
        private CaffeineCacheBackend backend;
        private ResponseCache cache;

        @BeforeEach
        void setUp() {
            clock = new ManualClock();
            backend = new CaffeineCacheBackend(100, clock);
            cache = new ResponseCache(backend, true, "anyrun:", Duration.ofMinutes(5), metrics);
        }

        @Test
        @DisplayName("should prefix keys in the backend")
        void shouldPrefixKeys() {
            cache.set("get_environment", "{}").await().atMost(TIMEOUT);

            assertEquals(Optional.of("{}"), backend.get("anyrun:get_environment").await().atMost(TIMEOUT));
            assertEquals(Optional.of("{}"), cache.get("get_environment").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should apply the default TTL")
        void shouldApplyDefaultTtl() {
            cache.set("key", "value").await().atMost(TIMEOUT);

            clock.advance(Duration.ofMinutes(5).plusSeconds(1));

            assertEquals(Optional.empty(), cache.get("key").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should never expire entries when the default TTL is zero")
        void shouldNeverExpireWithZeroTtl() {
            var forever = new ResponseCache(backend, true, "", Duration.ZERO, metrics);
            forever.set("key", "value").await().atMost(TIMEOUT);

            clock.advance(Duration.ofDays(30));

            assertEquals(Optional.of("value"), forever.get("key").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should honor an explicit TTL")
        void shouldHonorExplicitTtl() {
            cache.set("key", "value", Optional.of(Duration.ofSeconds(1))).await().atMost(TIMEOUT);

            clock.advance(Duration.ofSeconds(2));

            assertFalse(cache.exists("key").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("Disabled")
    class DisabledTests {

        @Test
        @DisplayName("should never touch the backend")
        void shouldNotTouchBackend() {
            var backend = mock(CacheBackend.class);
            var cache = new ResponseCache(backend, false, "anyrun:", Duration.ofMinutes(5), metrics);

            cache.set("key", "value").await().atMost(TIMEOUT);
            assertEquals(Optional.empty(), cache.get("key").await().atMost(TIMEOUT));
            assertFalse(cache.exists("key").await().atMost(TIMEOUT));
            cache.delete("key").await().atMost(TIMEOUT);

            verifyNoInteractions(backend);
        }
    }

    @Nested
    @DisplayName("Degradation")
    class DegradationTests {

        private CacheBackend backend;
        private ResponseCache cache;

        @BeforeEach
        void setUp() {
            backend = mock(CacheBackend.class);
            cache = new ResponseCache(backend, true, "anyrun:", Duration.ofMinutes(5), metrics);
        }

        @Test
        @DisplayName("should treat a failed read as a miss")
        void shouldMissOnReadFailure() {
            when(backend.get(anyString())).thenReturn(Uni.createFrom().failure(new IllegalStateException("boom")));

            assertEquals(Optional.empty(), cache.get("key").await().atMost(TIMEOUT));
            verify(metrics).recordBackendFailure("cache", "get");
        }

        @Test
        @DisplayName("should ignore a failed write")
        void shouldIgnoreWriteFailure() {
            when(backend.set(anyString(), anyString(), any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("boom")));

            cache.set("key", "value").await().atMost(TIMEOUT);

            verify(metrics).recordBackendFailure("cache", "set");
        }

        @Test
        @DisplayName("should ignore a backend that throws instead of failing")
        void shouldIgnoreSynchronousThrow() {
            when(backend.delete(anyString())).thenThrow(new IllegalStateException("boom"));

            cache.delete("key").await().atMost(TIMEOUT);

            verify(metrics).recordBackendFailure("cache", "delete");
        }
    }
}
