package anyrun.adapter.out.cache.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import anyrun.mock.ManualClock;

@DisplayName("CaffeineCacheBackend")
class CaffeineCacheBackendTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private ManualClock clock;
    private CaffeineCacheBackend cache;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        cache = new CaffeineCacheBackend(100, clock);
    }

    @Nested
    @DisplayName("Basic operations")
    class BasicOperations {

        @Test
        @DisplayName("should return empty for missing key")
        void shouldReturnEmptyForMissingKey() {
            assertEquals(Optional.empty(), cache.get("missing").await().atMost(TIMEOUT));
            assertFalse(cache.exists("missing").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should return stored value")
        void shouldReturnStoredValue() {
            cache.set("key", "value", Optional.of(Duration.ofMinutes(1))).await().atMost(TIMEOUT);

            assertEquals(Optional.of("value"), cache.get("key").await().atMost(TIMEOUT));
            assertTrue(cache.exists("key").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should overwrite existing value")
        void shouldOverwrite() {
            cache.set("key", "first", Optional.empty()).await().atMost(TIMEOUT);
            cache.set("key", "second", Optional.empty()).await().atMost(TIMEOUT);

            assertEquals(Optional.of("second"), cache.get("key").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should delete a value")
        void shouldDelete() {
            cache.set("key", "value", Optional.empty()).await().atMost(TIMEOUT);

            cache.delete("key").await().atMost(TIMEOUT);

            assertEquals(Optional.empty(), cache.get("key").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should drop every entry on close")
        void shouldClearOnClose() {
            cache.set("a", "1", Optional.empty()).await().atMost(TIMEOUT);
            cache.set("b", "2", Optional.empty()).await().atMost(TIMEOUT);

            cache.close();

            assertFalse(cache.exists("a").await().atMost(TIMEOUT));
            assertFalse(cache.exists("b").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("should expire an entry once its TTL has elapsed")
        void shouldExpireAfterTtl() {
            cache.set("key", "value", Optional.of(Duration.ofSeconds(10))).await().atMost(TIMEOUT);

            clock.advance(Duration.ofSeconds(9));
            assertEquals(Optional.of("value"), cache.get("key").await().atMost(TIMEOUT));

            clock.advance(Duration.ofSeconds(2));
            assertEquals(Optional.empty(), cache.get("key").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should keep an entry without TTL indefinitely")
        void shouldNeverExpireWithoutTtl() {
            cache.set("key", "value", Optional.empty()).await().atMost(TIMEOUT);

            clock.advance(Duration.ofDays(365));

            assertEquals(Optional.of("value"), cache.get("key").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should give each entry its own TTL")
        void shouldUsePerEntryTtl() {
            cache.set("short", "1", Optional.of(Duration.ofSeconds(1))).await().atMost(TIMEOUT);
            cache.set("long", "2", Optional.of(Duration.ofMinutes(1))).await().atMost(TIMEOUT);

            clock.advance(Duration.ofSeconds(5));

            assertFalse(cache.exists("short").await().atMost(TIMEOUT));
            assertTrue(cache.exists("long").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should restart the TTL when a value is overwritten")
        void shouldRestartTtlOnUpdate() {
            cache.set("key", "first", Optional.of(Duration.ofSeconds(10))).await().atMost(TIMEOUT);
            clock.advance(Duration.ofSeconds(8));
            cache.set("key", "second", Optional.of(Duration.ofSeconds(10))).await().atMost(TIMEOUT);

            clock.advance(Duration.ofSeconds(8));

            assertEquals(Optional.of("second"), cache.get("key").await().atMost(TIMEOUT));
        }
    }
}
