package anyrun.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import anyrun.core.model.cache.CacheBackendType;
import anyrun.core.model.ratelimit.RateLimitBackendType;
import anyrun.core.model.retry.RetryStrategy;
import anyrun.mock.TestConfigs;

@DisplayName("SandboxConfigLoader")
class SandboxConfigLoaderTest {

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("should apply documented defaults")
        void shouldApplyDefaults() {
            var config = TestConfigs.config();

            assertEquals(TestConfigs.API_KEY, config.apiKey());
            assertEquals("https://api.any.run", config.baseUrl());
            assertEquals("v1", config.apiVersion());
            assertEquals(Duration.ofSeconds(30), config.timeout());
            assertTrue(config.verifyTls());
            assertTrue(config.proxies().isEmpty());
            assertTrue(config.headers().isEmpty());
            assertEquals(Duration.ofSeconds(30), config.shutdownGracePeriod());
        }

        @Test
        @DisplayName("should apply cache, rate limit and retry defaults")
        void shouldApplyGroupDefaults() {
            var config = TestConfigs.config();

            assertTrue(config.cache().enabled());
            assertEquals(CacheBackendType.MEMORY, config.cache().backend());
            assertEquals(Duration.ofMinutes(5), config.cache().ttl());
            assertEquals("anyrun:", config.cache().prefix());
            assertEquals(10_000L, config.cache().maxEntries());

            assertTrue(config.rateLimit().enabled());
            assertEquals(RateLimitBackendType.MEMORY, config.rateLimit().backend());
            assertEquals(10.0, config.rateLimit().rate());
            assertEquals(Duration.ofSeconds(1), config.rateLimit().window());

            assertTrue(config.retry().enabled());
            assertEquals(RetryStrategy.EXPONENTIAL, config.retry().strategy());
            assertEquals(3, config.retry().maxAttempts());
            assertEquals(Duration.ofSeconds(1), config.retry().initialDelay());
            assertEquals(Duration.ofSeconds(60), config.retry().maxDelay());
            assertEquals(2.0, config.retry().backoffFactor());
            assertTrue(config.retry().jitter());

            assertEquals("redis://localhost:6379", config.redis().url());
            assertTrue(config.metrics().enabled());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class OverrideTests {

        @Test
        @DisplayName("should apply explicit overrides")
        void shouldApplyOverrides() {
            var config = TestConfigs.config(
                    "anyrun.base-url", "http://localhost:8089",
                    "anyrun.cache.backend", "REDIS",
                    "anyrun.cache.ttl", "PT0S",
                    "anyrun.retry.strategy", "LINEAR",
                    "anyrun.retry.max-attempts", "5",
                    "anyrun.headers.X-Team", "blue",
                    "anyrun.proxies.https", "http://proxy.local:3128",
                    "anyrun.rate-limit.buckets.analyze.rate", "0.2");

            assertEquals("http://localhost:8089", config.baseUrl());
            assertEquals(CacheBackendType.REDIS, config.cache().backend());
            assertEquals(Duration.ZERO, config.cache().ttl());
            assertEquals(RetryStrategy.LINEAR, config.retry().strategy());
            assertEquals(5, config.retry().maxAttempts());
            assertEquals("blue", config.headers().get("X-Team"));
            assertEquals("http://proxy.local:3128", config.proxies().get("https"));
            assertEquals(0.2, config.rateLimit().buckets().get("analyze").rate().orElseThrow());
            assertFalse(config.rateLimit().buckets().get("analyze").burst().isPresent());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should require an API key")
        void shouldRequireApiKey() {
            assertThrows(SandboxConfigurationException.class, () -> SandboxConfigLoader.load(Map.of()));
        }

        @Test
        @DisplayName("should reject a blank API key")
        void shouldRejectBlankApiKey() {
            assertThrows(
                    SandboxConfigurationException.class,
                    () -> SandboxConfigLoader.load(Map.of("anyrun.api-key", " ")));
        }

        @Test
        @DisplayName("should reject a base URL that is not http or https")
        void shouldRejectBaseUrl() {
            var error = assertThrows(
                    SandboxConfigurationException.class,
                    () -> TestConfigs.config("anyrun.base-url", "ftp://api.any.run"));

            assertTrue(error.getMessage().contains("anyrun.base-url"));
        }

        @Test
        @DisplayName("should reject out-of-range values")
        void shouldRejectRanges() {
            assertThrows(SandboxConfigurationException.class, () -> TestConfigs.config("anyrun.timeout", "PT0S"));
            assertThrows(
                    SandboxConfigurationException.class, () -> TestConfigs.config("anyrun.retry.max-attempts", "0"));
            assertThrows(
                    SandboxConfigurationException.class,
                    () -> TestConfigs.config("anyrun.retry.backoff-factor", "0.5"));
            assertThrows(SandboxConfigurationException.class, () -> TestConfigs.config("anyrun.cache.ttl", "-PT1S"));
            assertThrows(
                    SandboxConfigurationException.class, () -> TestConfigs.config("anyrun.rate-limit.rate", "-1"));
        }

        @Test
        @DisplayName("should reject values of the wrong type")
        void shouldRejectWrongType() {
            assertThrows(
                    SandboxConfigurationException.class,
                    () -> TestConfigs.config("anyrun.retry.max-attempts", "three"));
            assertThrows(
                    SandboxConfigurationException.class, () -> TestConfigs.config("anyrun.cache.backend", "DISK"));
        }
    }
}
