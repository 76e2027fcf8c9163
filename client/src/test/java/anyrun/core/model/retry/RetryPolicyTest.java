package anyrun.core.model.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Test
    @DisplayName("should give a disabled policy a single attempt")
    void shouldGiveDisabledSingleAttempt() {
        var policy = new RetryPolicy(
                false, RetryStrategy.EXPONENTIAL, 5, Duration.ofSeconds(1), Duration.ofSeconds(5), 2.0, true);

        assertEquals(1, policy.effectiveMaxAttempts());
        assertEquals(3, RetryPolicy.defaults().effectiveMaxAttempts());
    }

    @Test
    @DisplayName("should cap the delay at the maximum")
    void shouldCapDelay() {
        var policy = new RetryPolicy(
                true, RetryStrategy.EXPONENTIAL, 20, Duration.ofSeconds(1), Duration.ofSeconds(60), 3.0, false);

        assertEquals(Duration.ofSeconds(9), policy.backoffDelay(3));
        assertEquals(Duration.ofSeconds(60), policy.backoffDelay(15));
    }

    @Test
    @DisplayName("should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new RetryPolicy(true, RetryStrategy.LINEAR, 0, Duration.ZERO, Duration.ZERO, 1.0, false));
        assertThrows(
                IllegalArgumentException.class,
                () -> new RetryPolicy(true, RetryStrategy.LINEAR, 1, Duration.ZERO, Duration.ZERO, 0.9, false));
        assertThrows(
                IllegalArgumentException.class,
                () -> new RetryPolicy(
                        true, RetryStrategy.LINEAR, 1, Duration.ofSeconds(-1), Duration.ZERO, 1.0, false));
    }
}
