package anyrun.core.service;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import anyrun.core.model.error.ClassifiedError;
import anyrun.core.model.error.RetryExhaustedException;
import anyrun.core.model.error.SandboxApiException;
import anyrun.core.model.retry.RetryPolicy;
import anyrun.core.port.out.Metrics;

/**
 * Runs an operation under a {@link RetryPolicy}.
 *
 * <p>Only {@link SandboxApiException}s of a transient kind are retried. Any other failure, and
 * every failure when the policy is disabled, propagates unchanged on first occurrence. When the
 * attempts run out on a transient failure the caller receives a {@link RetryExhaustedException}
 * wrapping the last error.
 *
 * <p>A rate limit error with a {@code Retry-After} hint waits exactly the hint. Otherwise the
 * policy's capped backoff applies, multiplied by a factor in [0.5, 1.5] when jitter is on.
 */
public class RetryExecutor {

    private static final Logger LOG = Logger.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final Metrics metrics;
    private final DoubleSupplier random;

    public RetryExecutor(RetryPolicy policy, Metrics metrics) {
        this(policy, metrics, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param policy  the retry policy
     * @param metrics the metrics sink
     * @param random  source of uniform values in [0, 1) used for jitter
     */
    public RetryExecutor(RetryPolicy policy, Metrics metrics, DoubleSupplier random) {
        this.policy = policy;
        this.metrics = metrics;
        this.random = random;
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Run the operation, retrying transient failures.
     *
     * @param operation name used for logs and metrics
     * @param attempt   produces a fresh attempt on every call
     * @param <T>       the result type
     * @return the first successful result
     */
    public <T> Uni<T> execute(String operation, Supplier<Uni<T>> attempt) {
        return attempt(operation, attempt, 1);
    }

    private <T> Uni<T> attempt(String operation, Supplier<Uni<T>> attempt, int number) {
        return Uni.createFrom().deferred(attempt::get)
                .onFailure()
                .recoverWithUni(failure -> backOff(operation, failure, number)
                        .chain(() -> attempt(operation, attempt, number + 1)));
    }

    /**
     * Decide what follows a failed attempt.
     *
     * <p>The returned {@code Uni} completes after the retry delay when another attempt is due,
     * and otherwise fails with the error the caller should see: the failure itself when it is not
     * retryable, or a {@link RetryExhaustedException} once the attempts are spent.
     *
     * @param operation name used for logs and metrics
     * @param failure   the failure of the attempt
     * @param number    the 1-based number of the attempt that failed
     * @return a signal to attempt again
     */
    public Uni<Void> backOff(String operation, Throwable failure, int number) {
        if (!(failure instanceof SandboxApiException apiError)
                || !apiError.error().isTransient()
                || !policy.enabled()) {
            return Uni.createFrom().failure(failure);
        }
        if (number >= policy.maxAttempts()) {
            LOG.debugv("{0} failed after {1} attempts: {2}", operation, number, apiError.getMessage());
            return Uni.createFrom().failure(new RetryExhaustedException(number, apiError));
        }

        final var delay = delayAfter(number, apiError.error());
        final var kind = apiError.kind().name().toLowerCase(Locale.ROOT);
        LOG.debugv(
                "{0} attempt {1} failed with {2}, retrying in {3} ms",
                operation, number, apiError.kind(), delay.toMillis());
        metrics.recordRetry(operation, kind);

        return delay.isZero()
                ? Uni.createFrom().voidItem()
                : Uni.createFrom().voidItem().onItem().delayIt().by(delay);
    }

    /**
     * Compute the wait after a failed attempt.
     *
     * @param attempt the 1-based number of the attempt that failed
     * @param error   the failure
     * @return the delay before the next attempt
     */
    public Duration delayAfter(int attempt, ClassifiedError error) {
        if (error instanceof ClassifiedError.RateLimit rateLimit && rateLimit.retryAfter().isPresent()) {
            return rateLimit.retryAfter().get();
        }
        final var base = policy.backoffDelay(attempt);
        if (!policy.jitter()) {
            return base;
        }
        final var factor = 0.5 + random.getAsDouble();
        return Duration.ofNanos((long) (base.toNanos() * factor));
    }
}
