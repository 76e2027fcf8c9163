package anyrun.core.model.retry;

/**
 * How the delay grows between attempts.
 */
public enum RetryStrategy {
    /** {@code initialDelay * factor^(attempt-1)}. */
    EXPONENTIAL,
    /** {@code initialDelay * attempt}. */
    LINEAR
}
