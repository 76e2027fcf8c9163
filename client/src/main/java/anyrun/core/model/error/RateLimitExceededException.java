package anyrun.core.model.error;

import java.time.Duration;

/**
 * Thrown by a non-waiting acquire when the local token bucket is empty.
 */
public class RateLimitExceededException extends SandboxException {

    private final String bucket;
    private final Duration retryAfter;

    public RateLimitExceededException(String bucket, Duration retryAfter) {
        super("Rate limit exceeded for bucket '" + bucket + "'. Please wait " + retryAfter.toMillis() + " ms.");
        this.bucket = bucket;
        this.retryAfter = retryAfter;
    }

    /** Returns the name of the exhausted bucket. */
    public String bucket() {
        return bucket;
    }

    /** Returns the time until a token becomes available. */
    public Duration retryAfter() {
        return retryAfter;
    }
}
