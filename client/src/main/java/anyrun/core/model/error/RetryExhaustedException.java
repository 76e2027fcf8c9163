package anyrun.core.model.error;

/**
 * Thrown when a transient failure persisted through every allowed attempt.
 *
 * <p>Distinguishes "gave up on a transient condition" from a request the service rejected
 * outright, which surfaces as a plain {@link SandboxApiException}.
 */
public class RetryExhaustedException extends SandboxException {

    private final int attempts;
    private final SandboxApiException lastError;

    public RetryExhaustedException(int attempts, SandboxApiException lastError) {
        super("Failed after " + attempts + " attempts. Last error: " + lastError.getMessage(), lastError);
        this.attempts = attempts;
        this.lastError = lastError;
    }

    /** Returns how many times the operation was invoked. */
    public int attempts() {
        return attempts;
    }

    /** Returns the failure observed on the final attempt. */
    public SandboxApiException lastError() {
        return lastError;
    }

    /** Returns the classified error of the final attempt. */
    public ClassifiedError error() {
        return lastError.error();
    }
}
