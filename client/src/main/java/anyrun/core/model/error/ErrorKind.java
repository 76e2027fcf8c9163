package anyrun.core.model.error;

/**
 * Kind tag of a {@link ClassifiedError}.
 *
 * <p>Transient kinds describe conditions that may clear on their own and are retried; the others
 * describe a request the service will keep rejecting.
 */
public enum ErrorKind {
    AUTHENTICATION(false),
    NOT_FOUND(false),
    RATE_LIMIT(true),
    SERVER(true),
    VALIDATION(false),
    MALFORMED_RESPONSE(false),
    GENERIC(true);

    private final boolean transientCondition;

    ErrorKind(boolean transientCondition) {
        this.transientCondition = transientCondition;
    }

    /**
     * Check whether errors of this kind are retried.
     *
     * @return true for rate-limit, server and generic errors
     */
    public boolean isTransient() {
        return transientCondition;
    }
}
