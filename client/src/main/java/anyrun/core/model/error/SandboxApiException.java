package anyrun.core.model.error;

/**
 * Failure of a single API call, tagged with its {@link ClassifiedError}.
 *
 * <p>The retry engine decides what to do by looking at {@link #error()}, not at the exception
 * type.
 */
public class SandboxApiException extends SandboxException {

    private final ClassifiedError error;

    public SandboxApiException(ClassifiedError error) {
        this(error, null);
    }

    public SandboxApiException(ClassifiedError error, Throwable cause) {
        super(describe(error), cause);
        this.error = error;
    }

    /** Returns the classified error. */
    public ClassifiedError error() {
        return error;
    }

    /** Returns the kind tag of the classified error. */
    public ErrorKind kind() {
        return error.kind();
    }

    /** Returns the HTTP status code, or 0 when no response was involved. */
    public int statusCode() {
        return error.statusCode();
    }

    private static String describe(ClassifiedError error) {
        if (error.statusCode() > 0) {
            return error.kind() + " (HTTP " + error.statusCode() + "): " + error.message();
        }
        return error.kind() + ": " + error.message();
    }
}
