package anyrun.core.model.error;

/**
 * Base class of every failure surfaced by the sandbox client.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
