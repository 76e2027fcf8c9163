package anyrun.config;

import anyrun.core.model.error.SandboxException;

/**
 * Raised when the client configuration is missing a required value or holds an invalid one.
 */
public class SandboxConfigurationException extends SandboxException {

    public SandboxConfigurationException(String message) {
        super(message);
    }

    public SandboxConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
