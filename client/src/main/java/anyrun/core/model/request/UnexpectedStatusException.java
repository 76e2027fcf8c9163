package anyrun.core.model.request;

/**
 * Raised by a streaming transport when the server answers the connect request with a non-2xx
 * status, so that the caller can classify the response.
 */
public class UnexpectedStatusException extends RuntimeException {

    private final RawResponse response;

    public UnexpectedStatusException(RawResponse response) {
        super("Unexpected HTTP status " + response.statusCode());
        this.response = response;
    }

    public RawResponse response() {
        return response;
    }
}
