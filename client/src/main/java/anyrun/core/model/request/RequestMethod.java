package anyrun.core.model.request;

/**
 * HTTP methods used by the sandbox API.
 */
public enum RequestMethod {
    GET,
    POST,
    PATCH,
    DELETE;

    /**
     * Check whether requests with this method only read state.
     *
     * @return true for GET
     */
    public boolean isRead() {
        return this == GET;
    }
}
