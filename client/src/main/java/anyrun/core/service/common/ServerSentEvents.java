package anyrun.core.service.common;

import java.util.Optional;

/**
 * Line-level parsing of a server-sent event stream.
 */
public final class ServerSentEvents {

    private static final String DATA_FIELD = "data:";

    private ServerSentEvents() {}

    /**
     * Return the payload of a {@code data:} line.
     *
     * <p>Blank lines, comments and other fields ({@code event:}, {@code id:}, {@code retry:})
     * carry no payload.
     *
     * @param line a line without its terminator
     * @return the trimmed payload, or empty
     */
    public static Optional<String> dataOf(String line) {
        if (line == null || !line.startsWith(DATA_FIELD)) {
            return Optional.empty();
        }
        final var payload = line.substring(DATA_FIELD.length()).trim();
        return payload.isEmpty() ? Optional.empty() : Optional.of(payload);
    }
}
