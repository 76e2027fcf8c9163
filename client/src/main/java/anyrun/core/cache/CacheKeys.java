package anyrun.core.cache;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Derives cache keys from an operation and its arguments.
 *
 * <p>Keys have the form {@code operation:arg1:arg2}. Arguments are URL-encoded, so an argument
 * containing {@code :} cannot make two different argument lists collide.
 */
public final class CacheKeys {

    private static final String SEPARATOR = ":";

    private CacheKeys() {}

    public static String of(String operation, Object... args) {
        return of(operation, Arrays.asList(args));
    }

    public static String of(String operation, List<?> args) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation is required");
        }
        return Stream.concat(Stream.of(operation), args.stream().map(CacheKeys::encode))
                .collect(Collectors.joining(SEPARATOR));
    }

    private static String encode(Object arg) {
        return URLEncoder.encode(String.valueOf(arg), StandardCharsets.UTF_8);
    }
}
