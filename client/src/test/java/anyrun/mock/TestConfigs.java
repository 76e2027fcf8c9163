package anyrun.mock;

import java.util.HashMap;
import java.util.Map;

import anyrun.config.SandboxConfig;
import anyrun.config.SandboxConfigLoader;

/**
 * Builds real configuration mappings from property pairs.
 */
public final class TestConfigs {

    public static final String API_KEY = "test-api-key";

    private TestConfigs() {}

    /**
     * @param pairs alternating property names and values, applied over an API key
     */
    public static SandboxConfig config(String... pairs) {
        return SandboxConfigLoader.load(properties(pairs));
    }

    public static Map<String, String> properties(String... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("pairs must have an even length");
        }
        final var properties = new HashMap<String, String>();
        properties.put("anyrun.api-key", API_KEY);
        for (int i = 0; i < pairs.length; i += 2) {
            properties.put(pairs[i], pairs[i + 1]);
        }
        return properties;
    }
}
