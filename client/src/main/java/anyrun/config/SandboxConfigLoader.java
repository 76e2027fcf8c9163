package anyrun.config;

import java.net.URI;
import java.util.Map;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jboss.logging.Logger;

/**
 * Builds {@link SandboxConfig} outside of a container.
 *
 * <p>Sources, highest precedence first: system properties, {@code ANYRUN_*} environment
 * variables, the overrides passed to {@link #load(Map)}, then
 * {@code META-INF/microprofile-config.properties} on the class path.
 */
public final class SandboxConfigLoader {

    private static final Logger LOG = Logger.getLogger(SandboxConfigLoader.class);

    static final int OVERRIDES_ORDINAL = 275;

    private SandboxConfigLoader() {}

    /**
     * Load the configuration without overrides.
     *
     * @return the validated configuration
     * @throws SandboxConfigurationException if a value is missing or invalid
     */
    public static SandboxConfig load() {
        return load(Map.of());
    }

    /**
     * Load the configuration.
     *
     * @param overrides properties such as {@code anyrun.api-key}, applied above the class path
     *                  defaults
     * @return the validated configuration
     * @throws SandboxConfigurationException if a value is missing or invalid
     */
    public static SandboxConfig load(Map<String, String> overrides) {
        final SandboxConfig config;
        try {
            final SmallRyeConfig smallRyeConfig = new SmallRyeConfigBuilder()
                    .addDefaultSources()
                    .addDiscoveredConverters()
                    .withSources(new PropertiesConfigSource(overrides, "anyrun-overrides", OVERRIDES_ORDINAL))
                    .withMapping(SandboxConfig.class)
                    .build();
            config = smallRyeConfig.getConfigMapping(SandboxConfig.class);
        } catch (RuntimeException e) {
            throw new SandboxConfigurationException("Invalid sandbox client configuration: " + e.getMessage(), e);
        }
        validate(config);
        LOG.debugv(
                "Loaded sandbox configuration: baseUrl={0}, cache={1}, rateLimit={2}, retry={3}",
                config.baseUrl(),
                config.cache().enabled() ? config.cache().backend() : "disabled",
                config.rateLimit().enabled() ? config.rateLimit().backend() : "disabled",
                config.retry().enabled() ? config.retry().maxAttempts() + " attempts" : "disabled");
        return config;
    }

    /**
     * Check value ranges the mapping itself cannot express.
     *
     * @param config the configuration
     * @throws SandboxConfigurationException on the first invalid value
     */
    public static void validate(SandboxConfig config) {
        if (config.apiKey() == null || config.apiKey().isBlank()) {
            throw new SandboxConfigurationException("anyrun.api-key must not be blank");
        }
        requireHttpUrl("anyrun.base-url", config.baseUrl());
        config.proxies().forEach((scheme, url) -> requireHttpUrl("anyrun.proxies." + scheme, url));
        if (config.timeout().isNegative() || config.timeout().isZero()) {
            throw new SandboxConfigurationException("anyrun.timeout must be positive");
        }
        if (config.shutdownGracePeriod().isNegative()) {
            throw new SandboxConfigurationException("anyrun.shutdown-grace-period must not be negative");
        }
        if (config.cache().ttl().isNegative()) {
            throw new SandboxConfigurationException("anyrun.cache.ttl must not be negative");
        }
        if (config.cache().maxEntries() < 1) {
            throw new SandboxConfigurationException("anyrun.cache.max-entries must be at least 1");
        }
        if (config.rateLimit().rate() < 0) {
            throw new SandboxConfigurationException("anyrun.rate-limit.rate must not be negative");
        }
        if (config.rateLimit().window().isNegative()) {
            throw new SandboxConfigurationException("anyrun.rate-limit.window must not be negative");
        }
        if (config.retry().maxAttempts() < 1) {
            throw new SandboxConfigurationException("anyrun.retry.max-attempts must be at least 1");
        }
        if (config.retry().backoffFactor() < 1.0) {
            throw new SandboxConfigurationException("anyrun.retry.backoff-factor must be at least 1");
        }
        if (config.retry().initialDelay().isNegative() || config.retry().maxDelay().isNegative()) {
            throw new SandboxConfigurationException("anyrun.retry delays must not be negative");
        }
    }

    private static void requireHttpUrl(String property, String value) {
        try {
            final var uri = URI.create(value);
            final var scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new SandboxConfigurationException(property + " must be an http or https URL: " + value);
            }
        } catch (IllegalArgumentException e) {
            throw new SandboxConfigurationException(property + " is not a valid URL: " + value, e);
        }
    }
}
