package anyrun;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import anyrun.adapter.out.cache.CacheBackendProviderLoader;
import anyrun.adapter.out.http.VertxTransport;
import anyrun.adapter.out.ratelimit.RateLimiterProviderLoader;
import anyrun.adapter.out.ratelimit.memory.TokenBucketRegistry;
import anyrun.adapter.out.redis.RedisClients;
import anyrun.adapter.out.telemetry.MicrometerMetrics;
import anyrun.adapter.out.telemetry.NoOpMetrics;
import anyrun.config.SandboxConfig;
import anyrun.config.SandboxConfigLoader;
import anyrun.core.cache.ResponseCache;
import anyrun.core.model.analysis.AnalysisListRequest;
import anyrun.core.model.analysis.AnalysisRequest;
import anyrun.core.model.analysis.ApiResponse;
import anyrun.core.model.analysis.SubmissionResult;
import anyrun.core.model.analysis.TaskStatus;
import anyrun.core.model.analysis.TaskStatusUpdate;
import anyrun.core.model.cache.CacheBackendType;
import anyrun.core.model.common.ValidationResult;
import anyrun.core.model.error.ClassifiedError;
import anyrun.core.model.error.SandboxApiException;
import anyrun.core.model.ratelimit.RateLimitBackendType;
import anyrun.core.model.ratelimit.RateLimitKey;
import anyrun.core.model.request.RequestBody;
import anyrun.core.model.request.RequestDescriptor;
import anyrun.core.model.request.RequestMethod;
import anyrun.core.model.retry.RetryPolicy;
import anyrun.core.port.out.Metrics;
import anyrun.core.port.out.Transport;
import anyrun.core.service.AnalysisRequestValidator;
import anyrun.core.service.ErrorClassifier;
import anyrun.core.service.RequestExecutor;
import anyrun.core.service.RetryExecutor;
import anyrun.core.service.common.InFlightTracker;
import anyrun.core.service.ratelimit.RateLimitResolver;
import anyrun.core.service.ratelimit.RateLimitService;
import anyrun.core.util.Clock;

/**
 * Client for the ANY.RUN sandbox API.
 *
 * <p>Every operation is lazy: nothing is sent until the returned {@link Uni} or {@link Multi}
 * is subscribed. Calls go through the response cache, the token bucket of their operation and
 * the retry policy. Failures surface as {@link SandboxApiException} or
 * {@link anyrun.core.model.error.RetryExhaustedException}.
 *
 * <p>Live updates come from one feed only, the monitor event stream
 * ({@code /analysis/monitor/{taskid}/stream}), exposed as {@link #streamAnalysisStatus}. Its
 * events carry the task status, so no separate status stream is offered.
 *
 * <pre>{@code
 * try (var client = SandboxClient.builder().apiKey("...").build()) {
 *     var taskId = client.analyzeUrl("https://example.com").await().indefinitely().taskId();
 *     var status = client.awaitCompletion(taskId).await().indefinitely();
 * }
 * }</pre>
 */
public class SandboxClient implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SandboxClient.class);

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    static final Duration DEFAULT_AWAIT_TIMEOUT = Duration.ofSeconds(1800);

    private final SandboxConfig config;
    private final RequestExecutor executor;
    private final RateLimitService rateLimitService;
    private final ResponseCache cache;
    private final Transport transport;
    private final RedisClients redisClients;
    private final Vertx ownedVertx;
    private final ObjectMapper objectMapper;
    private final AnalysisRequestValidator validator = new AnalysisRequestValidator();
    private final InFlightTracker inFlight = new InFlightTracker();
    private final String pathPrefix;

    private SandboxClient(Builder builder, SandboxConfig config) {
        this.config = config;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : defaultObjectMapper();
        final Metrics metrics = builder.meterRegistry != null && config.metrics().enabled()
                ? new MicrometerMetrics(builder.meterRegistry, true)
                : NoOpMetrics.getInstance();

        final var needsRedis = (config.cache().enabled() && config.cache().backend() == CacheBackendType.REDIS)
                || (config.rateLimit().enabled() && config.rateLimit().backend() == RateLimitBackendType.REDIS);
        final var needsVertx = builder.transport == null || needsRedis;
        final var createVertx = needsVertx && builder.vertx == null;
        final var vertx = createVertx ? Vertx.vertx() : builder.vertx;

        this.redisClients = needsRedis ? new RedisClients(vertx, config.redis().url()) : null;
        if (builder.transport != null) {
            this.transport = builder.transport;
            this.ownedVertx = createVertx ? vertx : null;
        } else {
            this.transport = new VertxTransport(vertx, createVertx, config);
            this.ownedVertx = null;
        }

        final var clock = builder.clock != null ? builder.clock : Clock.system();
        final var registry = builder.registry != null ? builder.registry : TokenBucketRegistry.shared();

        final var backend = new CacheBackendProviderLoader(config, clock, redisClients, metrics).load();
        this.cache = new ResponseCache(
                backend, config.cache().enabled(), config.cache().prefix(), config.cache().ttl(), metrics);

        final var limiter = new RateLimiterProviderLoader(config, registry, clock, redisClients, metrics).load();
        this.rateLimitService = new RateLimitService(limiter, new RateLimitResolver(config.rateLimit()), metrics);

        final var retry = config.retry();
        final var policy = new RetryPolicy(
                retry.enabled(),
                retry.strategy(),
                retry.maxAttempts(),
                retry.initialDelay(),
                retry.maxDelay(),
                retry.backoffFactor(),
                retry.jitter());

        this.executor = new RequestExecutor(
                transport,
                cache,
                rateLimitService,
                new RetryExecutor(policy, metrics),
                new ErrorClassifier(objectMapper),
                objectMapper,
                metrics);
        this.pathPrefix = "/" + config.apiVersion();

        LOG.infov(
                "Sandbox client created for {0} (cache={1}, rateLimit={2}, retry={3})",
                config.baseUrl(),
                config.cache().enabled() ? config.cache().backend() : "disabled",
                rateLimitService.isEnabled() ? config.rateLimit().backend() : "disabled",
                policy.enabled() ? policy.maxAttempts() + " attempts" : "disabled");
    }

    public static Builder builder() {
        return new Builder();
    }

    // Submission

    /**
     * Submit a file, URL, download or rerun for analysis.
     *
     * @param request the submission
     * @return the id of the new task
     */
    public Uni<SubmissionResult> analyze(AnalysisRequest request) {
        return call(validator.validate(request), () -> {
            final var fields = request.toFormFields();
            final RequestBody body = request.hasFile()
                    ? new RequestBody.Multipart(
                            fields, new RequestBody.FilePart("file", request.filename(), request.content(), null))
                    : new RequestBody.Form(fields);
            final var descriptor = RequestDescriptor.builder("analyze", RequestMethod.POST, path("/analysis"))
                    .body(body)
                    .rateLimitKey(RateLimitKey.ANALYZE)
                    .build();
            return executor.execute(descriptor).map(response -> convert(response, SubmissionResult.class));
        });
    }

    public Uni<SubmissionResult> analyzeFile(byte[] content, String filename) {
        return analyze(AnalysisRequest.file(content, filename).build());
    }

    public Uni<SubmissionResult> analyzeUrl(String url) {
        return analyze(AnalysisRequest.url(url).build());
    }

    // Task queries

    /**
     * Fetch the analysis of a task. Cached.
     *
     * @param taskId the task id
     * @return the analysis data
     */
    public Uni<JsonNode> getAnalysis(String taskId) {
        return call(validator.validateTaskId(taskId), () -> data(RequestDescriptor.builder(
                        "get_analysis", RequestMethod.GET, path("/analysis/" + encode(taskId)))
                .cacheable(taskId)
                .rateLimitKey(RateLimitKey.STATUS)
                .build()));
    }

    public Uni<JsonNode> listAnalyses() {
        return listAnalyses(AnalysisListRequest.defaults());
    }

    /**
     * List past analyses, one page at a time. Cached per page.
     *
     * @param request the page to fetch
     * @return the page data
     */
    public Uni<JsonNode> listAnalyses(AnalysisListRequest request) {
        return call(validator.validate(request), () -> data(RequestDescriptor.builder(
                        "list_analyses", RequestMethod.GET, path("/analysis"))
                .queryParam("team", request.team())
                .queryParam("skip", request.skip())
                .queryParam("limit", request.limit())
                .cacheable(request.team(), request.skip(), request.limit())
                .rateLimitKey(RateLimitKey.LIST)
                .build()));
    }

    /**
     * Fetch the current status of a task. Never cached.
     */
    public Uni<TaskStatus> getAnalysisStatus(String taskId) {
        return call(validator.validateTaskId(taskId), () -> status(taskId));
    }

    public Uni<JsonNode> getAnalysisMonitor(String taskId) {
        return call(validator.validateTaskId(taskId), () -> data(RequestDescriptor.builder(
                        "get_analysis_monitor", RequestMethod.GET, path("/analysis/monitor/" + encode(taskId)))
                .rateLimitKey(RateLimitKey.STATUS)
                .build()));
    }

    /**
     * Follow the status of a task as server-sent events.
     *
     * <p>Reads the monitor event stream of the task. Lines that are not valid updates are
     * skipped. The stream completes after the first update that reports completion or an error.
     *
     * @param taskId the task id
     * @return the updates
     */
    public Multi<TaskStatusUpdate> streamAnalysisStatus(String taskId) {
        final var validation = validator.validateTaskId(taskId);
        return inFlight.trackStream(() -> {
            if (validation instanceof ValidationResult.Invalid invalid) {
                return Multi.createFrom().<TaskStatusUpdate>failure(validationFailure(invalid.reason()));
            }
            final var descriptor = RequestDescriptor.builder(
                            "stream_analysis_status",
                            RequestMethod.GET,
                            path("/analysis/monitor/" + encode(taskId) + "/stream"))
                    .rateLimitKey(RateLimitKey.STATUS)
                    .build();
            return executor.stream(descriptor)
                    .onItem()
                    .transformToIterable(this::untilTerminal)
                    .select()
                    .first(Optional::isPresent)
                    .map(Optional::get);
        });
    }

    /**
     * Poll the status of a task until it reaches a terminal state.
     *
     * @param taskId the task id
     * @return the terminal status, or a {@link io.smallrye.mutiny.TimeoutException} after 30 minutes
     */
    public Uni<TaskStatus> awaitCompletion(String taskId) {
        return awaitCompletion(taskId, DEFAULT_POLL_INTERVAL, DEFAULT_AWAIT_TIMEOUT);
    }

    /**
     * Poll the status of a task until it reaches a terminal state.
     *
     * @param taskId   the task id
     * @param interval delay between polls
     * @param timeout  how long to wait in total
     * @return the terminal status, or a {@link io.smallrye.mutiny.TimeoutException}
     */
    public Uni<TaskStatus> awaitCompletion(String taskId, Duration interval, Duration timeout) {
        var validation = validator.validateTaskId(taskId);
        if (validation.isValid() && (interval == null || interval.isNegative() || interval.isZero())) {
            validation = ValidationResult.invalid("poll interval must be positive");
        }
        if (validation.isValid() && (timeout == null || timeout.isNegative() || timeout.isZero())) {
            validation = ValidationResult.invalid("timeout must be positive");
        }
        return call(validation, () -> status(taskId)
                .repeat()
                .withDelay(interval)
                .whilst(status -> !status.isTerminal())
                .collect()
                .last()
                .ifNoItem()
                .after(timeout)
                .fail()
                .invoke(status -> LOG.debugv("Task {0} finished with status {1}", taskId, status.status())));
    }

    // Task actions

    public Uni<ApiResponse> addAnalysisTime(String taskId) {
        return action("add_analysis_time", RequestMethod.PATCH, "/analysis/addtime/", taskId);
    }

    public Uni<ApiResponse> stopAnalysis(String taskId) {
        return action("stop_analysis", RequestMethod.PATCH, "/analysis/stop/", taskId);
    }

    public Uni<ApiResponse> deleteAnalysis(String taskId) {
        return action("delete_analysis", RequestMethod.DELETE, "/analysis/delete/", taskId);
    }

    // Account and environment

    /**
     * Fetch the available sandbox environments. Cached.
     */
    public Uni<JsonNode> getEnvironment() {
        return call(ValidationResult.valid(), () -> data(RequestDescriptor.builder(
                        "get_environment", RequestMethod.GET, path("/environment"))
                .cacheable()
                .rateLimitKey(RateLimitKey.ENVIRONMENT)
                .build()));
    }

    public Uni<JsonNode> getUserInfo() {
        return getUserInfo(false);
    }

    /**
     * Fetch account limits and usage. Cached.
     *
     * @param team whether to report the team's figures instead of the user's
     */
    public Uni<JsonNode> getUserInfo(boolean team) {
        return call(ValidationResult.valid(), () -> data(RequestDescriptor.builder(
                        "get_user_info", RequestMethod.GET, path("/user"))
                .queryParam("team", team)
                .cacheable(team)
                .rateLimitKey(RateLimitKey.USER)
                .build()));
    }

    public Uni<JsonNode> getUserPresets() {
        return call(ValidationResult.valid(), () -> data(RequestDescriptor.builder(
                        "get_user_presets", RequestMethod.GET, path("/user/presets"))
                .cacheable()
                .rateLimitKey(RateLimitKey.USER)
                .build()));
    }

    /**
     * Download the report of a finished task. Cached.
     */
    public Uni<JsonNode> downloadReport(String taskId) {
        return call(validator.validateTaskId(taskId), () -> data(RequestDescriptor.builder(
                        "download_report", RequestMethod.GET, path("/analysis/" + encode(taskId) + "/report"))
                .cacheable(taskId)
                .rateLimitKey(RateLimitKey.DOWNLOAD)
                .build()));
    }

    public SandboxConfig config() {
        return config;
    }

    /**
     * Token buckets of this client, for inspecting or overriding limits at runtime.
     */
    public RateLimitService rateLimits() {
        return rateLimitService;
    }

    public ResponseCache cache() {
        return cache;
    }

    /**
     * Refuse new calls, wait up to {@code anyrun.shutdown-grace-period} for running calls, then
     * release connections. Blocks; do not call from an event loop thread.
     */
    @Override
    public void close() {
        if (inFlight.isClosed()) {
            return;
        }
        final var grace = config.shutdownGracePeriod();
        if (!inFlight.closeAndAwait(grace)) {
            LOG.warnv("Closing with {0} call(s) still running after {1}", inFlight.inFlight(), grace);
        }
        if (redisClients != null) {
            redisClients.close();
        }
        cache.close();
        transport.close();
        if (ownedVertx != null) {
            ownedVertx.closeAndAwait();
        }
        LOG.info("Sandbox client closed");
    }

    private Uni<ApiResponse> action(String operation, RequestMethod method, String pathPrefix, String taskId) {
        return call(validator.validateTaskId(taskId), () -> executor.execute(RequestDescriptor.builder(
                        operation, method, path(pathPrefix + encode(taskId)))
                .rateLimitKey(RateLimitKey.ANALYZE)
                .build()));
    }

    private Uni<TaskStatus> status(String taskId) {
        final var descriptor = RequestDescriptor.builder(
                        "get_analysis_status", RequestMethod.GET, path("/analysis/" + encode(taskId) + "/status"))
                .rateLimitKey(RateLimitKey.STATUS)
                .build();
        return executor.execute(descriptor).map(response -> convert(response, TaskStatus.class));
    }

    private Uni<JsonNode> data(RequestDescriptor descriptor) {
        return executor.execute(descriptor).map(ApiResponse::data);
    }

    private <T> Uni<T> call(ValidationResult validation, Supplier<Uni<T>> call) {
        return inFlight.track(() -> {
            if (validation instanceof ValidationResult.Invalid invalid) {
                return Uni.createFrom().<T>failure(validationFailure(invalid.reason()));
            }
            return call.get();
        });
    }

    // A terminal update is followed by an empty marker so the stream stops without waiting for another event.
    private List<Optional<TaskStatusUpdate>> untilTerminal(String payload) {
        final TaskStatusUpdate update;
        try {
            update = objectMapper.readValue(payload, TaskStatusUpdate.class);
        } catch (JsonProcessingException e) {
            LOG.warnv("Skipping unparseable status event: {0}", e.getOriginalMessage());
            return List.of();
        }
        return update.isTerminal() ? List.of(Optional.of(update), Optional.empty()) : List.of(Optional.of(update));
    }

    private <T> T convert(ApiResponse response, Class<T> type) {
        try {
            return objectMapper.treeToValue(response.data(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SandboxApiException(
                    ClassifiedError.malformed(200, "Unexpected " + type.getSimpleName() + " payload: " + e.getMessage()),
                    e);
        }
    }

    private String path(String relative) {
        return pathPrefix + relative;
    }

    private static SandboxApiException validationFailure(String reason) {
        return new SandboxApiException(ClassifiedError.validation(reason));
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Builder for {@link SandboxClient}.
     *
     * <p>Without an explicit {@link SandboxConfig}, configuration is loaded from system
     * properties, {@code ANYRUN_*} environment variables, the overrides given here and
     * {@code META-INF/microprofile-config.properties}.
     */
    public static class Builder {
        private final Map<String, String> overrides = new LinkedHashMap<>();
        private SandboxConfig config;
        private MeterRegistry meterRegistry;
        private Vertx vertx;
        private Transport transport;
        private TokenBucketRegistry registry;
        private Clock clock;
        private ObjectMapper objectMapper;

        private Builder() {}

        public Builder config(SandboxConfig config) {
            this.config = config;
            return this;
        }

        public Builder apiKey(String apiKey) {
            return property("anyrun.api-key", apiKey);
        }

        public Builder baseUrl(String baseUrl) {
            return property("anyrun.base-url", baseUrl);
        }

        /**
         * Set a configuration property, for example {@code anyrun.retry.max-attempts}.
         */
        public Builder property(String name, String value) {
            overrides.put(name, value);
            return this;
        }

        public Builder properties(Map<String, String> properties) {
            overrides.putAll(properties);
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /**
         * Use an existing Vert.x instance. It is not closed with the client.
         */
        public Builder vertx(Vertx vertx) {
            this.vertx = vertx;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Bucket registry of the in-memory limiter. Defaults to the process-wide registry.
         */
        public Builder tokenBucketRegistry(TokenBucketRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * @throws anyrun.config.SandboxConfigurationException if the configuration is invalid
         */
        public SandboxClient build() {
            final SandboxConfig resolved;
            if (config != null) {
                SandboxConfigLoader.validate(config);
                resolved = config;
            } else {
                resolved = SandboxConfigLoader.load(overrides);
            }
            return new SandboxClient(this, resolved);
        }
    }
}
