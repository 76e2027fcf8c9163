package anyrun.core.service;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import anyrun.core.cache.ResponseCache;
import anyrun.core.model.analysis.ApiResponse;
import anyrun.core.model.error.ClassifiedError;
import anyrun.core.model.error.RetryExhaustedException;
import anyrun.core.model.error.SandboxApiException;
import anyrun.core.model.request.RequestDescriptor;
import anyrun.core.model.request.UnexpectedStatusException;
import anyrun.core.port.out.Metrics;
import anyrun.core.port.out.Transport;
import anyrun.core.service.common.ServerSentEvents;
import anyrun.core.service.ratelimit.RateLimitService;

/**
 * Runs every API call through cache, rate limiter, transport, classifier and retry policy.
 *
 * <p>Order of a call:
 * <ol>
 *   <li>cacheable requests are looked up first; a hit returns without a token or a network call</li>
 *   <li>one token is taken from the request's bucket, waiting if the bucket is empty</li>
 *   <li>the transport call runs under the retry policy, each attempt classified</li>
 *   <li>a successful cacheable response is stored before it is returned</li>
 * </ol>
 *
 * <p>Mutations are never read from or written to the cache.
 */
public class RequestExecutor {

    private static final Logger LOG = Logger.getLogger(RequestExecutor.class);

    private final Transport transport;
    private final ResponseCache cache;
    private final RateLimitService rateLimitService;
    private final RetryExecutor retryExecutor;
    private final ErrorClassifier classifier;
    private final ObjectMapper objectMapper;
    private final Metrics metrics;

    public RequestExecutor(
            Transport transport,
            ResponseCache cache,
            RateLimitService rateLimitService,
            RetryExecutor retryExecutor,
            ErrorClassifier classifier,
            ObjectMapper objectMapper,
            Metrics metrics) {
        this.transport = transport;
        this.cache = cache;
        this.rateLimitService = rateLimitService;
        this.retryExecutor = retryExecutor;
        this.classifier = classifier;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Execute a request.
     *
     * @param request the request
     * @return the envelope, or a failure with {@link SandboxApiException} or
     *     {@link RetryExhaustedException}
     */
    public Uni<ApiResponse> execute(RequestDescriptor request) {
        return Uni.createFrom().deferred(() -> {
            final var started = System.nanoTime();
            return lookup(request)
                    .chain(cached -> cached.isPresent()
                            ? Uni.createFrom().item(cached.get())
                            : fetch(request))
                    .onItemOrFailure()
                    .invoke((response, failure) -> metrics.recordRequest(
                            request.operation(), outcomeOf(failure), (System.nanoTime() - started) / 1_000_000L));
        });
    }

    /**
     * Open a server-sent event stream and emit the payload of each {@code data:} line.
     *
     * <p>One token is taken per connection attempt. Failures are classified like any other
     * response and reconnected with the same delays and attempt budget as {@link #execute}.
     * Streams are never cached.
     *
     * @param request the stream request
     * @return the data payloads
     */
    public Multi<String> stream(RequestDescriptor request) {
        return connect(request, 1)
                .onItem()
                .transformToIterable(line -> ServerSentEvents.dataOf(line).stream().toList());
    }

    private Multi<String> connect(RequestDescriptor request, int number) {
        return Multi.createFrom()
                .deferred(() -> rateLimitService
                        .acquire(request.rateLimitKey())
                        .onItem()
                        .transformToMulti(ignored -> transport.streamLines(request)))
                .onFailure()
                .transform(this::toApiException)
                .onFailure()
                .recoverWithMulti(failure -> retryExecutor
                        .backOff(request.operation(), failure, number)
                        .onItem()
                        .transformToMulti(ignored -> connect(request, number + 1)));
    }

    private Uni<Optional<ApiResponse>> lookup(RequestDescriptor request) {
        if (!request.cacheable() || !cache.isEnabled()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var key = request.cacheKey();
        return cache.get(key).map(cached -> {
            final var parsed = cached.flatMap(body -> parseCached(key, body));
            metrics.recordCacheLookup(request.operation(), parsed.isPresent());
            LOG.debugv("Cache {0} for {1}", parsed.isPresent() ? "hit" : "miss", key);
            return parsed;
        });
    }

    private Uni<ApiResponse> fetch(RequestDescriptor request) {
        return rateLimitService
                .acquire(request.rateLimitKey())
                .chain(() -> retryExecutor.execute(request.operation(), () -> attempt(request)))
                .call(success -> store(request, success))
                .map(ErrorClassifier.Outcome.Success::response);
    }

    private Uni<ErrorClassifier.Outcome.Success> attempt(RequestDescriptor request) {
        return Uni.createFrom()
                .deferred(() -> transport.send(request))
                .onFailure()
                .transform(this::toApiException)
                .map(response -> {
                    final var outcome = classifier.classify(response);
                    if (outcome instanceof ErrorClassifier.Outcome.Failure failure) {
                        throw new SandboxApiException(failure.error());
                    }
                    return (ErrorClassifier.Outcome.Success) outcome;
                });
    }

    private Uni<Void> store(RequestDescriptor request, ErrorClassifier.Outcome.Success success) {
        if (!request.cacheable() || !cache.isEnabled()) {
            return Uni.createFrom().voidItem();
        }
        return cache.set(request.cacheKey(), success.body());
    }

    private Optional<ApiResponse> parseCached(String key, String body) {
        if (body.isEmpty()) {
            return Optional.of(ApiResponse.empty());
        }
        try {
            return Optional.of(objectMapper.readValue(body, ApiResponse.class));
        } catch (JsonProcessingException e) {
            LOG.warnv("Ignoring unreadable cache entry {0}: {1}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Throwable toApiException(Throwable failure) {
        if (failure instanceof SandboxApiException || failure instanceof RetryExhaustedException) {
            return failure;
        }
        if (failure instanceof UnexpectedStatusException unexpected) {
            return new SandboxApiException(classifier.classifyFailure(unexpected.response()), unexpected);
        }
        final var message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        return new SandboxApiException(new ClassifiedError.Generic(0, "Transport failure: " + message), failure);
    }

    private static String outcomeOf(Throwable failure) {
        if (failure == null) {
            return "success";
        }
        if (failure instanceof RetryExhaustedException) {
            return "retry_exhausted";
        }
        if (failure instanceof SandboxApiException apiError) {
            return apiError.kind().name().toLowerCase(Locale.ROOT);
        }
        return "error";
    }
}
