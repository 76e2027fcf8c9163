package anyrun.adapter.out.http;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.core.net.ProxyOptions;
import io.vertx.core.net.ProxyType;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.MultiMap;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.core.http.HttpClient;
import io.vertx.mutiny.core.http.HttpClientRequest;
import io.vertx.mutiny.core.http.HttpClientResponse;
import io.vertx.mutiny.core.parsetools.RecordParser;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import io.vertx.mutiny.ext.web.multipart.MultipartForm;
import org.jboss.logging.Logger;

import anyrun.config.SandboxConfig;
import anyrun.core.model.request.RawResponse;
import anyrun.core.model.request.RequestBody;
import anyrun.core.model.request.RequestDescriptor;
import anyrun.core.model.request.UnexpectedStatusException;
import anyrun.core.port.out.Transport;

/**
 * HTTP adapter for the sandbox API using Vert.x.
 *
 * <p>Regular calls go through a {@link WebClient}; event streams use the core
 * {@link HttpClient} so the body can be consumed as it arrives. Both are created on first use
 * and share TLS and proxy settings. Every request carries {@code Authorization: API-Key <key>}.
 */
public class VertxTransport implements Transport {

    private static final Logger LOG = Logger.getLogger(VertxTransport.class);

    static final String AUTHORIZATION = "Authorization";

    private static final String LF = "\n";

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final SandboxConfig config;
    private final String baseUrl;

    private volatile WebClient webClient;
    private volatile HttpClient streamClient;
    private volatile boolean closed;

    /**
     * @param vertx     the Vert.x instance
     * @param ownsVertx whether {@link #close()} also closes {@code vertx}
     * @param config    the client configuration
     */
    public VertxTransport(Vertx vertx, boolean ownsVertx, SandboxConfig config) {
        this.vertx = vertx;
        this.ownsVertx = ownsVertx;
        this.config = config;
        this.baseUrl = stripTrailingSlash(config.baseUrl());
    }

    @Override
    public Uni<RawResponse> send(RequestDescriptor request) {
        return Uni.createFrom().deferred(() -> {
            final var httpRequest = webClient()
                    .requestAbs(HttpMethod.valueOf(request.method().name()), baseUrl + request.path())
                    .timeout(config.timeout().toMillis());
            applyHeaders(httpRequest);
            request.queryParams().forEach(httpRequest::addQueryParam);
            LOG.debugv("{0} {1}", request.method(), request.path());
            return sendBody(httpRequest, request.body()).map(VertxTransport::toRawResponse);
        });
    }

    @Override
    public Multi<String> streamLines(RequestDescriptor request) {
        return Multi.createFrom().deferred(() -> {
            final var options = new RequestOptions()
                    .setMethod(HttpMethod.valueOf(request.method().name()))
                    .setAbsoluteURI(baseUrl + request.path() + queryString(request.queryParams()))
                    .setConnectTimeout(config.timeout().toMillis());
            headers().forEach(options::putHeader);
            options.putHeader("Accept", "text/event-stream");

            return streamClient()
                    .request(options)
                    .chain(HttpClientRequest::send)
                    .onItem()
                    .transformToMulti(this::linesOf);
        });
    }

    private Multi<String> linesOf(HttpClientResponse response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            return response.body().onItem().transformToMulti(body -> Multi.createFrom()
                    .failure(new UnexpectedStatusException(new RawResponse(
                            response.statusCode(), headersOf(response.headers()), body.toString()))));
        }
        return RecordParser.newDelimited(LF, response).toMulti().map(VertxTransport::toLine);
    }

    // Records end at LF; a CRLF terminator leaves a CR to drop.
    private static String toLine(Buffer record) {
        final var line = record.toString("UTF-8");
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private Uni<HttpResponse<Buffer>> sendBody(HttpRequest<Buffer> httpRequest, RequestBody body) {
        if (body instanceof RequestBody.Json json) {
            httpRequest.putHeader("Content-Type", "application/json");
            return httpRequest.sendBuffer(Buffer.buffer(json.json()));
        }
        if (body instanceof RequestBody.Form form) {
            final var fields = MultiMap.caseInsensitiveMultiMap();
            form.fields().forEach(fields::add);
            return httpRequest.sendForm(fields);
        }
        if (body instanceof RequestBody.Multipart multipart) {
            final var form = MultipartForm.create();
            multipart.fields().forEach(form::attribute);
            final var file = multipart.file();
            form.binaryFileUpload(file.fieldName(), file.filename(), Buffer.buffer(file.content()), file.mediaType());
            return httpRequest.sendMultipartForm(form);
        }
        return httpRequest.send();
    }

    private void applyHeaders(HttpRequest<Buffer> httpRequest) {
        headers().forEach(httpRequest::putHeader);
    }

    private Map<String, String> headers() {
        final var headers = new LinkedHashMap<String, String>(config.headers());
        headers.put(AUTHORIZATION, "API-Key " + config.apiKey());
        headers.putIfAbsent("Accept", "application/json");
        return headers;
    }

    private WebClient webClient() {
        var current = webClient;
        if (current == null) {
            synchronized (this) {
                ensureOpen();
                current = webClient;
                if (current == null) {
                    final var options = new WebClientOptions().setUserAgent(config.userAgent());
                    configure(options);
                    current = WebClient.create(vertx, options);
                    webClient = current;
                }
            }
        }
        return current;
    }

    private HttpClient streamClient() {
        var current = streamClient;
        if (current == null) {
            synchronized (this) {
                ensureOpen();
                current = streamClient;
                if (current == null) {
                    final var options = new HttpClientOptions();
                    configure(options);
                    current = vertx.createHttpClient(options);
                    streamClient = current;
                }
            }
        }
        return current;
    }

    private void configure(HttpClientOptions options) {
        final var verify = config.verifyTls();
        options.setTrustAll(!verify).setVerifyHost(verify);
        final var scheme = URI.create(baseUrl).getScheme().toLowerCase();
        final var proxy = config.proxies().get(scheme);
        if (proxy != null && !proxy.isBlank()) {
            options.setProxyOptions(proxyOptions(proxy));
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transport is closed");
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (webClient != null) {
            webClient.close();
            webClient = null;
        }
        if (streamClient != null) {
            streamClient.closeAndAwait();
            streamClient = null;
        }
        if (ownsVertx) {
            vertx.closeAndAwait();
        }
        LOG.debug("Transport closed");
    }

    static ProxyOptions proxyOptions(String proxyUrl) {
        final var uri = URI.create(proxyUrl);
        final var port = uri.getPort() != -1 ? uri.getPort() : ("https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80);
        final var options = new ProxyOptions().setType(ProxyType.HTTP).setHost(uri.getHost()).setPort(port);
        final var userInfo = uri.getUserInfo();
        if (userInfo != null) {
            final var separator = userInfo.indexOf(':');
            if (separator >= 0) {
                options.setUsername(userInfo.substring(0, separator)).setPassword(userInfo.substring(separator + 1));
            } else {
                options.setUsername(userInfo);
            }
        }
        return options;
    }

    private static RawResponse toRawResponse(HttpResponse<Buffer> response) {
        final var body = response.body() != null ? response.body().toString() : "";
        return new RawResponse(response.statusCode(), headersOf(response.headers()), body);
    }

    private static Map<String, List<String>> headersOf(MultiMap source) {
        final Map<String, List<String>> headers = new LinkedHashMap<>();
        for (var name : source.names()) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).addAll(source.getAll(name));
        }
        return headers;
    }

    private static String queryString(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        final var query = new StringBuilder("?");
        params.forEach((name, value) -> {
            if (query.length() > 1) {
                query.append('&');
            }
            query.append(encode(name)).append('=').append(encode(value));
        });
        return query.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
