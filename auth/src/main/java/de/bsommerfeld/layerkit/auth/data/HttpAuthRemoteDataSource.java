package de.bsommerfeld.layerkit.auth.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.layerkit.core.config.ApiConfig;
import de.bsommerfeld.layerkit.core.config.GlobalConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link AuthRemoteDataSource} talking JSON over HTTP to the configured auth
 * API.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code POST {base}/auth/login}, body {@code {"email","password"}},
 * answers {@code {"id","email","access_token"}}</li>
 * <li>{@code POST {base}/auth/logout}, {@code ?all=true} to end every
 * session</li>
 * <li>{@code GET {base}/auth/me}</li>
 * </ul>
 * The last two carry {@code Authorization: Bearer <token>}.
 *
 * <h3>Errors</h3>
 * Any status outside 2xx becomes a {@link ServerException}. Its message is
 * the {@code message} field of a JSON error body, or a generic text naming
 * the status. Connect and request timeouts come from {@code [api]} and
 * surface as {@link java.net.http.HttpTimeoutException}.
 */
@Singleton
public class HttpAuthRemoteDataSource implements AuthRemoteDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(HttpAuthRemoteDataSource.class);

    private static final String JSON = "application/json";

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    /** Jackson's mapper is thread-safe once configured; one instance serves every call. */
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public HttpAuthRemoteDataSource(GlobalConfig config) {
        this(config.getApi(), HttpClient.newBuilder()
                .connectTimeout(config.getApi().getConnectTimeout())
                .build());
    }

    HttpAuthRemoteDataSource(ApiConfig api, HttpClient httpClient) {
        this.baseUrl = stripTrailingSlash(api.getBaseUrl());
        this.requestTimeout = api.getRequestTimeout();
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<UserModel> login(LoginRequest request) {
        HttpRequest httpRequest = newRequest("/auth/login")
                .header("Content-Type", JSON)
                .POST(HttpRequest.BodyPublishers.ofString(toJson(request)))
                .build();
        return send(httpRequest).thenApply(body -> parse(body, UserModel.class));
    }

    @Override
    public CompletableFuture<Void> logout(String accessToken, boolean allDevices) {
        HttpRequest httpRequest = newRequest(allDevices ? "/auth/logout?all=true" : "/auth/logout")
                .header("Authorization", "Bearer " + accessToken)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return send(httpRequest).thenApply(body -> null);
    }

    @Override
    public CompletableFuture<UserModel> currentUser(String accessToken) {
        HttpRequest httpRequest = newRequest("/auth/me")
                .header("Authorization", "Bearer " + accessToken)
                .GET()
                .build();
        return send(httpRequest).thenApply(body -> parse(body, UserModel.class));
    }

    private HttpRequest.Builder newRequest(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", JSON);
    }

    private CompletableFuture<String> send(HttpRequest request) {
        LOG.debug("{} {}", request.method(), request.uri());
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    int status = response.statusCode();
                    if (status < 200 || status >= 300) {
                        String message = errorMessage(status, response.body());
                        LOG.warn("{} {} answered {}: {}", request.method(), request.uri().getPath(), status, message);
                        throw new ServerException(status, message);
                    }
                    return response.body();
                });
    }

    private String errorMessage(int status, String body) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode message = mapper.readTree(body).path("message");
                if (message.isTextual() && !message.asText().isBlank()) {
                    return message.asText();
                }
            } catch (JsonProcessingException e) {
                LOG.debug("Error body of HTTP {} is not JSON: {}", status, e.getOriginalMessage());
            }
        }
        return "Server responded with HTTP " + status;
    }

    private <T> T parse(String body, Class<T> type) {
        try {
            return mapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Malformed response: " + e.getOriginalMessage(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
