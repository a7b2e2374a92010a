package de.bsommerfeld.tachobridge.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.google.inject.Singleton;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * JSON request primitive shared by {@link HubClient} and {@link FleetClient},
 * built on {@link HttpClient} and Jackson.
 *
 * <p>
 * A 2xx response yields its parsed body ({@link MissingNode} when empty or
 * not JSON). Every other status raises {@link ApiStatusException}; transport
 * failures raise a plain {@link IOException}. No status is interpreted here.
 */
@Singleton
public class JsonHttpClient {

    private static final Logger LOG = LoggerFactory.getLogger(JsonHttpClient.class);

    private static final String USER_AGENT = "TachoBridge/" + ApplicationVersion.get()
            + " (" + System.getProperty("os.name", "unknown") + ")";

    private final HttpClient httpClient;

    /**
     * Shared mapper. {@link ObjectMapper} is thread-safe once configured, so
     * one instance serves every request.
     */
    private final ObjectMapper mapper;

    @Inject
    public JsonHttpClient() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10))
                .build(), new ObjectMapper());
    }

    public JsonHttpClient(HttpClient httpClient, ObjectMapper mapper) {
        this.httpClient = httpClient;
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Sends one request.
     *
     * @param method      HTTP method
     * @param uri         absolute target
     * @param bearerToken sent as {@code Authorization: Bearer ...} when not {@code null}
     * @param body        JSON body, or {@code null} for none
     * @param timeout     request timeout
     * @return the parsed response body of a 2xx response
     * @throws ApiStatusException for any non-2xx status
     * @throws IOException        on transport failure or interruption
     */
    public JsonNode send(String method, URI uri, String bearerToken, JsonNode body, Duration timeout)
            throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT);
        if (bearerToken != null) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        if (body != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body),
                            StandardCharsets.UTF_8));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Request interrupted: " + method + " " + uri.getPath(), e);
        }

        int status = response.statusCode();
        JsonNode parsed = parse(response.body(), uri);
        LOG.debug("{} {} -> {}", method, uri.getPath(), status);
        if (status < 200 || status >= 300) {
            throw new ApiStatusException(status, uri, parsed);
        }
        return parsed;
    }

    /**
     * Joins a configured base URL and an endpoint path. Trailing slashes on
     * the base are ignored.
     */
    public static URI resolve(String baseUrl, String path) {
        String base = baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + (path.startsWith("/") ? path : "/" + path));
    }

    private JsonNode parse(String raw, URI uri) {
        if (raw == null || raw.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            LOG.warn("Could not parse JSON response of {}", uri.getPath(), e);
            return MissingNode.getInstance();
        }
    }
}
