package org.Aayush.allocator.external;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.error.ExternalServiceException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * Blocking GET-and-parse transport shared by the remote service clients.
 *
 * <p>Failures are classified once here: timeouts, connection errors, HTTP 429 and 5xx
 * are transient; auth rejections, other HTTP errors and unparseable bodies are
 * permanent.</p>
 */
@Slf4j
public final class HttpJsonTransport {
    public static final String REASON_TIMEOUT = "EXT_TIMEOUT";
    public static final String REASON_CONNECTION = "EXT_CONNECTION_FAILED";
    public static final String REASON_RATE_LIMITED = "EXT_RATE_LIMITED";
    public static final String REASON_SERVER_ERROR = "EXT_SERVER_ERROR";
    public static final String REASON_AUTH_REJECTED = "EXT_AUTH_REJECTED";
    public static final String REASON_HTTP_STATUS = "EXT_HTTP_STATUS";
    public static final String REASON_MALFORMED_RESPONSE = "EXT_MALFORMED_RESPONSE";

    private static final int MAX_BODY_EXCERPT = 256;

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpJsonTransport(Duration requestTimeout) {
        // HTTP/1.1 keeps self-hosted OSRM instances from rejecting h2c upgrade attempts.
        this(
                HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(requestTimeout)
                        .build(),
                requestTimeout
        );
    }

    public HttpJsonTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    /**
     * Issues one GET and parses the body as a JSON object.
     *
     * @param service service name used as the error subject.
     * @param uri fully built request uri.
     * @throws ExternalServiceException classified transient or permanent failure.
     */
    public JsonObject get(String service, URI uri) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        log.debug("{}: GET {}{}", service, uri.getHost(), uri.getPath());

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException ex) {
            throw new ExternalServiceException(REASON_TIMEOUT, service, "request timed out after " + requestTimeout, true, ex);
        } catch (IOException ex) {
            throw new ExternalServiceException(REASON_CONNECTION, service, "request failed: " + ex, true, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(ExternalCallExecutor.REASON_INTERRUPTED, service, "request interrupted", false, ex);
        }

        int status = response.statusCode();
        String body = response.body() == null ? "" : response.body();
        if (status == 429) {
            throw new ExternalServiceException(REASON_RATE_LIMITED, service, "rate limited (HTTP 429)", true);
        }
        if (status >= 500) {
            throw new ExternalServiceException(
                    REASON_SERVER_ERROR,
                    service,
                    "server error HTTP " + status + ": " + excerpt(body),
                    true
            );
        }
        if (status == 401 || status == 403) {
            throw new ExternalServiceException(
                    REASON_AUTH_REJECTED,
                    service,
                    "credentials rejected HTTP " + status + ": " + excerpt(body),
                    false
            );
        }
        if (status != 200) {
            throw new ExternalServiceException(
                    REASON_HTTP_STATUS,
                    service,
                    "unexpected HTTP " + status + ": " + excerpt(body),
                    false
            );
        }
        return parseObject(service, body);
    }

    private static JsonObject parseObject(String service, String body) {
        try {
            JsonElement element = JsonParser.parseString(body);
            if (element == null || !element.isJsonObject()) {
                throw new ExternalServiceException(
                        REASON_MALFORMED_RESPONSE,
                        service,
                        "response is not a JSON object: " + excerpt(body),
                        false
                );
            }
            return element.getAsJsonObject();
        } catch (JsonParseException ex) {
            throw new ExternalServiceException(
                    REASON_MALFORMED_RESPONSE,
                    service,
                    "response is not valid JSON: " + excerpt(body),
                    false,
                    ex
            );
        }
    }

    private static String excerpt(String body) {
        if (body.length() <= MAX_BODY_EXCERPT) {
            return body;
        }
        return body.substring(0, MAX_BODY_EXCERPT) + "...";
    }
}
