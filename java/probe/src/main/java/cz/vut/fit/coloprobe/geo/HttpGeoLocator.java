package cz.vut.fit.coloprobe.geo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.coloprobe.Common;
import cz.vut.fit.coloprobe.ProbeConfig;
import cz.vut.fit.coloprobe.models.GeoLocation;
import cz.vut.fit.coloprobe.models.ResultCodes;
import cz.vut.fit.coloprobe.models.results.LookupResult;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Queries a JSON geolocation web service with a GET request to {@code <base URL><ip>}. The response is expected
 * to be an object with optional {@code country}, {@code region} and {@code city} string fields.
 */
public class HttpGeoLocator implements GeoLocator {
    public static final String COMPONENT_NAME = "geo";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(HttpGeoLocator.class);

    private final String _baseUrl;
    private final Duration _timeout;
    private final ObjectMapper _mapper;
    private final HttpClient _client;

    public HttpGeoLocator(@NotNull String baseUrl, @NotNull Duration timeout, @NotNull ObjectMapper mapper) {
        _baseUrl = baseUrl;
        _timeout = timeout;
        _mapper = mapper;

        // Create an HTTP client
        _client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(_timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public HttpGeoLocator(@NotNull Properties properties, @NotNull ObjectMapper mapper) {
        this(properties.getProperty(ProbeConfig.GEO_URL_CONFIG, ProbeConfig.GEO_URL_DEFAULT).trim(),
                Duration.ofMillis(Common.getInt(properties, ProbeConfig.GEO_TIMEOUT_MS_CONFIG,
                        ProbeConfig.GEO_TIMEOUT_MS_DEFAULT)),
                mapper);
    }

    @Override
    public @NotNull LookupResult<GeoLocation> lookup(@NotNull String ip) {
        final HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(_baseUrl + ip))
                    .timeout(_timeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            Logger.debug("[{}] Cannot make the request URL: {}", ip, e.getMessage());
            return LookupResult.error(ResultCodes.UNSUPPORTED_ADDRESS, e.getMessage());
        }

        final HttpResponse<String> response;
        try {
            // The connect timeout and the request timeout apply separately
            response = _client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                    .orTimeout(2 * _timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            var cause = e.getCause();
            if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
                Logger.debug("[{}] Geolocation request timed out", ip);
                return LookupResult.error(ResultCodes.TIMEOUT,
                        "Request timed out (%d ms)".formatted(_timeout.toMillis()));
            } else if (cause instanceof IOException) {
                Logger.debug("[{}] Geolocation I/O error: {}", ip, cause.getMessage());
                return LookupResult.error(ResultCodes.CANNOT_FETCH, cause.getMessage());
            } else {
                Logger.warn("[{}] Unexpected geolocation error", ip, e);
                return LookupResult.error(ResultCodes.INTERNAL_ERROR,
                        cause == null ? e.getMessage() : cause.getMessage());
            }
        }

        if (response.statusCode() == 429) {
            Logger.debug("[{}] Geolocation service is rate limited", ip);
            return LookupResult.error(ResultCodes.RATE_LIMITED, "Geolocation service is rate limited");
        } else if (response.statusCode() != 200) {
            Logger.debug("[{}] Geolocation response {}", ip, response.statusCode());
            return LookupResult.error(ResultCodes.CANNOT_FETCH, "Geolocation response " + response.statusCode());
        }

        try {
            final var root = _mapper.readTree(response.body());
            if (root == null || !root.isObject()) {
                return LookupResult.error(ResultCodes.INVALID_FORMAT, "The response is not a JSON object");
            }

            var location = new GeoLocation(textOrUnknown(root, "country"), textOrUnknown(root, "region"),
                    textOrUnknown(root, "city"));
            Logger.trace("[{}] Located at {}", ip, location);
            return LookupResult.of(location);
        } catch (JsonProcessingException e) {
            Logger.debug("[{}] Invalid geolocation response: {}", ip, e.getOriginalMessage());
            return LookupResult.error(ResultCodes.INVALID_FORMAT, e.getOriginalMessage());
        }
    }

    private static String textOrUnknown(JsonNode root, String field) {
        var node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : GeoLocation.UNKNOWN;
    }

    public String getBaseUrl() {
        return _baseUrl;
    }
}
