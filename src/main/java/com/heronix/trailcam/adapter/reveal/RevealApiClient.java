package com.heronix.trailcam.adapter.reveal;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.heronix.trailcam.config.TrailCamProperties;
import com.heronix.trailcam.exception.ApiException;
import com.heronix.trailcam.model.domain.Session;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Low-level client for the Reveal camera REST API.
 *
 * Every payload is wrapped as {@code {"response": {...}}}.
 */
@Component
@Slf4j
public class RevealApiClient {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private static final String BROWSER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";

    private final WebClient client;
    private final TrailCamProperties properties;

    public RevealApiClient(WebClient.Builder webClientBuilder, TrailCamProperties properties) {
        this.properties = properties;
        TrailCamProperties.ApiConfig api = properties.getApi();
        this.client = webClientBuilder.clone()
                .baseUrl(api.getBaseUrl() + "/" + api.getVersion())
                .defaultHeader("reveal-user-agent", api.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ORIGIN, api.getOrigin())
                .defaultHeader(HttpHeaders.REFERER, api.getOrigin() + "/")
                .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_AGENT)
                .build();
    }

    /**
     * Get the account record of the logged-in user.
     */
    public Map<String, Object> getAccount(Session session) {
        Map<String, Object> response = get(session, "/account", Map.of(), "account");
        Object account = response.get("account");
        return account instanceof Map<?, ?> ? castObject(account, "account") : response;
    }

    /**
     * List all cameras of the account.
     */
    public List<Map<String, Object>> getCameras(Session session) {
        Map<String, Object> response = get(session, "/cameras", Map.of(), "cameras");
        List<Map<String, Object>> cameras = castList(response.get("cameras"), "cameras");
        log.info("Found {} cameras", cameras.size());
        return cameras;
    }

    /**
     * Get the most recent photos of one camera, newest first, including weather data.
     */
    public List<Map<String, Object>> getPhotos(Session session, String cameraId, int size) {
        Map<String, Object> params = Map.of(
                "size", size,
                "page", 0,
                "includeWeatherData", "true",
                "cameraId", cameraId
        );
        Map<String, Object> response = get(session, "/photos", params, "photos of " + cameraId);
        List<Map<String, Object>> photos = castList(response.get("photos"), "photos");
        log.debug("Retrieved {} photos for camera {}", photos.size(), cameraId);
        return photos;
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private Map<String, Object> get(Session session, String path, Map<String, Object> params, String what) {
        Duration timeout = Duration.ofSeconds(properties.getApi().getTimeoutSeconds());
        Map<String, Object> body;

        try {
            body = client.get()
                    .uri(builder -> {
                        builder.path(path);
                        params.forEach((name, value) -> builder.queryParam(name, value));
                        return builder.build();
                    })
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + session.accessToken())
                    .retrieve()
                    .bodyToMono(JSON_OBJECT)
                    .timeout(timeout, Mono.error(() -> new ApiException(
                            ApiException.Kind.UNAVAILABLE, "Timed out fetching " + what)))
                    .block();

        } catch (WebClientResponseException e) {
            throw translate(e, what);
        } catch (WebClientRequestException e) {
            log.error("Request for {} failed: {}", what, e.getMessage());
            throw new ApiException(ApiException.Kind.UNAVAILABLE, "Camera API unreachable: " + e.getMessage(), e);
        } catch (DecodingException e) {
            throw new ApiException(ApiException.Kind.MALFORMED, "Unreadable " + what + " response", e);
        }

        if (body == null || !(body.get("response") instanceof Map<?, ?>)) {
            throw new ApiException(ApiException.Kind.MALFORMED, "Missing response envelope for " + what);
        }
        return castObject(body.get("response"), what);
    }

    private ApiException translate(WebClientResponseException e, String what) {
        int status = e.getStatusCode().value();
        log.error("Failed to get {}: HTTP {}", what, status);
        log.debug("Response: {}", abbreviate(e.getResponseBodyAsString()));

        if (status == 401 || status == 403) {
            return new ApiException(ApiException.Kind.UNAUTHORIZED, "Unauthorized fetching " + what, e);
        }
        if (status == 404) {
            return new ApiException(ApiException.Kind.NOT_FOUND, "Not found: " + what, e);
        }
        if (status == 429 || e.getStatusCode().is5xxServerError()) {
            return new ApiException(ApiException.Kind.UNAVAILABLE, "Camera API error " + status + " for " + what, e);
        }
        return new ApiException(ApiException.Kind.MALFORMED, "Camera API rejected request for " + what
                + " with " + status, e);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castObject(Object value, String what) {
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw new ApiException(ApiException.Kind.MALFORMED, "Expected object for " + what);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> castList(Object value, String what) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ApiException(ApiException.Kind.MALFORMED, "Expected array for " + what);
        }
        for (Object item : list) {
            if (!(item instanceof Map<?, ?>)) {
                throw new ApiException(ApiException.Kind.MALFORMED, "Unexpected element in " + what);
            }
        }
        return (List<Map<String, Object>>) value;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 500 ? text.substring(0, 500) : text;
    }
}
