package com.heronix.trailcam.adapter.reveal;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.trailcam.config.TrailCamProperties;
import com.heronix.trailcam.exception.AuthException;
import com.heronix.trailcam.model.domain.Credential;
import com.heronix.trailcam.model.domain.Session;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Low-level client for the AWS Cognito user pool behind the Reveal web app.
 *
 * Cognito answers with {@code application/x-amz-json-1.1}, which the JSON
 * codecs do not accept, so bodies are read as text and parsed here.
 */
@Component
@Slf4j
public class CognitoIdentityClient {

    private static final String AMZ_JSON = "application/x-amz-json-1.1";
    private static final String INITIATE_AUTH = "AWSCognitoIdentityProviderService.InitiateAuth";
    private static final String AMPLIFY_AGENT = "aws-amplify/6.8.2 auth/4 framework/1";

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final TrailCamProperties properties;
    private final Clock clock;

    public CognitoIdentityClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                 TrailCamProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.client = webClientBuilder.clone()
                .baseUrl(properties.getIdentity().getUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, AMZ_JSON)
                .defaultHeader("X-Amz-Target", INITIATE_AUTH)
                .defaultHeader("X-Amz-User-Agent", AMPLIFY_AGENT)
                .defaultHeader(HttpHeaders.ORIGIN, properties.getApi().getOrigin())
                .defaultHeader(HttpHeaders.REFERER, properties.getApi().getOrigin() + "/")
                .build();
    }

    /**
     * USER_PASSWORD_AUTH login.
     */
    public Session initiatePasswordAuth(Credential credential) {
        Map<String, Object> request = Map.of(
                "AuthFlow", "USER_PASSWORD_AUTH",
                "AuthParameters", Map.of(
                        "USERNAME", credential.identifier(),
                        "PASSWORD", credential.secret()
                ),
                "ClientId", properties.getIdentity().getClientId()
        );

        JsonNode result = initiateAuth(request, "login");
        String refreshToken = text(result, "RefreshToken");
        log.info("Authenticated with Cognito as {}", credential.identifier());
        return toSession(result, refreshToken);
    }

    /**
     * REFRESH_TOKEN_AUTH renewal. Cognito does not rotate the refresh token,
     * so the existing one is kept unless a new one is returned.
     */
    public Session initiateRefreshAuth(Session session) {
        if (!session.hasRefreshToken()) {
            throw new AuthException(AuthException.Kind.INVALID_CREDENTIAL, "Session has no refresh token");
        }

        Map<String, Object> request = Map.of(
                "AuthFlow", "REFRESH_TOKEN_AUTH",
                "AuthParameters", Map.of("REFRESH_TOKEN", session.refreshToken()),
                "ClientId", properties.getIdentity().getClientId()
        );

        JsonNode result = initiateAuth(request, "refresh");
        String rotated = text(result, "RefreshToken");
        log.info("Refreshed Cognito tokens");
        return toSession(result, rotated != null ? rotated : session.refreshToken())
                .withAccountId(session.accountId());
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private JsonNode initiateAuth(Map<String, Object> request, String operation) {
        Duration timeout = Duration.ofSeconds(properties.getIdentity().getTimeoutSeconds());
        String body;

        try {
            body = client.post()
                    .bodyValue(serialize(request))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout, Mono.error(() -> new AuthException(
                            AuthException.Kind.PROVIDER_UNAVAILABLE, "Cognito " + operation + " timed out")))
                    .block();

        } catch (WebClientResponseException e) {
            throw translate(e, operation);
        } catch (WebClientRequestException e) {
            log.error("Cognito {} request failed: {}", operation, e.getMessage());
            throw new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE,
                    "Identity provider unreachable: " + e.getMessage(), e);
        }

        JsonNode root = parse(body, operation);
        JsonNode result = root.path("AuthenticationResult");
        if (result.isMissingNode() || text(result, "AccessToken") == null) {
            // A challenge (e.g. NEW_PASSWORD_REQUIRED) cannot be answered unattended
            String challenge = root.path("ChallengeName").asText("none");
            throw new AuthException(AuthException.Kind.INVALID_CREDENTIAL,
                    "Cognito " + operation + " returned no tokens (challenge: " + challenge + ")");
        }
        return result;
    }

    private Session toSession(JsonNode result, String refreshToken) {
        Instant issuedAt = clock.instant();
        long expiresIn = result.path("ExpiresIn").asLong(properties.getIdentity().getDefaultExpiresInSeconds());
        if (expiresIn <= 0) {
            expiresIn = properties.getIdentity().getDefaultExpiresInSeconds();
        }

        return new Session(
                text(result, "AccessToken"),
                text(result, "IdToken"),
                refreshToken,
                issuedAt,
                issuedAt.plusSeconds(expiresIn),
                null
        );
    }

    private AuthException translate(WebClientResponseException e, String operation) {
        String errorType = errorType(e.getResponseBodyAsString());
        log.error("Cognito {} failed: HTTP {} {}", operation, e.getStatusCode().value(), errorType);

        if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()
                || errorType.endsWith("TooManyRequestsException")
                || errorType.endsWith("LimitExceededException")) {
            return new AuthException(AuthException.Kind.THROTTLED, "Identity provider throttled " + operation, e);
        }
        if (e.getStatusCode().is5xxServerError()) {
            return new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE,
                    "Identity provider error " + e.getStatusCode().value(), e);
        }
        return new AuthException(AuthException.Kind.INVALID_CREDENTIAL,
                "Identity provider rejected " + operation + ": " + errorType, e);
    }

    /**
     * Cognito reports the error class in "__type", e.g. "NotAuthorizedException".
     */
    private String errorType(String body) {
        if (body == null || body.isBlank()) {
            return "unknown";
        }
        try {
            return objectMapper.readTree(body).path("__type").asText("unknown");
        } catch (JsonProcessingException e) {
            log.debug("Unparseable Cognito error body: {}", e.getOriginalMessage());
            return "unknown";
        }
    }

    private String serialize(Map<String, Object> request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Cognito request", e);
        }
    }

    private JsonNode parse(String body, String operation) {
        if (body == null || body.isBlank()) {
            throw new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE, "Empty response from Cognito " + operation);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE,
                    "Unreadable response from Cognito " + operation, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
