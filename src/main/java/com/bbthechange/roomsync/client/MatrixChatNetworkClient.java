package com.bbthechange.roomsync.client;

import com.bbthechange.roomsync.config.MatrixProperties;
import com.bbthechange.roomsync.exception.ChatNetworkException;
import com.bbthechange.roomsync.exception.ChatNetworkException.ErrorType;
import com.bbthechange.roomsync.util.QueryPerformanceTracker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the Matrix client-server API, authenticated as an application service.
 * Per-tenant bot users are impersonated through the {@code user_id} query parameter.
 * Retries only on rate limiting (HTTP 429); every other failure is classified and thrown.
 */
@Component
public class MatrixChatNetworkClient implements ChatNetworkClient {

    private static final Logger logger = LoggerFactory.getLogger(MatrixChatNetworkClient.class);

    private static final String CLIENT_API = "/_matrix/client/v3";
    private static final String MEMBER_EVENT = "m.room.member";
    private static final String CANONICAL_ALIAS_EVENT = "m.room.canonical_alias";

    private static final String ERRCODE_NOT_FOUND = "M_NOT_FOUND";
    private static final String ERRCODE_FORBIDDEN = "M_FORBIDDEN";
    private static final String ERRCODE_ROOM_IN_USE = "M_ROOM_IN_USE";
    private static final String ERRCODE_LIMIT_EXCEEDED = "M_LIMIT_EXCEEDED";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final QueryPerformanceTracker performanceTracker;
    private final String baseUrl;
    private final String accessToken;
    private final Duration requestTimeout;
    private final int maxRetries;
    private final long retryBackoffMs;

    @Autowired
    public MatrixChatNetworkClient(@Qualifier("matrixHttpClient") HttpClient httpClient,
                                   ObjectMapper objectMapper,
                                   QueryPerformanceTracker performanceTracker,
                                   MatrixProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.performanceTracker = performanceTracker;
        this.baseUrl = stripTrailingSlash(properties.getHomeserverUrl());
        this.accessToken = properties.getAccessToken();
        this.requestTimeout = properties.getRequestTimeout();
        this.maxRetries = properties.getMaxRetries();
        this.retryBackoffMs = properties.getRetryBackoff().toMillis();
    }

    @Override
    public Optional<String> resolveAlias(String alias) {
        HttpRequest request = request(CLIENT_API + "/directory/room/" + encode(alias), null).GET().build();
        try {
            JsonNode body = execute("resolveAlias", request);
            return Optional.ofNullable(textOrNull(body, "room_id"));
        } catch (ChatNetworkException e) {
            if (e.getErrorType() == ErrorType.NOT_FOUND) {
                logger.debug("Alias {} is not mapped to any room", alias);
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public String createRoom(CreateRoomOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("room_alias_name", options.aliasLocalpart());
        body.put("name", options.name());
        body.put("preset", options.preset());
        body.put("visibility", "private");
        body.put("power_level_content_override",
            Map.of("users", Map.of(options.creatorUserId(), options.creatorPowerLevel())));

        HttpRequest request = request(CLIENT_API + "/createRoom", options.creatorUserId())
            .POST(jsonBody(body))
            .build();

        JsonNode response = execute("createRoom", request);
        String roomId = textOrNull(response, "room_id");
        if (roomId == null) {
            throw new ChatNetworkException(ErrorType.UNAVAILABLE, 200, null,
                "createRoom response did not contain a room_id");
        }
        logger.info("Created room {} with alias localpart {}", roomId, options.aliasLocalpart());
        return roomId;
    }

    @Override
    public void registerAlias(String alias, String roomId) {
        HttpRequest request = request(CLIENT_API + "/directory/room/" + encode(alias), null)
            .PUT(jsonBody(Map.of("room_id", roomId)))
            .build();
        execute("registerAlias", request);
    }

    @Override
    public void setCanonicalAlias(String roomId, String alias, List<String> altAliases, String actingUserId) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("alias", alias);
        content.put("alt_aliases", altAliases == null ? List.of() : altAliases);

        HttpRequest request = request(stateEventPath(roomId, CANONICAL_ALIAS_EVENT, ""), actingUserId)
            .PUT(jsonBody(content))
            .build();
        execute("setCanonicalAlias", request);
    }

    @Override
    public void invite(String roomId, String userId, String actingUserId) {
        HttpRequest request = request(CLIENT_API + "/rooms/" + encode(roomId) + "/invite", actingUserId)
            .POST(jsonBody(Map.of("user_id", userId)))
            .build();
        execute("invite", request);
    }

    @Override
    public void kick(String roomId, String userId, String reason, String actingUserId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", userId);
        if (reason != null) {
            body.put("reason", reason);
        }
        HttpRequest request = request(CLIENT_API + "/rooms/" + encode(roomId) + "/kick", actingUserId)
            .POST(jsonBody(body))
            .build();
        execute("kick", request);
    }

    @Override
    public RoomMembership getMembership(String roomId, String userId, String actingUserId) {
        HttpRequest request = request(stateEventPath(roomId, MEMBER_EVENT, userId), actingUserId).GET().build();
        try {
            JsonNode body = execute("getMembership", request);
            return RoomMembership.fromValue(textOrNull(body, "membership"));
        } catch (ChatNetworkException e) {
            if (e.getErrorType() == ErrorType.NOT_FOUND) {
                return RoomMembership.NONE;
            }
            throw e;
        }
    }

    @Override
    public RoomPowerLevels getPowerLevels(String roomId, String actingUserId) {
        HttpRequest request = request(stateEventPath(roomId, RoomPowerLevels.POWER_LEVELS_EVENT, ""), actingUserId)
            .GET()
            .build();
        JsonNode body = execute("getPowerLevels", request);
        Map<String, Object> content = objectMapper.convertValue(body, new TypeReference<Map<String, Object>>() {});
        return new RoomPowerLevels(content);
    }

    @Override
    public void setUserPowerLevels(String roomId, Map<String, Integer> userLevels, String actingUserId) {
        RoomPowerLevels current = getPowerLevels(roomId, actingUserId);
        HttpRequest request = request(stateEventPath(roomId, RoomPowerLevels.POWER_LEVELS_EVENT, ""), actingUserId)
            .PUT(jsonBody(current.withUserLevels(userLevels)))
            .build();
        execute("setUserPowerLevels", request);
        logger.info("Updated power levels in room {} for users {}", roomId, userLevels.keySet());
    }

    @Override
    public void ping() {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/_matrix/client/versions"))
            .timeout(requestTimeout)
            .GET()
            .build();
        execute("ping", request);
    }

    /**
     * Send a request, retrying on rate limiting, and return the parsed JSON body.
     */
    private JsonNode execute(String operation, HttpRequest request) {
        return performanceTracker.trackNetworkCall(operation, () -> executeWithRetry(operation, request));
    }

    private JsonNode executeWithRetry(String operation, HttpRequest request) {
        int attempt = 0;
        while (true) {
            try {
                return executeOnce(operation, request);
            } catch (RateLimitException e) {
                attempt++;
                if (attempt > maxRetries) {
                    throw new ChatNetworkException(ErrorType.RATE_LIMITED, 429, ERRCODE_LIMIT_EXCEEDED,
                        operation + " rate limited after " + maxRetries + " retries");
                }
                long delayMs = e.retryAfterMs > 0 ? e.retryAfterMs : retryBackoffMs * (1L << (attempt - 1));
                logger.warn("Rate limited by homeserver during {} (attempt {}/{}). Retrying in {}ms",
                    operation, attempt, maxRetries, delayMs);
                sleep(delayMs);
            }
        }
    }

    private JsonNode executeOnce(String operation, HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw ChatNetworkException.timeout(operation, e);
        } catch (IOException e) {
            throw ChatNetworkException.unavailable(operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ChatNetworkException.unavailable(operation, e);
        }

        int statusCode = response.statusCode();
        JsonNode body = parse(response.body());
        logger.debug("Homeserver responded {} to {}", statusCode, operation);

        if (statusCode >= 200 && statusCode < 300) {
            return body;
        }

        String errcode = textOrNull(body, "errcode");
        if (statusCode == 429 || ERRCODE_LIMIT_EXCEEDED.equals(errcode)) {
            throw new RateLimitException(body.path("retry_after_ms").asLong(0));
        }
        throw classify(operation, statusCode, errcode, body.path("error").asText(""));
    }

    /**
     * Map a homeserver error response to an error type. Membership conflicts are reported by
     * Synapse as M_FORBIDDEN with a descriptive message, so those are told apart by text.
     */
    static ChatNetworkException classify(String operation, int statusCode, String errcode, String error) {
        String message = operation + " failed with HTTP " + statusCode
            + (errcode != null ? " " + errcode : "") + (error.isEmpty() ? "" : ": " + error);
        String lowerError = error.toLowerCase(Locale.ROOT);

        ErrorType type;
        if (ERRCODE_ROOM_IN_USE.equals(errcode) || (statusCode == 409 && "registerAlias".equals(operation))) {
            type = ErrorType.ROOM_IN_USE;
        } else if (lowerError.contains("already in the room") || lowerError.contains("already joined")
            || lowerError.contains("already invited")) {
            type = ErrorType.ALREADY_MEMBER;
        } else if (lowerError.contains("not in the room") || lowerError.contains("not a member")) {
            type = ErrorType.NOT_MEMBER;
        } else if (statusCode == 404 || ERRCODE_NOT_FOUND.equals(errcode)) {
            type = ErrorType.NOT_FOUND;
        } else if (statusCode == 401 || statusCode == 403 || ERRCODE_FORBIDDEN.equals(errcode)) {
            type = ErrorType.FORBIDDEN;
        } else if (statusCode >= 500) {
            type = ErrorType.UNAVAILABLE;
        } else {
            type = ErrorType.BAD_REQUEST;
        }
        return new ChatNetworkException(type, statusCode, errcode, message);
    }

    private HttpRequest.Builder request(String path, String actingUserId) {
        String uri = baseUrl + path;
        if (actingUserId != null) {
            uri += "?user_id=" + encode(actingUserId);
        }
        return HttpRequest.newBuilder()
            .uri(URI.create(uri))
            .header("Authorization", "Bearer " + accessToken)
            .header("Content-Type", "application/json")
            .timeout(requestTimeout);
    }

    private String stateEventPath(String roomId, String eventType, String stateKey) {
        return CLIENT_API + "/rooms/" + encode(roomId) + "/state/" + eventType + "/" + encode(stateKey);
    }

    private HttpRequest.BodyPublisher jsonBody(Object body) {
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize request body", e);
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.debug("Homeserver returned a non-JSON body: {}", e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() ? value.asText() : null;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Sleep between rate-limit retries.
     * Package-private for testing.
     */
    void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ChatNetworkException.unavailable("retry wait", e);
        }
    }

    /**
     * Internal signal for rate limiting that triggers a retry.
     */
    private static class RateLimitException extends RuntimeException {
        private final long retryAfterMs;

        RateLimitException(long retryAfterMs) {
            super("Rate limited by homeserver");
            this.retryAfterMs = retryAfterMs;
        }
    }
}
