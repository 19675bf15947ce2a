package com.bbthechange.roomsync.client;

import com.bbthechange.roomsync.config.MatrixProperties;
import com.bbthechange.roomsync.exception.ChatNetworkException;
import com.bbthechange.roomsync.exception.ChatNetworkException.ErrorType;
import com.bbthechange.roomsync.util.QueryPerformanceTracker;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MatrixChatNetworkClientTest {

    private static final String ROOM_ID = "!abc:matrix.example.org";
    private static final String BOT = "@bot-t1:matrix.example.org";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    @Mock
    private HttpResponse<String> rateLimitResponse;

    private MatrixChatNetworkClient client;

    @BeforeEach
    void setUp() {
        MatrixProperties properties = new MatrixProperties();
        properties.setHomeserverUrl("http://hs.test/");
        properties.setServerName("matrix.example.org");
        properties.setAccessToken("as-token");
        properties.setRequestTimeout(Duration.ofSeconds(2));
        properties.setMaxRetries(3);
        properties.setRetryBackoff(Duration.ofMillis(500));

        client = new MatrixChatNetworkClient(httpClient, new ObjectMapper(),
            new QueryPerformanceTracker(new SimpleMeterRegistry()), properties);
    }

    private void respond(int status, String body) throws Exception {
        when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString())))
            .thenReturn(httpResponse);
        when(httpResponse.statusCode()).thenReturn(status);
        when(httpResponse.body()).thenReturn(body);
    }

    private HttpRequest capturedRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), eq(HttpResponse.BodyHandlers.ofString()));
        return captor.getValue();
    }

    @Nested
    @DisplayName("resolveAlias")
    class ResolveAliasTests {

        @Test
        @DisplayName("should return the room id the alias maps to")
        void resolveAlias_Mapped_ReturnsRoomId() throws Exception {
            // Given
            respond(200, "{\"room_id\": \"" + ROOM_ID + "\", \"servers\": [\"matrix.example.org\"]}");

            // When
            Optional<String> roomId = client.resolveAlias("#event-foo-t1:matrix.example.org");

            // Then
            assertThat(roomId).contains(ROOM_ID);
            HttpRequest request = capturedRequest();
            assertThat(request.method()).isEqualTo("GET");
            assertThat(request.uri().toString())
                .isEqualTo("http://hs.test/_matrix/client/v3/directory/room/%23event-foo-t1%3Amatrix.example.org");
            assertThat(request.headers().firstValue("Authorization")).contains("Bearer as-token");
        }

        @Test
        @DisplayName("should return empty when the alias is unknown")
        void resolveAlias_NotFound_ReturnsEmpty() throws Exception {
            respond(404, "{\"errcode\": \"M_NOT_FOUND\", \"error\": \"Room alias not found\"}");

            assertThat(client.resolveAlias("#event-foo-t1:matrix.example.org")).isEmpty();
        }

        @Test
        @DisplayName("should classify a server error as unavailable")
        void resolveAlias_ServerError_ThrowsUnavailable() throws Exception {
            respond(502, "<html>Bad gateway</html>");

            assertThatThrownBy(() -> client.resolveAlias("#event-foo-t1:matrix.example.org"))
                .isInstanceOf(ChatNetworkException.class)
                .satisfies(e -> {
                    ChatNetworkException ex = (ChatNetworkException) e;
                    assertThat(ex.getErrorType()).isEqualTo(ErrorType.UNAVAILABLE);
                    assertThat(ex.getStatusCode()).isEqualTo(502);
                    assertThat(ex.isTransient()).isTrue();
                });
        }
    }

    @Nested
    @DisplayName("createRoom")
    class CreateRoomTests {

        private final CreateRoomOptions options =
            new CreateRoomOptions("event-foo-t1", "event foo", "private_chat", BOT, 100);

        @Test
        void createRoom_Success_ImpersonatesCreator() throws Exception {
            respond(200, "{\"room_id\": \"" + ROOM_ID + "\"}");

            String roomId = client.createRoom(options);

            assertThat(roomId).isEqualTo(ROOM_ID);
            HttpRequest request = capturedRequest();
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.uri().toString())
                .isEqualTo("http://hs.test/_matrix/client/v3/createRoom?user_id=%40bot-t1%3Amatrix.example.org");
        }

        @Test
        void createRoom_AliasTaken_ThrowsRoomInUse() throws Exception {
            respond(400, "{\"errcode\": \"M_ROOM_IN_USE\", \"error\": \"Room alias already taken\"}");

            assertThatThrownBy(() -> client.createRoom(options))
                .isInstanceOf(ChatNetworkException.class)
                .extracting(e -> ((ChatNetworkException) e).getErrorType())
                .isEqualTo(ErrorType.ROOM_IN_USE);
        }

        @Test
        void createRoom_MissingRoomId_ThrowsUnavailable() throws Exception {
            respond(200, "{}");

            assertThatThrownBy(() -> client.createRoom(options))
                .isInstanceOf(ChatNetworkException.class)
                .hasMessageContaining("room_id");
        }
    }

    @Nested
    @DisplayName("membership calls")
    class MembershipTests {

        @Test
        void invite_AlreadyInRoom_ThrowsAlreadyMember() throws Exception {
            respond(403, "{\"errcode\": \"M_FORBIDDEN\", \"error\": \"@alice-t1:matrix.example.org is already in the room.\"}");

            assertThatThrownBy(() -> client.invite(ROOM_ID, "@alice-t1:matrix.example.org", BOT))
                .isInstanceOf(ChatNetworkException.class)
                .extracting(e -> ((ChatNetworkException) e).getErrorType())
                .isEqualTo(ErrorType.ALREADY_MEMBER);
        }

        @Test
        void invite_InsufficientPower_ThrowsForbidden() throws Exception {
            respond(403, "{\"errcode\": \"M_FORBIDDEN\", \"error\": \"You don't have permission to invite users\"}");

            assertThatThrownBy(() -> client.invite(ROOM_ID, "@alice-t1:matrix.example.org", BOT))
                .isInstanceOf(ChatNetworkException.class)
                .extracting(e -> ((ChatNetworkException) e).getErrorType())
                .isEqualTo(ErrorType.FORBIDDEN);
        }

        @Test
        void invite_EncodesRoomIdAndActingUser() throws Exception {
            respond(200, "{}");

            client.invite(ROOM_ID, "@alice-t1:matrix.example.org", BOT);

            assertThat(capturedRequest().uri().toString()).isEqualTo(
                "http://hs.test/_matrix/client/v3/rooms/%21abc%3Amatrix.example.org/invite?user_id=%40bot-t1%3Amatrix.example.org");
        }

        @Test
        void kick_TargetNotInRoom_ThrowsNotMember() throws Exception {
            respond(403, "{\"errcode\": \"M_FORBIDDEN\", \"error\": \"The target user is not in the room\"}");

            assertThatThrownBy(() -> client.kick(ROOM_ID, "@ghost-t1:matrix.example.org", "probe", BOT))
                .isInstanceOf(ChatNetworkException.class)
                .extracting(e -> ((ChatNetworkException) e).getErrorType())
                .isEqualTo(ErrorType.NOT_MEMBER);
        }

        @Test
        void getMembership_Joined_ReturnsJoin() throws Exception {
            respond(200, "{\"membership\": \"join\", \"displayname\": \"Alice\"}");

            assertThat(client.getMembership(ROOM_ID, "@alice-t1:matrix.example.org", BOT))
                .isEqualTo(RoomMembership.JOIN);
        }

        @Test
        void getMembership_NoStateEvent_ReturnsNone() throws Exception {
            respond(404, "{\"errcode\": \"M_NOT_FOUND\", \"error\": \"Event not found.\"}");

            assertThat(client.getMembership(ROOM_ID, "@alice-t1:matrix.example.org", BOT))
                .isEqualTo(RoomMembership.NONE);
        }
    }

    @Nested
    @DisplayName("power levels")
    class PowerLevelTests {

        @Test
        void getPowerLevels_ParsesUsersAndDefaults() throws Exception {
            respond(200, "{\"users\": {\"" + BOT + "\": 100}, \"users_default\": 0, \"kick\": 50}");

            RoomPowerLevels levels = client.getPowerLevels(ROOM_ID, BOT);

            assertThat(levels.levelOf(BOT)).isEqualTo(100);
            assertThat(levels.levelOf("@alice-t1:matrix.example.org")).isZero();
            assertThat(levels.getKickLevel()).isEqualTo(50);
        }

        @Test
        @DisplayName("should read the current levels before writing merged content as the sender")
        void setUserPowerLevels_ReadsThenWrites() throws Exception {
            respond(200, "{\"users\": {\"@admin-t1:matrix.example.org\": 100}}");

            client.setUserPowerLevels(ROOM_ID, Map.of(BOT, 100), null);

            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient, times(2)).send(captor.capture(), eq(HttpResponse.BodyHandlers.ofString()));
            List<HttpRequest> requests = captor.getAllValues();
            assertThat(requests).extracting(HttpRequest::method).containsExactly("GET", "PUT");
            assertThat(requests.get(1).uri().toString()).isEqualTo(
                "http://hs.test/_matrix/client/v3/rooms/%21abc%3Amatrix.example.org/state/m.room.power_levels/");
        }
    }

    @Nested
    @DisplayName("retries and transport failures")
    class RetryTests {

        @Test
        @DisplayName("should wait retry_after_ms and retry on rate limit")
        void execute_RateLimitedOnce_RetriesAndSucceeds() throws Exception {
            // Given
            when(rateLimitResponse.statusCode()).thenReturn(429);
            when(rateLimitResponse.body()).thenReturn("{\"errcode\": \"M_LIMIT_EXCEEDED\", \"retry_after_ms\": 1500}");
            when(httpResponse.statusCode()).thenReturn(200);
            when(httpResponse.body()).thenReturn("{\"room_id\": \"" + ROOM_ID + "\"}");
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString())))
                .thenReturn(rateLimitResponse)
                .thenReturn(httpResponse);

            // Spy to skip actual sleep
            MatrixChatNetworkClient spyClient = spy(client);
            doNothing().when(spyClient).sleep(anyLong());

            // When
            Optional<String> roomId = spyClient.resolveAlias("#event-foo-t1:matrix.example.org");

            // Then
            assertThat(roomId).contains(ROOM_ID);
            verify(spyClient).sleep(1500L);
            verify(httpClient, times(2)).send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()));
        }

        @Test
        @DisplayName("should back off exponentially and give up after max retries")
        void execute_RateLimitedRepeatedly_ThrowsRateLimited() throws Exception {
            // Given
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString())))
                .thenReturn(rateLimitResponse);
            when(rateLimitResponse.statusCode()).thenReturn(429);

            MatrixChatNetworkClient spyClient = spy(client);
            doNothing().when(spyClient).sleep(anyLong());

            // When/Then
            assertThatThrownBy(() -> spyClient.invite(ROOM_ID, "@alice-t1:matrix.example.org", BOT))
                .isInstanceOf(ChatNetworkException.class)
                .satisfies(e -> {
                    ChatNetworkException ex = (ChatNetworkException) e;
                    assertThat(ex.getErrorType()).isEqualTo(ErrorType.RATE_LIMITED);
                    assertThat(ex.isTransient()).isTrue();
                });

            verify(spyClient).sleep(500L);
            verify(spyClient).sleep(1000L);
            verify(spyClient).sleep(2000L);
            verify(httpClient, times(4)).send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()));
        }

        @Test
        void execute_Timeout_ThrowsTimeout() throws Exception {
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString())))
                .thenThrow(new HttpTimeoutException("request timed out"));

            assertThatThrownBy(() -> client.resolveAlias("#event-foo-t1:matrix.example.org"))
                .isInstanceOf(ChatNetworkException.class)
                .extracting(e -> ((ChatNetworkException) e).getErrorType())
                .isEqualTo(ErrorType.TIMEOUT);
        }

        @Test
        void execute_ConnectionRefused_ThrowsUnavailable() throws Exception {
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString())))
                .thenThrow(new IOException("Connection refused"));

            assertThatThrownBy(() -> client.ping())
                .isInstanceOf(ChatNetworkException.class)
                .extracting(e -> ((ChatNetworkException) e).getErrorType())
                .isEqualTo(ErrorType.UNAVAILABLE);
        }
    }

    @Nested
    @DisplayName("classify")
    class ClassifyTests {

        @ParameterizedTest(name = "{0} HTTP {1} {2} -> {4}")
        @CsvSource({
            "createRoom,    400, M_ROOM_IN_USE, Room alias already taken,          ROOM_IN_USE",
            "registerAlias, 409, M_UNKNOWN,     Room alias already exists,         ROOM_IN_USE",
            "invite,        403, M_FORBIDDEN,   user is already joined to room,    ALREADY_MEMBER",
            "kick,          403, M_FORBIDDEN,   The user is not a member,          NOT_MEMBER",
            "resolveAlias,  404, M_NOT_FOUND,   not found,                         NOT_FOUND",
            "invite,        401, M_UNKNOWN_TOKEN, Unknown token,                   FORBIDDEN",
            "invite,        403, M_FORBIDDEN,   Insufficient power,                FORBIDDEN",
            "createRoom,    500, M_UNKNOWN,     Internal error,                    UNAVAILABLE",
            "createRoom,    400, M_BAD_JSON,    Bad json,                          BAD_REQUEST"
        })
        void classify_MapsResponses(String operation, int status, String errcode, String error, ErrorType expected) {
            assertThat(MatrixChatNetworkClient.classify(operation, status, errcode, error).getErrorType())
                .isEqualTo(expected);
        }

        @Test
        void classify_MessageIncludesStatusAndErrcode() {
            ChatNetworkException e = MatrixChatNetworkClient.classify("invite", 403, "M_FORBIDDEN", "nope");

            assertThat(e.getMessage()).isEqualTo("invite failed with HTTP 403 M_FORBIDDEN: nope");
            assertThat(e.getErrcode()).isEqualTo("M_FORBIDDEN");
        }
    }
}
