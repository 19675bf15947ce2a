package com.bbthechange.roomsync.service.impl;

import com.bbthechange.roomsync.client.ChatNetworkClient;
import com.bbthechange.roomsync.client.CreateRoomOptions;
import com.bbthechange.roomsync.client.RoomMembership;
import com.bbthechange.roomsync.client.RoomPowerLevels;
import com.bbthechange.roomsync.config.MatrixProperties;
import com.bbthechange.roomsync.exception.ChatNetworkException;
import com.bbthechange.roomsync.exception.ChatNetworkException.ErrorType;
import com.bbthechange.roomsync.identity.TenantRoomIdentity;
import com.bbthechange.roomsync.model.BotPermissionSnapshot;
import com.bbthechange.roomsync.testutil.InMemoryChatNetwork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BotPermissionServiceImplTest {

    private static final String SERVER = "matrix.example.org";
    private static final String BOT = "@bot-t1:matrix.example.org";
    private static final String ALICE = "@alice-t1:matrix.example.org";

    private final TenantRoomIdentity identity = new TenantRoomIdentity(SERVER, "bot");

    @Nested
    @DisplayName("Against an in-memory homeserver")
    class InMemoryTests {

        private InMemoryChatNetwork network;
        private BotPermissionServiceImpl service;
        private String roomId;

        @BeforeEach
        void setUp() {
            network = new InMemoryChatNetwork(SERVER);
            service = new BotPermissionServiceImpl(network, identity, new MatrixProperties());
            roomId = network.createRoom(new CreateRoomOptions("event-foo-t1", "event foo", "private_chat", BOT, 100));
        }

        @Test
        @DisplayName("a bot with admin power is reported healthy without elevation")
        void diagnose_AdminBot_Healthy() {
            // When
            BotPermissionSnapshot snapshot = service.diagnose("t1", roomId, null);

            // Then
            assertThat(snapshot.getBotUserId()).isEqualTo(BOT);
            assertThat(snapshot.getCurrentPowerLevel()).isEqualTo(100);
            assertThat(snapshot.isCanInvite()).isTrue();
            assertThat(snapshot.isCanKick()).isTrue();
            assertThat(snapshot.isCanModifyPowerLevels()).isTrue();
            assertThat(snapshot.isFixAttempted()).isFalse();
            assertThat(snapshot.getErrors()).isEmpty();
            assertThat(snapshot.isHealthy()).isTrue();
            assertThat(snapshot.getFinalPowerLevel()).isEqualTo(100);
        }

        @Test
        @DisplayName("a demoted bot is elevated and verified")
        void diagnose_DemotedBot_HealsAndConverges() {
            // Given
            network.setPowerLevel(roomId, BOT, 0);

            // When
            BotPermissionSnapshot snapshot = service.diagnose("t1", roomId, null);

            // Then
            assertThat(snapshot.getCurrentPowerLevel()).isZero();
            assertThat(snapshot.isCanKick()).isFalse();
            assertThat(snapshot.isFixAttempted()).isTrue();
            assertThat(snapshot.isFixSucceeded()).isTrue();
            assertThat(snapshot.isCanInvite()).isTrue();
            assertThat(snapshot.isKickAuthorityAvailable()).isTrue();
            assertThat(snapshot.getFinalPowerLevel()).isEqualTo(100);
            assertThat(snapshot.isCanModifyPowerLevels()).isTrue();
            assertThat(snapshot.isNetworkUnavailable()).isFalse();
            assertThat(network.powerLevelOf(roomId, BOT)).isEqualTo(100);
        }

        @Test
        @DisplayName("a second diagnosis after healing needs no fix")
        void diagnose_AfterHeal_Stable() {
            network.setPowerLevel(roomId, BOT, 0);
            service.diagnose("t1", roomId, null);

            BotPermissionSnapshot second = service.diagnose("t1", roomId, null);

            assertThat(second.isFixAttempted()).isFalse();
            assertThat(second.isHealthy()).isTrue();
        }

        @Test
        @DisplayName("the invite probe targets the given user")
        void diagnose_WithProbeUser_InvitesThatUser() {
            service.diagnose("t1", roomId, ALICE);

            assertThat(network.getMembership(roomId, ALICE, BOT)).isEqualTo(RoomMembership.INVITE);
        }

        @Test
        @DisplayName("healing keeps other users' levels")
        void heal_PreservesOtherLevels() {
            network.setPowerLevel(roomId, ALICE, 50);
            network.setPowerLevel(roomId, BOT, 10);

            boolean healed = service.heal("t1", roomId);

            assertThat(healed).isTrue();
            assertThat(network.powerLevelOf(roomId, BOT)).isEqualTo(100);
            assertThat(network.powerLevelOf(roomId, ALICE)).isEqualTo(50);
        }

        @Test
        @DisplayName("an unreachable homeserver is reported as a network problem, not a permission problem")
        void diagnose_Unreachable_NetworkUnavailable() {
            network.setUnreachable(true);

            BotPermissionSnapshot snapshot = service.diagnose("t1", roomId, null);

            assertThat(snapshot.isNetworkUnavailable()).isTrue();
            assertThat(snapshot.isCanInvite()).isFalse();
            assertThat(snapshot.isFixAttempted()).isTrue();
            assertThat(snapshot.isFixSucceeded()).isFalse();
            assertThat(snapshot.getCurrentPowerLevel()).isNull();
            assertThat(snapshot.getErrors())
                .anyMatch(error -> error.startsWith("Failed to elevate bot power level in room " + roomId));
        }
    }

    @Nested
    @DisplayName("With a mocked client")
    @ExtendWith(MockitoExtension.class)
    class MockedClientTests {

        private static final String ROOM = "!r:matrix.example.org";

        @Mock
        private ChatNetworkClient chatClient;

        private BotPermissionServiceImpl service;

        @BeforeEach
        void setUp() {
            service = new BotPermissionServiceImpl(chatClient, identity, new MatrixProperties());
        }

        @Test
        @DisplayName("a refused elevation is reported and never counted as a network outage")
        void diagnose_ElevationRefused_FixFails() {
            // Given
            when(chatClient.getPowerLevels(ROOM, BOT))
                .thenReturn(new RoomPowerLevels(Map.of("users", Map.of(BOT, 0), "state_default", 50)));
            doThrow(new ChatNetworkException(ErrorType.FORBIDDEN, 403, "M_FORBIDDEN", "no power"))
                .when(chatClient).invite(ROOM, BOT, BOT);
            doThrow(new ChatNetworkException(ErrorType.FORBIDDEN, 403, "M_FORBIDDEN", "no power"))
                .when(chatClient).kick(eq(ROOM), anyString(), anyString(), eq(BOT));
            doThrow(new ChatNetworkException(ErrorType.FORBIDDEN, 403, "M_FORBIDDEN", "no power"))
                .when(chatClient).setUserPowerLevels(eq(ROOM), anyMap(), isNull());

            // When
            BotPermissionSnapshot snapshot = service.diagnose("t1", ROOM, null);

            // Then
            assertThat(snapshot.isFixAttempted()).isTrue();
            assertThat(snapshot.isFixSucceeded()).isFalse();
            assertThat(snapshot.isCanInvite()).isFalse();
            assertThat(snapshot.isKickAuthorityAvailable()).isFalse();
            assertThat(snapshot.isNetworkUnavailable()).isFalse();
            assertThat(snapshot.isCanModifyPowerLevels()).isFalse();
            assertThat(snapshot.getErrors()).contains("Failed to elevate bot power level in room " + ROOM);
        }

        @Test
        @DisplayName("the kick probe targets a throwaway user in the tenant namespace")
        void diagnose_KickProbe_UsesProbeUser() {
            when(chatClient.getPowerLevels(ROOM, BOT))
                .thenReturn(new RoomPowerLevels(Map.of("users", Map.of(BOT, 100))));
            doThrow(new ChatNetworkException(ErrorType.NOT_MEMBER, 403, "M_FORBIDDEN", "The target user is not in the room"))
                .when(chatClient).kick(eq(ROOM), anyString(), anyString(), eq(BOT));

            BotPermissionSnapshot snapshot = service.diagnose("t1", ROOM, null);

            assertThat(snapshot.isCanKick()).isTrue();
            verify(chatClient).kick(eq(ROOM),
                matches("@permission-probe-[0-9a-f]{32}-t1:matrix\\.example\\.org"),
                anyString(), eq(BOT));
        }

        @Test
        void heal_WritesAdminLevelAsSender() {
            boolean healed = service.heal("t1", ROOM);

            assertThat(healed).isTrue();
            verify(chatClient).setUserPowerLevels(ROOM, Map.of(BOT, 100), null);
        }

        @Test
        void heal_NetworkFailure_ReturnsFalse() {
            doThrow(ChatNetworkException.unavailable("setUserPowerLevels", null))
                .when(chatClient).setUserPowerLevels(any(), any(), any());

            assertThat(service.heal("t1", ROOM)).isFalse();
        }
    }
}
