package com.bbthechange.roomsync.service.impl;

import com.bbthechange.roomsync.exception.RepositoryException;
import com.bbthechange.roomsync.identity.TenantRoomIdentity;
import com.bbthechange.roomsync.model.EntityMembership;
import com.bbthechange.roomsync.model.EntityRef;
import com.bbthechange.roomsync.model.EntityType;
import com.bbthechange.roomsync.model.FailureKind;
import com.bbthechange.roomsync.model.MemberRole;
import com.bbthechange.roomsync.model.MembershipIntent;
import com.bbthechange.roomsync.model.MembershipOperation;
import com.bbthechange.roomsync.model.SyncResult;
import com.bbthechange.roomsync.model.SyncStep;
import com.bbthechange.roomsync.repository.EntityDirectory;
import com.bbthechange.roomsync.service.MembershipSynchronizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserRoomSyncServiceImplTest {

    private static final String GUS = "@gus-t1:matrix.example.org";
    private static final String ROOM = "!room1:matrix.example.org";

    @Mock
    private EntityDirectory entityDirectory;

    @Mock
    private MembershipSynchronizer membershipSynchronizer;

    private UserRoomSyncServiceImpl service;

    private final EntityRef foo = new EntityRef("t1", EntityType.EVENT, "foo");
    private final EntityRef club = new EntityRef("t1", EntityType.GROUP, "club");

    @BeforeEach
    void setUp() {
        service = new UserRoomSyncServiceImpl(entityDirectory, membershipSynchronizer,
            new TenantRoomIdentity("matrix.example.org", "bot"));
    }

    private static Map<String, Object> memberEvent(String sender, String stateKey, String membership) {
        return Map.of(
            "type", "m.room.member",
            "room_id", ROOM,
            "sender", sender,
            "state_key", stateKey,
            "content", Map.of("membership", membership));
    }

    @Nested
    class HandleEventTests {

        @Test
        @DisplayName("a user's own join syncs all of their rooms")
        void handleEvent_SelfJoin_SyncsEveryMembership() {
            // Given
            when(entityDirectory.findMemberships("t1", "gus")).thenReturn(List.of(
                new EntityMembership(foo, "gus", MemberRole.GUEST),
                new EntityMembership(club, "gus", MemberRole.MEMBER)));
            when(membershipSynchronizer.apply(any(), any())).thenReturn(SyncResult.success(ROOM, MembershipOperation.NONE));

            // When
            service.handleEvent(memberEvent(GUS, GUS, "join"));

            // Then
            verify(membershipSynchronizer).apply(eq(foo), any());
            verify(membershipSynchronizer).apply(eq(club), any());
        }

        @Test
        @DisplayName("an invite sent by someone else is ignored")
        void handleEvent_InviteBySomeoneElse_Ignored() {
            service.handleEvent(memberEvent("@mod-t1:matrix.example.org", GUS, "invite"));

            verifyNoInteractions(entityDirectory, membershipSynchronizer);
        }

        @Test
        void handleEvent_JoinOnBehalfOfSomeoneElse_Ignored() {
            service.handleEvent(memberEvent("@mod-t1:matrix.example.org", GUS, "join"));

            verifyNoInteractions(entityDirectory, membershipSynchronizer);
        }

        @Test
        void handleEvent_SelfLeave_Ignored() {
            service.handleEvent(memberEvent(GUS, GUS, "leave"));

            verifyNoInteractions(entityDirectory, membershipSynchronizer);
        }

        @Test
        void handleEvent_OtherEventType_Ignored() {
            service.handleEvent(Map.of("type", "m.room.message", "sender", GUS, "content", Map.of("body", "hi")));

            verifyNoInteractions(entityDirectory, membershipSynchronizer);
        }

        @Test
        void handleEvent_ForeignServerUser_Ignored() {
            String foreign = "@gus-t1:elsewhere.org";

            service.handleEvent(memberEvent(foreign, foreign, "join"));

            verifyNoInteractions(entityDirectory, membershipSynchronizer);
        }

        @Test
        @DisplayName("a directory outage is logged, never thrown")
        void handleEvent_DirectoryFails_DoesNotThrow() {
            when(entityDirectory.findMemberships(anyString(), anyString()))
                .thenThrow(new RepositoryException("Failed to list memberships"));

            assertThatCode(() -> service.handleEvent(memberEvent(GUS, GUS, "join"))).doesNotThrowAnyException();
            verifyNoInteractions(membershipSynchronizer);
        }
    }

    @Nested
    class SyncUserRoomsTests {

        @Test
        @DisplayName("each membership keeps its role, so no role change is requested")
        void syncUserRooms_BuildsUnchangedRoleIntent() {
            // Given
            when(entityDirectory.findMemberships("t1", "gus"))
                .thenReturn(List.of(new EntityMembership(foo, "gus", MemberRole.GUEST)));
            when(membershipSynchronizer.apply(eq(foo), any())).thenReturn(SyncResult.success(ROOM, MembershipOperation.INVITE));

            // When
            List<SyncResult> results = service.syncUserRooms(GUS);

            // Then
            assertThat(results).hasSize(1);
            assertThat(results.get(0).isSuccess()).isTrue();
            ArgumentCaptor<MembershipIntent> captor = ArgumentCaptor.forClass(MembershipIntent.class);
            verify(membershipSynchronizer).apply(eq(foo), captor.capture());
            MembershipIntent intent = captor.getValue();
            assertThat(intent.actorId()).isEqualTo(GUS);
            assertThat(intent.targetUserId()).isEqualTo(GUS);
            assertThat(intent.actorRole()).isEqualTo(MemberRole.GUEST);
            assertThat(intent.targetCurrentRole()).isEqualTo(MemberRole.GUEST);
            assertThat(intent.desiredRole()).isEqualTo(MemberRole.GUEST);
            assertThat(intent.changesRole()).isFalse();
        }

        @Test
        @DisplayName("one failing room does not stop the others")
        void syncUserRooms_OneRoomFails_ContinuesWithNext() {
            // Given
            when(entityDirectory.findMemberships("t1", "gus")).thenReturn(List.of(
                new EntityMembership(foo, "gus", MemberRole.MEMBER),
                new EntityMembership(club, "gus", MemberRole.MEMBER)));
            when(membershipSynchronizer.apply(eq(foo), any()))
                .thenReturn(SyncResult.failure(FailureKind.PERMISSION_UNAVAILABLE, SyncStep.VERIFY_PERMISSIONS, ROOM, "no power"));
            when(membershipSynchronizer.apply(eq(club), any()))
                .thenThrow(new IllegalStateException("boom"));

            // When
            List<SyncResult> results = service.syncUserRooms(GUS);

            // Then
            assertThat(results).extracting(SyncResult::getFailureKind)
                .containsExactly(FailureKind.PERMISSION_UNAVAILABLE, FailureKind.TRANSIENT);
        }

        @Test
        void syncUserRooms_NoMemberships_Empty() {
            when(entityDirectory.findMemberships("t1", "gus")).thenReturn(List.of());

            assertThat(service.syncUserRooms(GUS)).isEmpty();
            verifyNoInteractions(membershipSynchronizer);
        }

        @Test
        void syncUserRooms_MalformedUserId_Empty() {
            assertThat(service.syncUserRooms("not-a-user-id")).isEmpty();
            verifyNoInteractions(entityDirectory);
        }
    }
}
