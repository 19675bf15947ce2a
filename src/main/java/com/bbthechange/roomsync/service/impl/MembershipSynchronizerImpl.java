package com.bbthechange.roomsync.service.impl;

import com.bbthechange.roomsync.client.ChatNetworkClient;
import com.bbthechange.roomsync.client.RoomMembership;
import com.bbthechange.roomsync.exception.ChatNetworkException;
import com.bbthechange.roomsync.exception.ChatNetworkException.ErrorType;
import com.bbthechange.roomsync.exception.InvalidKeyException;
import com.bbthechange.roomsync.exception.RoomSyncException;
import com.bbthechange.roomsync.identity.TenantRoomIdentity;
import com.bbthechange.roomsync.model.BotPermissionSnapshot;
import com.bbthechange.roomsync.model.EntityRef;
import com.bbthechange.roomsync.model.FailureKind;
import com.bbthechange.roomsync.model.HierarchyDecision;
import com.bbthechange.roomsync.model.MembershipIntent;
import com.bbthechange.roomsync.model.MembershipOperation;
import com.bbthechange.roomsync.model.RoomHandle;
import com.bbthechange.roomsync.model.SyncResult;
import com.bbthechange.roomsync.model.SyncStep;
import com.bbthechange.roomsync.policy.RoleHierarchyPolicy;
import com.bbthechange.roomsync.service.BotPermissionService;
import com.bbthechange.roomsync.service.MembershipSynchronizer;
import com.bbthechange.roomsync.service.RoomLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class MembershipSynchronizerImpl implements MembershipSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(MembershipSynchronizerImpl.class);

    private static final String REMOVAL_REASON = "Removed from ";

    private final RoleHierarchyPolicy hierarchyPolicy;
    private final RoomLifecycleManager roomLifecycleManager;
    private final BotPermissionService botPermissionService;
    private final ChatNetworkClient chatClient;
    private final TenantRoomIdentity identity;

    @Autowired
    public MembershipSynchronizerImpl(RoleHierarchyPolicy hierarchyPolicy,
                                      RoomLifecycleManager roomLifecycleManager,
                                      BotPermissionService botPermissionService,
                                      ChatNetworkClient chatClient,
                                      TenantRoomIdentity identity) {
        this.hierarchyPolicy = hierarchyPolicy;
        this.roomLifecycleManager = roomLifecycleManager;
        this.botPermissionService = botPermissionService;
        this.chatClient = chatClient;
        this.identity = identity;
    }

    @Override
    public SyncResult apply(EntityRef owner, MembershipIntent intent) {
        // 1. Authorize
        HierarchyDecision decision = hierarchyPolicy.evaluate(intent);
        if (!decision.allowed()) {
            logger.info("Denied membership change of {} by {} in {}: {}",
                intent.targetUserId(), intent.actorId(), owner, decision.rule());
            return SyncResult.forbidden(decision);
        }

        // 2. Ensure room
        RoomHandle room;
        try {
            room = roomLifecycleManager.ensure(owner.tenantId(), owner.entityType(), owner.entitySlug());
        } catch (RoomSyncException e) {
            return SyncResult.failure(e, SyncStep.ENSURE_ROOM, null);
        } catch (InvalidKeyException e) {
            return SyncResult.failure(FailureKind.NOT_FOUND, SyncStep.ENSURE_ROOM, null, e.getMessage());
        }

        // 3. Verify bot permissions
        BotPermissionSnapshot permissions =
            botPermissionService.diagnose(owner.tenantId(), room.roomId(), intent.actorId());
        boolean authorityAvailable = intent.isRemoval()
            ? permissions.isKickAuthorityAvailable()
            : permissions.isCanInvite();
        if (!authorityAvailable) {
            FailureKind kind = permissions.isNetworkUnavailable()
                ? FailureKind.TRANSIENT
                : FailureKind.PERMISSION_UNAVAILABLE;
            logger.warn("Bot cannot {} in room {} for {}: {}",
                intent.isRemoval() ? "kick" : "invite", room.roomId(), owner, permissions.getErrors());
            return SyncResult.failure(kind, SyncStep.VERIFY_PERMISSIONS, room.roomId(),
                "Bot lacks room privileges: " + String.join("; ", permissions.getErrors()));
        }

        // 4. Mutate
        String botUserId = identity.botUserId(owner.tenantId());
        try {
            MembershipOperation operation = intent.isRemoval()
                ? kick(room.roomId(), intent.targetUserId(), owner, botUserId)
                : invite(room.roomId(), intent.targetUserId(), botUserId);
            logger.info("Synchronized {} for {} in room {} ({})", operation, intent.targetUserId(), room.roomId(), owner);
            return SyncResult.success(room.roomId(), operation);
        } catch (ChatNetworkException e) {
            RoomSyncException failure = RoomSyncException.fromNetwork("Membership update", e);
            logger.warn("Membership update for {} in room {} failed: {}", intent.targetUserId(), room.roomId(), e.getMessage());
            return SyncResult.failure(failure, SyncStep.MUTATE_MEMBERSHIP, room.roomId());
        }
    }

    private MembershipOperation kick(String roomId, String targetUserId, EntityRef owner, String botUserId) {
        try {
            chatClient.kick(roomId, targetUserId, REMOVAL_REASON + owner.entityType() + " " + owner.entitySlug(), botUserId);
        } catch (ChatNetworkException e) {
            if (e.getErrorType() != ErrorType.NOT_MEMBER && e.getErrorType() != ErrorType.NOT_FOUND) {
                throw e;
            }
            logger.debug("{} was not in room {}, nothing to kick", targetUserId, roomId);
        }
        return MembershipOperation.KICK;
    }

    /**
     * Invite only when the target holds no membership slot yet; role changes of members
     * already present are local bookkeeping.
     */
    private MembershipOperation invite(String roomId, String targetUserId, String botUserId) {
        RoomMembership membership = chatClient.getMembership(roomId, targetUserId, botUserId);
        if (membership.isPresent()) {
            return MembershipOperation.NONE;
        }
        try {
            chatClient.invite(roomId, targetUserId, botUserId);
            return MembershipOperation.INVITE;
        } catch (ChatNetworkException e) {
            if (e.getErrorType() != ErrorType.ALREADY_MEMBER) {
                throw e;
            }
            return MembershipOperation.NONE;
        }
    }
}
