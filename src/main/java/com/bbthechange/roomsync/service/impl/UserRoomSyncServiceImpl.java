package com.bbthechange.roomsync.service.impl;

import com.bbthechange.roomsync.identity.TenantRoomIdentity;
import com.bbthechange.roomsync.model.ChatUserInfo;
import com.bbthechange.roomsync.model.EntityMembership;
import com.bbthechange.roomsync.model.FailureKind;
import com.bbthechange.roomsync.model.MembershipIntent;
import com.bbthechange.roomsync.model.SyncResult;
import com.bbthechange.roomsync.model.SyncStep;
import com.bbthechange.roomsync.repository.EntityDirectory;
import com.bbthechange.roomsync.service.MembershipSynchronizer;
import com.bbthechange.roomsync.service.UserRoomSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class UserRoomSyncServiceImpl implements UserRoomSyncService {

    private static final Logger logger = LoggerFactory.getLogger(UserRoomSyncServiceImpl.class);

    static final String MEMBER_EVENT_TYPE = "m.room.member";
    static final String JOIN_MEMBERSHIP = "join";

    private final EntityDirectory entityDirectory;
    private final MembershipSynchronizer membershipSynchronizer;
    private final TenantRoomIdentity identity;

    @Autowired
    public UserRoomSyncServiceImpl(EntityDirectory entityDirectory,
                                   MembershipSynchronizer membershipSynchronizer,
                                   TenantRoomIdentity identity) {
        this.entityDirectory = entityDirectory;
        this.membershipSynchronizer = membershipSynchronizer;
        this.identity = identity;
    }

    @Override
    public void handleEvent(Map<String, Object> event) {
        if (event == null || !MEMBER_EVENT_TYPE.equals(event.get("type"))) {
            return;
        }
        Object sender = event.get("sender");
        if (!(sender instanceof String) || !sender.equals(event.get("state_key"))) {
            // Invites and kicks are issued by someone else; only self-joins trigger a sync
            return;
        }
        Object content = event.get("content");
        if (!(content instanceof Map) || !JOIN_MEMBERSHIP.equals(((Map<?, ?>) content).get("membership"))) {
            return;
        }

        String userId = (String) sender;
        try {
            List<SyncResult> results = syncUserRooms(userId);
            long failed = results.stream().filter(result -> !result.isSuccess()).count();
            logger.info("Synced {} rooms for {} after join in {} ({} failed)",
                results.size(), userId, event.get("room_id"), failed);
        } catch (RuntimeException e) {
            logger.error("Room sync for {} failed", userId, e);
        }
    }

    @Override
    public List<SyncResult> syncUserRooms(String userId) {
        Optional<ChatUserInfo> user = identity.parseUserId(userId);
        if (user.isEmpty()) {
            logger.debug("Ignoring user {} outside the tenant namespace", userId);
            return List.of();
        }
        String tenantId = user.get().tenantId();
        String userSlug = user.get().userSlug();

        List<SyncResult> results = new ArrayList<>();
        for (EntityMembership membership : entityDirectory.findMemberships(tenantId, userSlug)) {
            // The user keeps their role, so only the room and the bot's authority are checked
            MembershipIntent intent = new MembershipIntent(userId, membership.role(),
                userId, membership.role(), membership.role());
            SyncResult result;
            try {
                result = membershipSynchronizer.apply(membership.entity(), intent);
            } catch (RuntimeException e) {
                logger.warn("Room sync for {} in {} failed: {}", userId, membership.entity(), e.getMessage());
                result = SyncResult.failure(FailureKind.TRANSIENT, SyncStep.MUTATE_MEMBERSHIP, null, e.getMessage());
            }
            if (!result.isSuccess()) {
                logger.warn("Could not sync {} into the room of {}: {} at {}",
                    userId, membership.entity(), result.getFailureKind(), result.getFailedStep());
            }
            results.add(result);
        }
        return results;
    }
}
