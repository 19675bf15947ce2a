package com.bbthechange.roomsync.service.impl;

import com.bbthechange.roomsync.exception.RepositoryException;
import com.bbthechange.roomsync.identity.TenantRoomIdentity;
import com.bbthechange.roomsync.model.EntityRef;
import com.bbthechange.roomsync.model.MemberRole;
import com.bbthechange.roomsync.model.MembershipIntent;
import com.bbthechange.roomsync.model.SyncResult;
import com.bbthechange.roomsync.repository.EntityDirectory;
import com.bbthechange.roomsync.service.ChatMembershipService;
import com.bbthechange.roomsync.service.MembershipSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Builds membership intents from locally stored roles and records the outcome.
 * A local role is only written after the room accepted the change.
 */
@Service
public class ChatMembershipServiceImpl implements ChatMembershipService {

    private static final Logger logger = LoggerFactory.getLogger(ChatMembershipServiceImpl.class);

    private final EntityDirectory entityDirectory;
    private final MembershipSynchronizer membershipSynchronizer;
    private final TenantRoomIdentity identity;

    @Autowired
    public ChatMembershipServiceImpl(EntityDirectory entityDirectory,
                                     MembershipSynchronizer membershipSynchronizer,
                                     TenantRoomIdentity identity) {
        this.entityDirectory = entityDirectory;
        this.membershipSynchronizer = membershipSynchronizer;
        this.identity = identity;
    }

    @Override
    public SyncResult addMember(EntityRef entity, String actorSlug, String targetSlug, String desiredRole) {
        MemberRole current = roleOf(entity, targetSlug);
        MemberRole desired;
        if (desiredRole != null) {
            desired = MemberRole.parse(desiredRole);
        } else {
            desired = current != null ? current : MemberRole.MEMBER;
        }
        return applyAndRecord(entity, actorSlug, targetSlug, current, desired);
    }

    @Override
    public SyncResult removeMember(EntityRef entity, String actorSlug, String targetSlug) {
        MembershipIntent intent = MembershipIntent.removal(
            identity.buildUserId(entity.tenantId(), actorSlug),
            actorRole(entity, actorSlug),
            identity.buildUserId(entity.tenantId(), targetSlug),
            roleOf(entity, targetSlug));

        SyncResult result = membershipSynchronizer.apply(entity, intent);
        if (result.isSuccess()) {
            entityDirectory.removeMember(entity.tenantId(), entity.entityType(), entity.entitySlug(), targetSlug);
        }
        return result;
    }

    @Override
    public SyncResult changeRole(EntityRef entity, String actorSlug, String targetSlug, String desiredRole) {
        MemberRole desired = MemberRole.parse(desiredRole);
        return applyAndRecord(entity, actorSlug, targetSlug, roleOf(entity, targetSlug), desired);
    }

    private SyncResult applyAndRecord(EntityRef entity, String actorSlug, String targetSlug,
                                      MemberRole current, MemberRole desired) {
        MembershipIntent intent = new MembershipIntent(
            identity.buildUserId(entity.tenantId(), actorSlug),
            actorRole(entity, actorSlug),
            identity.buildUserId(entity.tenantId(), targetSlug),
            current,
            desired);

        SyncResult result = membershipSynchronizer.apply(entity, intent);
        if (result.isSuccess() && intent.changesRole()) {
            try {
                entityDirectory.recordMemberRole(entity.tenantId(), entity.entityType(),
                    entity.entitySlug(), targetSlug, desired);
            } catch (RepositoryException e) {
                // Room membership is already ahead of the stored role
                logger.error("Room updated but role {} for {} in {} was not recorded", desired, targetSlug, entity, e);
                throw e;
            }
        }
        return result;
    }

    /**
     * Actors without a local role act with guest authority, which permits nothing but leaving.
     */
    private MemberRole actorRole(EntityRef entity, String actorSlug) {
        MemberRole role = roleOf(entity, actorSlug);
        return role != null ? role : MemberRole.GUEST;
    }

    private MemberRole roleOf(EntityRef entity, String userSlug) {
        return entityDirectory.findMemberRole(entity.tenantId(), entity.entityType(), entity.entitySlug(), userSlug)
            .orElse(null);
    }
}
