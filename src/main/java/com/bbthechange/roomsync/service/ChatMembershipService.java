package com.bbthechange.roomsync.service;

import com.bbthechange.roomsync.model.EntityRef;
import com.bbthechange.roomsync.model.SyncResult;

/**
 * Membership operations as seen by local users, addressed by user slugs.
 * Resolves roles from the entity directory and records accepted role changes there.
 */
public interface ChatMembershipService {

    /**
     * Bring a member into the entity's room.
     *
     * @param desiredRole role to grant, or null to keep the target's current role (member for newcomers)
     */
    SyncResult addMember(EntityRef entity, String actorSlug, String targetSlug, String desiredRole);

    SyncResult removeMember(EntityRef entity, String actorSlug, String targetSlug);

    SyncResult changeRole(EntityRef entity, String actorSlug, String targetSlug, String desiredRole);
}
