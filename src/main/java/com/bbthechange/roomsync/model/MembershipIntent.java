package com.bbthechange.roomsync.model;

/**
 * A single requested membership change, alive only for one synchronization call.
 *
 * @param actorId           chat user id of the actor
 * @param actorRole         role of the actor in the owning entity
 * @param targetUserId      chat user id of the target
 * @param targetCurrentRole target's current role, null when the target holds no role yet
 * @param desiredRole       requested role, null means remove
 */
public record MembershipIntent(String actorId,
                               MemberRole actorRole,
                               String targetUserId,
                               MemberRole targetCurrentRole,
                               MemberRole desiredRole) {

    public static MembershipIntent removal(String actorId, MemberRole actorRole,
                                           String targetUserId, MemberRole targetCurrentRole) {
        return new MembershipIntent(actorId, actorRole, targetUserId, targetCurrentRole, null);
    }

    public boolean isRemoval() {
        return desiredRole == null;
    }

    public boolean isSelf() {
        return actorId != null && actorId.equals(targetUserId);
    }

    public boolean changesRole() {
        return desiredRole != null && desiredRole != targetCurrentRole;
    }
}
