package com.bbthechange.roomsync.model;

/**
 * A user's role in one event or group, as stored by the events/groups subsystem.
 */
public record EntityMembership(EntityRef entity, String userSlug, MemberRole role) {
}
