package com.bbthechange.roomsync.repository;

import com.bbthechange.roomsync.model.EntityMembership;
import com.bbthechange.roomsync.model.EntityType;
import com.bbthechange.roomsync.model.MemberRole;

import java.util.List;
import java.util.Optional;

/**
 * Read/write view of the events and groups owned by the surrounding system.
 * Only the pieces the chat engine needs: existence and per-member roles.
 */
public interface EntityDirectory {

    boolean entityExists(String tenantId, EntityType entityType, String entitySlug);

    /**
     * Role of a user in an entity, empty when the user is not a member.
     */
    Optional<MemberRole> findMemberRole(String tenantId, EntityType entityType, String entitySlug, String userSlug);

    void recordMemberRole(String tenantId, EntityType entityType, String entitySlug, String userSlug, MemberRole role);

    void removeMember(String tenantId, EntityType entityType, String entitySlug, String userSlug);

    /**
     * Every event and group of the tenant the user holds a role in. Rows with an unrecognized role are skipped.
     */
    List<EntityMembership> findMemberships(String tenantId, String userSlug);
}
