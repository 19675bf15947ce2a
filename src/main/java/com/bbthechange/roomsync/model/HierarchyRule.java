package com.bbthechange.roomsync.model;

/**
 * Rules of the membership role hierarchy. Each decision names the rule that produced it.
 */
public enum HierarchyRule {

    OWNER_UNRESTRICTED("Owners may set any role on any member"),
    OWNER_TARGET_PROTECTED("Only an owner may change or remove an owner"),
    OWNER_GRANT_RESTRICTED("Only an owner may grant the owner role"),
    ADMIN_SCOPE("Admins may act on admins or lower and grant roles up to admin"),
    MODERATOR_SCOPE("Moderators may only act on members or guests and grant member or guest"),
    NO_ROLE_AUTHORITY("Members and guests may not change or remove other members"),
    SELF_PROMOTION("Members may not promote themselves"),
    SELF_REMOVAL("Members may always remove themselves"),
    UNCHANGED("Role is unchanged, no authority required"),
    INVALID_ROLE("Role is not recognized");

    private final String description;

    HierarchyRule(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
