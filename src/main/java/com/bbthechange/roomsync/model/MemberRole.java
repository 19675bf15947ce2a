package com.bbthechange.roomsync.model;

import com.bbthechange.roomsync.exception.InvalidRoleException;

import java.util.Locale;
import java.util.Optional;

/**
 * Membership roles for events and groups, highest first.
 * Replaces the old ADMIN/MEMBER string constants with the full five-level ordering.
 */
public enum MemberRole {

    OWNER("owner", 5),
    ADMIN("admin", 4),
    MODERATOR("moderator", 3),
    MEMBER("member", 2),
    GUEST("guest", 1);

    private final String roleName;
    private final int rank;

    MemberRole(String roleName, int rank) {
        this.roleName = roleName;
        this.rank = rank;
    }

    public String getRoleName() {
        return roleName;
    }

    public int getRank() {
        return rank;
    }

    public boolean isAbove(MemberRole other) {
        return rank > other.rank;
    }

    public boolean isAtMost(MemberRole other) {
        return rank <= other.rank;
    }

    /**
     * Resolve a role name case-insensitively. Unknown or blank names resolve to empty.
     */
    public static Optional<MemberRole> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MemberRole role : values()) {
            if (role.roleName.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a role name or fail with {@link InvalidRoleException}.
     */
    public static MemberRole parse(String name) {
        return fromName(name)
            .orElseThrow(() -> new InvalidRoleException("Unrecognized role: " + name));
    }

    @Override
    public String toString() {
        return roleName;
    }
}
