package com.bbthechange.roomsync.client;

import java.util.Locale;

/**
 * Membership state of a user in a room, as reported by the m.room.member state event.
 */
public enum RoomMembership {

    JOIN,
    INVITE,
    KNOCK,
    LEAVE,
    BAN,
    NONE;

    /**
     * Joined or invited. An invited user already occupies the membership slot, so inviting again is pointless.
     */
    public boolean isPresent() {
        return this == JOIN || this == INVITE;
    }

    public static RoomMembership fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
