package com.bbthechange.roomsync.model;

/**
 * External operation a synchronization call ended up performing.
 */
public enum MembershipOperation {
    INVITE,
    KICK,
    /** Role-only change the chat network does not model; recorded locally. */
    NONE
}
