package com.bbthechange.roomsync.model;

/**
 * Steps of a membership synchronization, used to report where a failure happened.
 */
public enum SyncStep {
    AUTHORIZE,
    ENSURE_ROOM,
    VERIFY_PERMISSIONS,
    MUTATE_MEMBERSHIP
}
