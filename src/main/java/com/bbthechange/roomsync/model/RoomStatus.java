package com.bbthechange.roomsync.model;

/**
 * Lifecycle state of a persisted room mapping.
 */
public enum RoomStatus {
    ACTIVE,
    RETIRED
}
