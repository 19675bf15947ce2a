package com.bbthechange.roomsync.model;

/**
 * Outcome of ensuring a room exists for an entity.
 *
 * @param roomId    external room id
 * @param alias     canonical alias of the room
 * @param recreated true only when this call's create request produced the room
 */
public record RoomHandle(String roomId, String alias, boolean recreated) {
}
