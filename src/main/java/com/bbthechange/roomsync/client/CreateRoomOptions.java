package com.bbthechange.roomsync.client;

/**
 * Parameters of a room creation request.
 *
 * @param aliasLocalpart    localpart the homeserver registers as the room's alias
 * @param name              display name of the room
 * @param preset            room preset, e.g. private_chat
 * @param creatorUserId     user the room is created as
 * @param creatorPowerLevel power level granted to the creator through the initial power levels
 */
public record CreateRoomOptions(String aliasLocalpart,
                                String name,
                                String preset,
                                String creatorUserId,
                                int creatorPowerLevel) {
}
