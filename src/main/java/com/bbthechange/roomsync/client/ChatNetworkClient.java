package com.bbthechange.roomsync.client;

import com.bbthechange.roomsync.exception.ChatNetworkException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Room operations against the federated chat network.
 *
 * Every call is blocking and bounded by the configured request timeout. Failures surface as
 * {@link ChatNetworkException} with a classified error type. The acting user is the identity
 * the call is made as; null means the application service's own sender.
 */
public interface ChatNetworkClient {

    /**
     * Resolve an alias to a room id. Empty when the alias is not mapped.
     */
    Optional<String> resolveAlias(String alias);

    /**
     * Create a room and return its id.
     *
     * @throws ChatNetworkException with {@code ROOM_IN_USE} when the alias is already taken
     */
    String createRoom(CreateRoomOptions options);

    /**
     * Map an additional alias to a room in the directory.
     *
     * @throws ChatNetworkException with {@code ROOM_IN_USE} when the alias points elsewhere
     */
    void registerAlias(String alias, String roomId);

    void setCanonicalAlias(String roomId, String alias, List<String> altAliases, String actingUserId);

    /**
     * @throws ChatNetworkException with {@code ALREADY_MEMBER} when the user is already joined or invited
     */
    void invite(String roomId, String userId, String actingUserId);

    /**
     * @throws ChatNetworkException with {@code NOT_MEMBER} when the user is not in the room
     */
    void kick(String roomId, String userId, String reason, String actingUserId);

    RoomMembership getMembership(String roomId, String userId, String actingUserId);

    RoomPowerLevels getPowerLevels(String roomId, String actingUserId);

    /**
     * Merge the given user levels into the room's power levels, preserving everything else.
     */
    void setUserPowerLevels(String roomId, Map<String, Integer> userLevels, String actingUserId);

    /**
     * Check the homeserver answers at all.
     */
    void ping();
}
