package com.bbthechange.roomsync.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of a room's m.room.power_levels content.
 * The raw content is kept so a write can preserve every field this service does not manage.
 */
public class RoomPowerLevels {

    public static final String POWER_LEVELS_EVENT = "m.room.power_levels";

    private static final int DEFAULT_STATE_LEVEL = 50;

    private final Map<String, Object> content;

    public RoomPowerLevels(Map<String, Object> content) {
        this.content = content == null ? new LinkedHashMap<>() : new LinkedHashMap<>(content);
    }

    public Map<String, Object> getContent() {
        return Collections.unmodifiableMap(content);
    }

    public Map<String, Integer> getUsers() {
        return intMap(content.get("users"));
    }

    public int getUsersDefault() {
        return intValue(content.get("users_default"), 0);
    }

    /**
     * Effective level of a user: the explicit entry, otherwise users_default.
     */
    public int levelOf(String userId) {
        Integer explicit = getUsers().get(userId);
        return explicit != null ? explicit : getUsersDefault();
    }

    public boolean hasExplicitLevel(String userId) {
        return getUsers().containsKey(userId);
    }

    /**
     * Level required to send the given state event: the events entry, otherwise state_default.
     * Returns the fallback only when the room sets neither.
     */
    public int requiredForStateEvent(String eventType, int fallback) {
        Integer eventLevel = intMap(content.get("events")).get(eventType);
        if (eventLevel != null) {
            return eventLevel;
        }
        return intValue(content.get("state_default"), fallback);
    }

    public int getInviteLevel() {
        return intValue(content.get("invite"), 0);
    }

    public int getKickLevel() {
        return intValue(content.get("kick"), DEFAULT_STATE_LEVEL);
    }

    /**
     * Content with the given user levels merged over the existing ones.
     */
    public Map<String, Object> withUserLevels(Map<String, Integer> userLevels) {
        Map<String, Object> merged = new LinkedHashMap<>(content);
        Map<String, Integer> users = new LinkedHashMap<>(getUsers());
        users.putAll(userLevels);
        merged.put("users", users);
        return merged;
    }

    private static Map<String, Integer> intMap(Object value) {
        if (!(value instanceof Map)) {
            return Collections.emptyMap();
        }
        Map<String, Integer> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((key, level) -> {
            if (key != null && level instanceof Number) {
                result.put(key.toString(), ((Number) level).intValue());
            }
        });
        return result;
    }

    private static int intValue(Object value, int fallback) {
        return value instanceof Number ? ((Number) value).intValue() : fallback;
    }
}
