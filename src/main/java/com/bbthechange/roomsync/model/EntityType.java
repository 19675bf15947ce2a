package com.bbthechange.roomsync.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of internal entities that own a chat room.
 * The value is the lowercase token used in room aliases and store keys.
 */
public enum EntityType {

    EVENT("event"),
    GROUP("group");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Look up an entity type by its alias token. Case-sensitive: aliases are always lowercase.
     */
    public static Optional<EntityType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.value.equals(value))
            .findFirst();
    }

    @Override
    public String toString() {
        return value;
    }
}
