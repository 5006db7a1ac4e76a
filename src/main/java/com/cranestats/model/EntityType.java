package com.cranestats.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of maintainable equipment.
 *
 * A CRANE is a simple entity whose usage is read from its own telemetry stream.
 * A SPREADER is a composite entity whose usage is accrued on the cranes it is
 * assigned to (see EquipmentAssignment).
 */
public enum EntityType {
    CRANE,
    SPREADER;

    /**
     * Case-insensitive lookup, accepts "crane" as stored by older tooling.
     *
     * @throws IllegalArgumentException for an unknown kind
     */
    @JsonCreator
    public static EntityType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("entityType is required");
        }
        try {
            return EntityType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown entityType: " + value);
        }
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
