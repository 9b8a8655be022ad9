package com.eainde.breakdown.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Production department an item is filed under. Every item lands in exactly one.
 */
public enum PropCategory {
    PROPS,
    SET_DRESSING,
    VEHICLES;

    @JsonValue
    public String json() {
        return name().toLowerCase(Locale.ROOT);
    }
}
