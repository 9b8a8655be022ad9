package com.eainde.breakdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Locale;

/**
 * A clearance issue found in the scene text.
 *
 * @param alertType  what kind of entity was mentioned
 * @param entityName the entity as listed in the knowledge base
 * @param description human-readable action for the legal team
 * @param severity   {@code critical} for song titles, {@code warning} otherwise
 */
public record LegalAlert(
        @JsonProperty("alert_type")  AlertType alertType,
        @JsonProperty("entity_name") String entityName,
        @JsonProperty("description") String description,
        @JsonProperty("severity")    Severity severity
) implements Serializable {

    public enum AlertType {
        CELEBRITY, BRAND, MUSIC;

        @JsonValue
        public String json() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Severity {
        WARNING, CRITICAL;

        @JsonValue
        public String json() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
