package com.eainde.breakdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * @param pattern        name of the cinematic pattern that fired, or of the default used
 * @param productionNote note for the director and assistant director
 * @param cameraNote     note for the camera department, may be empty
 */
public record CinematicNote(
        @JsonProperty("pattern")         String pattern,
        @JsonProperty("production_note") String productionNote,
        @JsonProperty("camera_note")     String cameraNote
) implements Serializable {

    public static final String CONTINUITY_REVIEW = "continuity_review";

    public CinematicNote {
        productionNote = productionNote == null ? "" : productionNote;
        cameraNote = cameraNote == null ? "" : cameraNote;
    }

    public static CinematicNote continuityReview() {
        return new CinematicNote(CONTINUITY_REVIEW, "Review continuity.", "");
    }
}
