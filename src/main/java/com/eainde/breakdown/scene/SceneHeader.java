package com.eainde.breakdown.scene;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Parsed scene header.
 *
 * @param interiorExterior INT or EXT, defaults to INT
 * @param timeOfDay        DAY or NIGHT, defaults to DAY
 * @param location         location text; never empty, {@value #UNSPECIFIED} when unknown
 */
public record SceneHeader(
        @JsonProperty("interior_exterior") InteriorExterior interiorExterior,
        @JsonProperty("time_of_day")       TimeOfDay timeOfDay,
        @JsonProperty("location")          String location
) implements Serializable {

    public static final String UNSPECIFIED = "unspecified";

    public SceneHeader {
        interiorExterior = interiorExterior == null ? InteriorExterior.INT : interiorExterior;
        timeOfDay = timeOfDay == null ? TimeOfDay.DAY : timeOfDay;
        location = location == null || location.isBlank() ? UNSPECIFIED : location;
    }

    public static SceneHeader defaults() {
        return new SceneHeader(InteriorExterior.INT, TimeOfDay.DAY, UNSPECIFIED);
    }

    @JsonIgnore
    public LocationType locationType() {
        return LocationType.classify(location);
    }

    @JsonIgnore
    public boolean hasLocation() {
        return !UNSPECIFIED.equals(location);
    }
}
