package com.eainde.breakdown.continuity;

import com.eainde.breakdown.scene.TimeOfDay;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One appearance of a character.
 *
 * @param sceneNumber scene the character appeared in
 * @param sequence    registration order within the run, starting at 0
 * @param location    location of that scene as written
 * @param timeOfDay   time of day of that scene
 * @param wardrobe    the character's wardrobe description in that scene, may be null
 */
public record TimelineEntry(
        @JsonProperty("scene_number") String sceneNumber,
        @JsonProperty("sequence")     int sequence,
        @JsonProperty("location")     String location,
        @JsonProperty("time_of_day")  TimeOfDay timeOfDay,
        @JsonProperty("wardrobe")     String wardrobe
) implements Serializable {
}
