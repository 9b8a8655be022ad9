package com.eainde.breakdown.scene;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Objects;

/**
 * The contiguous text between one scene marker and the next.
 *
 * @param sceneNumber the scene number as ASCII digits, e.g. {@code "12"}
 * @param rawText     the block text, starting with its header line
 */
public record SceneBlock(
        @JsonProperty("scene_number") String sceneNumber,
        @JsonProperty("raw_text")     String rawText
) implements Serializable {

    public SceneBlock {
        Objects.requireNonNull(sceneNumber, "sceneNumber");
        rawText = rawText == null ? "" : rawText;
    }

    /**
     * @return the numeric value of the scene number, used for ordering; unbounded
     */
    @JsonIgnore
    public BigInteger ordinal() {
        return new BigInteger(sceneNumber);
    }
}
