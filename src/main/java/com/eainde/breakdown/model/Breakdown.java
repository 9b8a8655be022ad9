package com.eainde.breakdown.model;

import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.scene.SceneType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The production breakdown of one scene: the record handed to the report renderer.
 *
 * <p>Built by the enrichment pass and completed by refinement, which adds the
 * continuity fields. Collection fields are copied on construction; absent ones are
 * empty, never null.</p>
 *
 * @param sceneNumber       scene number as ASCII digits
 * @param header            INT/EXT, DAY/NIGHT and location
 * @param sceneType         dramatic classification
 * @param synopsis          one-sentence summary, at most 250 characters
 * @param cast              canonical cast names, no duplicates
 * @param castProfiles      profile per cast name
 * @param props             props, set dressing and vehicles
 * @param wardrobe          one spec per cast member
 * @param makeup            make-up notes
 * @param extras            background performer requirement
 * @param effects           special effects, visual effects and sound
 * @param legalAlerts       clearance issues
 * @param continuityNotes   notes linking this scene to earlier ones
 * @param cinematicNote     production and camera suggestion
 * @param cameraLighting    camera/lighting line for the sheet
 * @param continuation      true if this scene continues an earlier one
 * @param previousSceneRef  the scene it continues, when {@code continuation} is true
 * @param analyzerWarnings  analyzers whose output was defaulted, with the reason
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Breakdown(
        @JsonProperty("scene_number")       String sceneNumber,
        @JsonProperty("header")             SceneHeader header,
        @JsonProperty("scene_type")         SceneType sceneType,
        @JsonProperty("synopsis")           String synopsis,
        @JsonProperty("cast")               List<String> cast,
        @JsonProperty("cast_profiles")      Map<String, CharacterProfile> castProfiles,
        @JsonProperty("props")              PropInventory props,
        @JsonProperty("wardrobe")           List<WardrobeSpec> wardrobe,
        @JsonProperty("makeup")             List<String> makeup,
        @JsonProperty("extras")             String extras,
        @JsonProperty("effects")            EffectsReport effects,
        @JsonProperty("legal_alerts")       List<LegalAlert> legalAlerts,
        @JsonProperty("continuity_notes")   List<String> continuityNotes,
        @JsonProperty("cinematic_note")     CinematicNote cinematicNote,
        @JsonProperty("camera_lighting")    String cameraLighting,
        @JsonProperty("is_continuation")    boolean continuation,
        @JsonProperty("previous_scene_ref") String previousSceneRef,
        @JsonProperty("analyzer_warnings")  List<String> analyzerWarnings
) implements Serializable {

    public Breakdown {
        Objects.requireNonNull(sceneNumber, "sceneNumber");
        header = header == null ? SceneHeader.defaults() : header;
        sceneType = sceneType == null ? SceneType.TRANSITIONAL : sceneType;
        synopsis = synopsis == null ? "" : synopsis;
        cast = cast == null ? List.of() : List.copyOf(cast);
        castProfiles = castProfiles == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(castProfiles));
        props = props == null ? PropInventory.empty() : props;
        wardrobe = wardrobe == null ? List.of() : List.copyOf(wardrobe);
        makeup = makeup == null ? List.of() : List.copyOf(makeup);
        extras = extras == null ? CastResult.NO_EXTRAS : extras;
        effects = effects == null ? EffectsReport.empty() : effects;
        legalAlerts = legalAlerts == null ? List.of() : List.copyOf(legalAlerts);
        continuityNotes = continuityNotes == null ? List.of() : List.copyOf(continuityNotes);
        cinematicNote = cinematicNote == null ? CinematicNote.continuityReview() : cinematicNote;
        cameraLighting = cameraLighting == null ? "" : cameraLighting;
        analyzerWarnings = analyzerWarnings == null ? List.of() : List.copyOf(analyzerWarnings);
    }
}
