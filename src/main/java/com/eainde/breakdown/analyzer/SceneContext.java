package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.knowledge.ProfileRegistry;
import com.eainde.breakdown.model.CastResult;
import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.scene.SceneType;

import java.util.List;

/**
 * What analyzers may know about a scene besides its text.
 *
 * @param header   parsed header from the extraction pass
 * @param sceneType scene classification from the extraction pass
 * @param rawCast  names as written in the script, before canonicalisation
 * @param profiles the run's character profiles
 * @param cast     the cast analyzer's result; null until the cast analyzer has run
 */
public record SceneContext(
        SceneHeader header,
        SceneType sceneType,
        List<String> rawCast,
        ProfileRegistry profiles,
        CastResult cast
) {

    public SceneContext {
        header = header == null ? SceneHeader.defaults() : header;
        sceneType = sceneType == null ? SceneType.TRANSITIONAL : sceneType;
        rawCast = rawCast == null ? List.of() : List.copyOf(rawCast);
    }

    public static SceneContext of(SceneHeader header, SceneType sceneType, List<String> rawCast,
                                  ProfileRegistry profiles) {
        return new SceneContext(header, sceneType, rawCast, profiles, null);
    }

    public SceneContext withCast(CastResult castResult) {
        return new SceneContext(header, sceneType, rawCast, profiles, castResult);
    }

    public boolean hasCast() {
        return cast != null;
    }
}
