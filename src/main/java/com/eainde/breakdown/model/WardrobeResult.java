package com.eainde.breakdown.model;

import java.io.Serializable;
import java.util.List;

/**
 * Costume and make-up requirements of one scene.
 *
 * @param specs  one wardrobe spec per cast member, in cast order
 * @param makeup make-up notes, one per cast member plus scene-level notes
 */
public record WardrobeResult(List<WardrobeSpec> specs, List<String> makeup) implements Serializable {

    public WardrobeResult {
        specs = specs == null ? List.of() : List.copyOf(specs);
        makeup = makeup == null ? List.of() : List.copyOf(makeup);
    }

    public static WardrobeResult empty() {
        return new WardrobeResult(List.of(), List.of());
    }
}
