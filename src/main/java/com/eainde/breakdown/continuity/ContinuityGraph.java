package com.eainde.breakdown.continuity;

import com.eainde.breakdown.model.Breakdown;
import com.eainde.breakdown.model.WardrobeSpec;
import com.eainde.breakdown.pattern.ScriptPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Cross-scene memory of one run: where each character has been, which scenes each item
 * appeared in and which scenes were shot at each location.
 *
 * <p>Append-only. Scenes are registered once, in document order, after their refinement.
 * All reads and writes go through a single lock, so the graph can be shared between
 * threads, though the pipeline only touches it from the sequential refinement pass.</p>
 */
public class ContinuityGraph {

    private static final Logger log = LoggerFactory.getLogger(ContinuityGraph.class);

    /** How far back each character's timeline is searched for a continuation. */
    static final int CONTINUATION_WINDOW = 3;

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, List<TimelineEntry>> characterTimeline = new LinkedHashMap<>();
    private final Map<String, List<String>> itemRegistry = new LinkedHashMap<>();
    private final Map<String, List<String>> locationHistory = new LinkedHashMap<>();
    private final Set<String> registered = new HashSet<>();
    private int sequence;

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Records a refined scene.
     *
     * @throws IllegalStateException if the scene was already registered
     */
    public void register(Breakdown breakdown) {
        lock.lock();
        try {
            if (!registered.add(breakdown.sceneNumber())) {
                throw new IllegalStateException("Scene " + breakdown.sceneNumber() + " is already registered");
            }
            int seq = sequence++;
            String location = breakdown.header().location();

            for (String character : breakdown.cast()) {
                String wardrobe = breakdown.wardrobe().stream()
                        .filter(w -> character.equals(w.character()))
                        .map(WardrobeSpec::description)
                        .findFirst()
                        .orElse(null);
                characterTimeline.computeIfAbsent(character, k -> new ArrayList<>())
                        .add(new TimelineEntry(breakdown.sceneNumber(), seq, location, breakdown.header().timeOfDay(), wardrobe));
            }
            for (String item : breakdown.props().allItems()) {
                itemRegistry.computeIfAbsent(item, k -> new ArrayList<>()).add(breakdown.sceneNumber());
            }
            locationHistory.computeIfAbsent(location, k -> new ArrayList<>()).add(breakdown.sceneNumber());
            log.debug("Registered scene {} (cast {}, {} items)",
                    breakdown.sceneNumber(), breakdown.cast().size(), breakdown.props().allItems().size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finds the most recent earlier scene this one continues: same location, same time
     * of day and at least one shared cast member. Only the last
     * {@value #CONTINUATION_WINDOW} appearances of each cast member are considered.
     *
     * @return the earlier scene number, or empty
     */
    public Optional<String> detectContinuation(Breakdown breakdown) {
        String location = locationKey(breakdown.header().location());
        lock.lock();
        try {
            List<TimelineEntry> recent = new ArrayList<>();
            for (String character : breakdown.cast()) {
                List<TimelineEntry> timeline = characterTimeline.getOrDefault(character, List.of());
                recent.addAll(timeline.subList(Math.max(0, timeline.size() - CONTINUATION_WINDOW), timeline.size()));
            }
            return recent.stream()
                    .sorted(Comparator.comparingInt(TimelineEntry::sequence).reversed())
                    .filter(e -> !e.sceneNumber().equals(breakdown.sceneNumber()))
                    .filter(e -> locationKey(e.location()).equals(location))
                    .filter(e -> e.timeOfDay() == breakdown.header().timeOfDay())
                    .map(TimelineEntry::sceneNumber)
                    .findFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * One note per item already seen in earlier scenes, then one note naming the cast
     * members whose previous appearance was at this location.
     */
    public List<String> continuityNotes(Breakdown breakdown) {
        String location = locationKey(breakdown.header().location());
        List<String> notes = new ArrayList<>();
        lock.lock();
        try {
            for (String item : breakdown.props().allItems()) {
                List<String> scenes = itemRegistry.getOrDefault(item, List.of());
                if (!scenes.isEmpty()) {
                    notes.add("Continuity: match " + item + " with its appearance in scenes " + String.join(", ", scenes));
                }
            }

            List<String> returning = breakdown.cast().stream()
                    .filter(c -> lastAppearance(c).map(e -> locationKey(e.location()).equals(location)).orElse(false))
                    .collect(Collectors.toList());
            if (!returning.isEmpty()) {
                notes.add("Wardrobe continuity: " + String.join(", ", returning)
                        + " last appeared at " + breakdown.header().location());
            }
        } finally {
            lock.unlock();
        }
        return notes;
    }

    /**
     * @return a note pointing the character's costume at their previous appearance, or
     *         empty when this is their first scene
     */
    public Optional<String> wardrobeNote(String character, Breakdown breakdown) {
        lock.lock();
        try {
            return lastAppearance(character).map(previous -> {
                if (breakdown.continuation() && previous.sceneNumber().equals(breakdown.previousSceneRef())) {
                    return "Continuous with scene " + previous.sceneNumber() + ": keep the same wardrobe";
                }
                String note = "Last seen in scene " + previous.sceneNumber();
                return previous.wardrobe() == null ? note : note + " wearing " + previous.wardrobe();
            });
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return scene numbers registered at the location, oldest first
     */
    public List<String> scenesAt(String location) {
        String key = locationKey(location);
        lock.lock();
        try {
            return locationHistory.entrySet().stream()
                    .filter(e -> locationKey(e.getKey()).equals(key))
                    .flatMap(e -> e.getValue().stream())
                    .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public ContinuityState snapshot() {
        lock.lock();
        try {
            return new ContinuityState(characterTimeline, itemRegistry, locationHistory);
        } finally {
            lock.unlock();
        }
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private Optional<TimelineEntry> lastAppearance(String character) {
        List<TimelineEntry> timeline = characterTimeline.get(character);
        return timeline == null || timeline.isEmpty() ? Optional.empty() : Optional.of(timeline.get(timeline.size() - 1));
    }

    private static String locationKey(String location) {
        return ScriptPatterns.collapseWhitespace(location).toLowerCase(Locale.ROOT);
    }
}
