package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.exception.AnalyzerException;
import com.eainde.breakdown.model.CastResult;
import com.eainde.breakdown.model.CharacterProfile;
import com.eainde.breakdown.model.WardrobeResult;
import com.eainde.breakdown.model.WardrobeSpec;
import com.eainde.breakdown.pattern.TermSet;
import com.eainde.breakdown.scene.LocationType;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneHeader;
import com.eainde.breakdown.scene.TimeOfDay;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Infers a costume for every cast member of a scene, plus make-up notes.
 *
 * <p>Five rule families are applied in a fixed order and every match is kept:</p>
 * <ol>
 *   <li>descriptor words in the scene text ("stern", "وقار", ...)</li>
 *   <li>time of day and location type</li>
 *   <li>the character's profession</li>
 *   <li>upper social class in a villa</li>
 *   <li>a paralysed or ill character</li>
 * </ol>
 * <p>An element is dropped when every concept word it carries ("formal", "luxury",
 * "homewear", ...) was already said by an earlier one; elements without a concept
 * word are always kept. The rest are joined with {@value #SEPARATOR}. Needs the
 * cast analyzer's result in the context.</p>
 */
@Component
public class WardrobeInferenceEngine implements SceneAnalyzer<WardrobeResult> {

    public static final String CONTEXT_DEPENDENT = "context-dependent";
    static final String SEPARATOR = " | ";

    private static final Map<TermSet, String> DESCRIPTORS = new LinkedHashMap<>();
    private static final Map<String, String> TIME_LOCATION = new LinkedHashMap<>();
    private static final Map<String, String> PROFESSIONS = new LinkedHashMap<>();

    static {
        DESCRIPTORS.put(TermSet.of("stern", "strict", "severe", "صرامة", "صارم"),
                "formal conservative attire (suit or tailored two-piece)");
        DESCRIPTORS.put(TermSet.of("dignified", "distinguished", "وقار"),
                "luxury formal suit");
        DESCRIPTORS.put(TermSet.of("practical", "عملية بشدة"),
                "plain practical style with minimal accessories");
        DESCRIPTORS.put(TermSet.of("handsome", "وسامة", "وسيم"),
                "smart casual shirt with a jacket");
        DESCRIPTORS.put(TermSet.of("beautiful", "elegant", "جمال", "أنيقة"),
                "elegant outfit that flatters the look");
        DESCRIPTORS.put(TermSet.of("frustrated", "frustration", "احباط", "إحباط"),
                "neat clothes worn with visible strain");
        DESCRIPTORS.put(TermSet.of("anxious", "worried", "قلق"),
                "everyday clothes, body language shows anxiety");
        DESCRIPTORS.put(TermSet.of("paraly[sz]ed", "مشلول"),
                "upscale homewear or a comfortable robe");

        TIME_LOCATION.put(key(TimeOfDay.NIGHT, LocationType.HOME), "night homewear or smart pajamas");
        TIME_LOCATION.put(key(TimeOfDay.NIGHT, LocationType.ROOM), "night homewear");
        TIME_LOCATION.put(key(TimeOfDay.DAY, LocationType.OFFICE), "formal business attire");
        TIME_LOCATION.put(key(TimeOfDay.DAY, LocationType.PRECINCT), "formal suit with sidearm");
        TIME_LOCATION.put(key(TimeOfDay.DAY, LocationType.STATION), "work clothes or smart casual");
        TIME_LOCATION.put(key(TimeOfDay.DAY, LocationType.VILLA), "upscale clothes matching social class");
        TIME_LOCATION.put(key(TimeOfDay.DAY, LocationType.STREET), "casual or semi-formal daywear");
        TIME_LOCATION.put(key(TimeOfDay.NIGHT, LocationType.STREET), "layered evening streetwear");
        TIME_LOCATION.put(key(TimeOfDay.DAY, LocationType.HOSPITAL), "plain clothes suited to a hospital visit");

        PROFESSIONS.put("state security", "dark formal suit with concealed sidearm");
        PROFESSIONS.put("detective", "plain-clothes suit with holstered sidearm");
        PROFESSIONS.put("producer", "luxury suit or upscale smart casual");
        PROFESSIONS.put("actress", "fashionable outfit styled for the scene");
        PROFESSIONS.put("religious broadcaster", "formal shirt with jacket or a conservative suit");
        PROFESSIONS.put("doctor", "white coat over business wear");
    }

    private static final Set<String> CONCEPTS = Set.of(
            "formal", "luxury", "homewear", "pajamas", "casual", "suit", "sidearm", "streetwear");

    private static final TermSet ILL = TermSet.of("paraly[sz]ed", "ill", "sick", "مشلول", "مريض");
    private static final TermSet INJURY = TermSet.of(
            "blood(?:y)?", "bleeding", "wounds?", "wounded", "bruised?", "injur(?:y|ed|ies)", "دم", "جرح", "كدمة");

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.WARDROBE;
    }

    @Override
    public WardrobeResult analyze(SceneBlock scene, SceneContext context) {
        if (!context.hasCast()) {
            throw new AnalyzerException(kind(), scene.sceneNumber(), "cast result is required before wardrobe inference");
        }
        CastResult cast = context.cast();
        String text = scene.rawText();

        List<WardrobeSpec> specs = new ArrayList<>();
        List<String> makeup = new ArrayList<>();
        for (String name : cast.cast()) {
            CharacterProfile profile = cast.profiles().getOrDefault(name, CharacterProfile.synthesized(name));
            specs.add(WardrobeSpec.inferred(name, infer(profile, text, context.header())));
            makeup.add(name + ": " + makeupFor(profile));
        }
        if (!cast.cast().isEmpty() && INJURY.foundIn(text)) {
            makeup.add("Scene: wound and injury effects required");
        }
        return new WardrobeResult(specs, makeup);
    }

    @Override
    public WardrobeResult fallback(SceneBlock scene, SceneContext context) {
        return WardrobeResult.empty();
    }

    /**
     * @param profile the character
     * @param text    the scene text
     * @param header  the scene header, for time of day and location
     * @return merged description, or {@value #CONTEXT_DEPENDENT}
     */
    public String infer(CharacterProfile profile, String text, SceneHeader header) {
        List<String> elements = new ArrayList<>();

        DESCRIPTORS.forEach((terms, clothing) -> {
            if (terms.foundIn(text)) elements.add(clothing);
        });

        LocationType locationType = header.locationType();
        String timeLocation = TIME_LOCATION.get(key(header.timeOfDay(), locationType));
        if (timeLocation != null) elements.add(timeLocation);

        if (profile.profession() != null) {
            String profession = profile.profession().toLowerCase(Locale.ROOT);
            PROFESSIONS.entrySet().stream()
                    .filter(e -> profession.contains(e.getKey()))
                    .findFirst()
                    .ifPresent(e -> elements.add(e.getValue()));
        }

        if ("upper".equalsIgnoreCase(profile.socialClass()) && locationType == LocationType.VILLA) {
            elements.add("luxury high-end clothing");
        }

        if (profile.psychologicalState() != null && ILL.foundIn(profile.psychologicalState())) {
            elements.add("upscale homewear (robe or luxury pajamas)");
        }

        return elements.isEmpty() ? CONTEXT_DEPENDENT : merge(elements);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private static String merge(List<String> elements) {
        List<String> unique = new ArrayList<>();
        Set<String> said = new HashSet<>();
        for (String element : elements) {
            Set<String> concepts = conceptsOf(element);
            if (concepts.isEmpty() || !said.containsAll(concepts)) {
                unique.add(element);
                said.addAll(concepts);
            }
        }
        return String.join(SEPARATOR, unique);
    }

    private static Set<String> conceptsOf(String element) {
        Set<String> found = new HashSet<>();
        for (String word : element.toLowerCase(Locale.ROOT).split("[^\\p{L}]+")) {
            if (CONCEPTS.contains(word)) found.add(word);
        }
        return found;
    }

    private static String makeupFor(CharacterProfile profile) {
        if (profile.psychologicalState() != null && ILL.foundIn(profile.psychologicalState())) {
            return "pale, tired complexion";
        }
        return "standard camera-ready correction";
    }

    private static String key(TimeOfDay time, LocationType location) {
        return time + "/" + location;
    }
}
