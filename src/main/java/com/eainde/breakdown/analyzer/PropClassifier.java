package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.model.PropCategory;
import com.eainde.breakdown.model.PropInventory;
import com.eainde.breakdown.pattern.ScriptPatterns;
import com.eainde.breakdown.pattern.TermSet;
import com.eainde.breakdown.scene.LocationType;
import com.eainde.breakdown.scene.SceneBlock;
import com.eainde.breakdown.scene.SceneHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Files every item mentioned in a scene under exactly one department.
 *
 * <h3>Precedence</h3>
 * <ol>
 *   <li>The wheelchair is ambiguous. Vehicle-usage words (push, street, speed, ...) are
 *       scored against medical words (patient, sitting, paralysed, ...). It is a
 *       vehicle only when the vehicle score is strictly higher; a tie is a prop.</li>
 *   <li>An item matching both the props and the set-dressing vocabulary is a prop.</li>
 *   <li>Otherwise the first matching category in the order vehicles, props, set dressing.</li>
 *   <li>Unmatched items are props.</li>
 * </ol>
 *
 * <p>Labels are canonicalised ({@code phone} becomes {@code mobile phone}). Items implied by
 * the location (an office has desks) are added last as set dressing.</p>
 */
@Component
public class PropClassifier implements SceneAnalyzer<PropInventory> {

    private static final Logger log = LoggerFactory.getLogger(PropClassifier.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    static final TermSet WHEELCHAIR = TermSet.of("wheel-?chairs?", "كرسي\\s+متحرك");

    static final TermSet VEHICLE_USAGE = TermSet.of(
            "push(?:es|ed|ing)?", "streets?", "roads?", "speed(?:s|ing)?", "fast", "races?", "racing", "rolls",
            "يدفع", "سرعة", "يتحرك", "طريق", "شارع");

    static final TermSet MEDICAL_USAGE = TermSet.of(
            "medical", "patients?", "sitting", "sits", "seated", "paraly[sz]ed", "disabled", "hospital",
            "طبي", "مريض", "يجلس", "مشلول", "إعاقة");

    private static final TermSet PROPS = TermSet.of(
            "envelopes?", "ظرف", "مظروف",
            "(?:mobile |cell)?phones?", "telephone", "هاتف", "موبايل", "تليفون",
            "laptops?", "computers?", "لابتوب", "حاسب", "كمبيوتر",
            "magazines?", "newspapers?", "مجلة", "مجلات", "صحيفة", "جريدة",
            "bags?", "briefcases?", "suitcases?", "حقيبة", "شنطة",
            "cups?", "mugs?", "glass", "كأس", "كوب", "فنجان",
            "keys?", "مفتاح", "مفاتيح",
            "(?:sun)?glasses", "نظارة", "نظارات",
            "watch", "clocks?", "ساعة\\s+(?:يد|حائط)",
            "photos?", "photographs?", "pictures?", "صورة", "صور",
            "guns?", "pistols?", "revolvers?", "مسدس", "سلاح",
            "cassettes?", "radio", "كاسيت", "راديو",
            "crutch(?:es)?", "عكاز", "عكازة",
            "pills", "medicine", "حبوب", "دواء",
            "documents?", "files?", "papers", "مستند", "ملف",
            "mirror", "lamp");

    private static final TermSet SET_DRESSING = TermSet.of(
            "chairs?", "كرسي(?!\\s+متحرك)",
            "tables?", "desks?", "طاولة", "منضدة",
            "mirrors?", "مرآة", "مراية",
            "beds?", "سرير",
            "wardrobes?", "closets?", "cabinets?", "خزانة", "دولاب",
            "shel(?:f|ves)", "رف", "أرفف",
            "paintings?", "لوحة", "لوحات",
            "curtains?", "ستارة", "ستائر",
            "sofas?", "couch", "كنبة",
            "lamps?", "أباجورة",
            "clocks?");

    private static final TermSet VEHICLES = TermSet.of(
            "(?<!toy\\s)cars?", "سيارة(?!\\s+لعبة)",
            "motorcycles?", "motorbikes?", "bicycles?", "bikes?", "دراجة",
            "(?:air)?planes?", "طائرة",
            "boats?", "قارب", "مركب",
            "bus(?:es)?", "حافلة", "أتوبيس",
            "taxis?", "تاكسي",
            "trucks?", "شاحنة",
            "ambulances?", "إسعاف");

    /**
     * Every candidate item, multi-word forms first so that they win at the same position.
     * Neither a Latin nor an Arabic letter may follow; the start of an Arabic match is
     * checked by {@link ScriptPatterns#startsArabicWord}.
     */
    private static final Pattern CANDIDATES = Pattern.compile(
            "(?<![\\p{IsLatin}])(?:"
                    + String.join("|", WHEELCHAIR.terms()) + "|"
                    + String.join("|", VEHICLES.terms()) + "|"
                    + String.join("|", PROPS.terms()) + "|"
                    + String.join("|", SET_DRESSING.terms())
                    + ")(?![\\p{IsLatin}])(?![\\p{IsArabic}&&\\p{L}])",
            FLAGS);

    private static final Map<String, String> CANONICAL = Map.ofEntries(
            Map.entry("phone", "mobile phone"),
            Map.entry("phones", "mobile phone"),
            Map.entry("cellphone", "mobile phone"),
            Map.entry("telephone", "mobile phone"),
            Map.entry("laptop", "laptop computer"),
            Map.entry("envelope", "postal envelope"),
            Map.entry("cars", "car"),
            Map.entry("keys", "keys"),
            Map.entry("photo", "photograph"),
            Map.entry("هاتف", "هاتف محمول"),
            Map.entry("موبايل", "هاتف محمول"),
            Map.entry("تليفون", "هاتف محمول"),
            Map.entry("لابتوب", "حاسب آلي محمول"),
            Map.entry("حاسب", "حاسب آلي محمول"),
            Map.entry("ظرف", "ظرف بريدي"));

    private static final Map<LocationType, List<String>> LOCATION_DRESSING = Map.of(
            LocationType.OFFICE, List.of("desk", "office chairs", "shelves"),
            LocationType.VILLA, List.of("upscale furniture", "luxury decor"),
            LocationType.HOME, List.of("home furniture"),
            LocationType.ROOM, List.of("home furniture"));

    private static final Map<LocationType, List<String>> LOCATION_DRESSING_AR = Map.of(
            LocationType.OFFICE, List.of("مكتب مدير", "كراسي", "أرفف"),
            LocationType.VILLA, List.of("أثاث راقٍ", "ديكور فاخر"),
            LocationType.HOME, List.of("أثاث منزلي"),
            LocationType.ROOM, List.of("أثاث منزلي"));

    private static final TermSet BEDROOM = TermSet.of("bedroom", "غرفة نوم", "نوم");

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.PROPS;
    }

    @Override
    public PropInventory analyze(SceneBlock scene, SceneContext context) {
        String text = scene.rawText();
        PropInventory.Builder inventory = PropInventory.builder();

        for (String item : candidates(text)) {
            Classification c = classify(item, text);
            if (!inventory.add(c.category(), c.label())) {
                log.debug("Scene {}: '{}' already filed, skipping {}", scene.sceneNumber(), c.label(), c.category());
            }
        }
        for (String dressing : locationDressing(context.header())) {
            inventory.add(PropCategory.SET_DRESSING, dressing);
        }
        return inventory.build();
    }

    @Override
    public PropInventory fallback(SceneBlock scene, SceneContext context) {
        return PropInventory.empty();
    }

    /**
     * Items mentioned in the text, as written, in order of first appearance.
     */
    public List<String> candidates(String text) {
        String source = text == null ? "" : text;
        List<String> found = new ArrayList<>();
        Matcher m = CANDIDATES.matcher(source);
        int from = 0;
        while (from < source.length() && m.find(from)) {
            if (!ScriptPatterns.isLatin(m.group()) && !ScriptPatterns.startsArabicWord(source, m.start())) {
                from = m.start() + 1;
                continue;
            }
            from = m.end();
            String item = ScriptPatterns.collapseWhitespace(m.group());
            if (ScriptPatterns.isLatin(item)) item = item.toLowerCase(Locale.ROOT);
            if (!found.contains(item)) found.add(item);
        }
        return found;
    }

    /**
     * @param item    the item as written
     * @param context the text around it, normally the whole scene
     * @return the single category and the canonical label
     */
    public Classification classify(String item, String context) {
        if (WHEELCHAIR.matchesToken(item)) {
            return classifyWheelchair(item, context);
        }

        boolean prop = PROPS.matchesToken(item);
        boolean dressing = SET_DRESSING.matchesToken(item);
        boolean vehicle = VEHICLES.matchesToken(item);

        PropCategory category;
        if (prop && dressing) {
            category = PropCategory.PROPS;
        } else if (vehicle) {
            category = PropCategory.VEHICLES;
        } else if (prop) {
            category = PropCategory.PROPS;
        } else if (dressing) {
            category = PropCategory.SET_DRESSING;
        } else {
            category = PropCategory.PROPS;
        }
        return new Classification(category, canonical(item));
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private Classification classifyWheelchair(String item, String context) {
        int vehicleScore = VEHICLE_USAGE.countIn(context);
        int medicalScore = MEDICAL_USAGE.countIn(context);
        boolean arabic = !ScriptPatterns.isLatin(item);

        if (vehicleScore > medicalScore) {
            return new Classification(PropCategory.VEHICLES, arabic ? "كرسي متحرك" : "wheelchair");
        }
        return new Classification(PropCategory.PROPS, arabic ? "كرسي متحرك طبي" : "medical wheelchair");
    }

    private static String canonical(String item) {
        return CANONICAL.getOrDefault(item.toLowerCase(Locale.ROOT), item);
    }

    private static List<String> locationDressing(SceneHeader header) {
        if (!header.hasLocation()) return List.of();
        String location = header.location();
        LocationType type = header.locationType();
        boolean arabic = ScriptPatterns.isMostlyArabic(location);

        if ((type == LocationType.HOME || type == LocationType.ROOM) && BEDROOM.foundIn(location)) {
            return arabic ? List.of("سرير", "خزانة", "إضاءة جانبية") : List.of("bed", "wardrobe", "bedside lamp");
        }
        Map<LocationType, List<String>> table = arabic ? LOCATION_DRESSING_AR : LOCATION_DRESSING;
        return table.getOrDefault(type, List.of());
    }

    /**
     * @param category the single department the item is filed under
     * @param label    canonical label
     */
    public record Classification(PropCategory category, String label) {
    }
}
