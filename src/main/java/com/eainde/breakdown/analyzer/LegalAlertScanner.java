package com.eainde.breakdown.analyzer;

import com.eainde.breakdown.knowledge.KnowledgeBase;
import com.eainde.breakdown.model.LegalAlert;
import com.eainde.breakdown.model.LegalAlert.AlertType;
import com.eainde.breakdown.model.LegalAlert.Severity;
import com.eainde.breakdown.pattern.TermSet;
import com.eainde.breakdown.scene.SceneBlock;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Flags celebrities, brands and songs named in a scene.
 *
 * <p>A song title is {@code critical}; everything else is a {@code warning}. When the
 * scene talks about music but names no known song, a single generic music warning is
 * raised so that the clearance question is still asked.</p>
 */
@Component
public class LegalAlertScanner implements SceneAnalyzer<List<LegalAlert>> {

    static final String GENERIC_MUSIC = "musical content";

    private static final TermSet MUSIC_WORDS = TermSet.of(
            "sings", "singing", "songs?", "soundtrack", "music", "cassette",
            "يغني", "أغنية", "اغنية", "موسيقى", "كاسيت");

    private final List<Entry> entries;

    public LegalAlertScanner(KnowledgeBase knowledgeBase) {
        List<Entry> all = new ArrayList<>();
        add(all, knowledgeBase.celebrities(), AlertType.CELEBRITY, Severity.WARNING,
                "Mention of \"%s\" requires legal review");
        add(all, knowledgeBase.brands(), AlertType.BRAND, Severity.WARNING,
                "Brand \"%s\" appears; clear usage rights");
        add(all, knowledgeBase.songs(), AlertType.MUSIC, Severity.CRITICAL,
                "Song \"%s\" is played; obtain performance rights");
        this.entries = List.copyOf(all);
    }

    @Override
    public AnalyzerKind kind() {
        return AnalyzerKind.LEGAL;
    }

    @Override
    public List<LegalAlert> analyze(SceneBlock scene, SceneContext context) {
        return scan(scene.rawText());
    }

    @Override
    public List<LegalAlert> fallback(SceneBlock scene, SceneContext context) {
        return List.of();
    }

    /**
     * @param text any scene text
     * @return alerts in the order celebrities, brands, songs, generic music
     */
    public List<LegalAlert> scan(String text) {
        List<LegalAlert> alerts = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.pattern().matcher(text).find()) {
                alerts.add(new LegalAlert(entry.type(), entry.name(),
                        String.format(entry.template(), entry.name()), entry.severity()));
            }
        }
        boolean musicAlerted = alerts.stream().anyMatch(a -> a.alertType() == AlertType.MUSIC);
        if (!musicAlerted && MUSIC_WORDS.foundIn(text)) {
            alerts.add(new LegalAlert(AlertType.MUSIC, GENERIC_MUSIC,
                    "Musical content; confirm performance rights", Severity.WARNING));
        }
        return alerts;
    }

    private static void add(List<Entry> entries, Set<String> names, AlertType type,
                            Severity severity, String template) {
        for (String name : names) {
            Pattern pattern = Pattern.compile(
                    "(?<![\\p{IsLatin}\\d])" + Pattern.quote(name) + "(?![\\p{IsLatin}\\d])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            entries.add(new Entry(name, type, severity, template, pattern));
        }
    }

    private record Entry(String name, AlertType type, Severity severity, String template, Pattern pattern) {
    }
}
