package com.eainde.breakdown.scene;

import com.eainde.breakdown.exception.NoScenesFoundException;
import com.eainde.breakdown.pattern.ScriptPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Splits a screenplay into {@link SceneBlock}s on scene-marker lines.
 *
 * <p>Text before the first marker (title page, cast list) is discarded. Blocks are
 * returned in ascending numeric scene order, regardless of where they appear in the
 * document; blocks sharing a number keep their document order.</p>
 */
@Component
public class SceneSplitter {

    private static final Logger log = LoggerFactory.getLogger(SceneSplitter.class);

    /**
     * @param document the full document text
     * @return scene blocks sorted by scene number, never empty
     * @throws NoScenesFoundException if the document contains no scene marker
     */
    public List<SceneBlock> split(String document) {
        String text = document == null ? "" : document;
        Matcher m = ScriptPatterns.SCENE_MARKER.matcher(text);

        List<Integer> starts = new ArrayList<>();
        List<String> numbers = new ArrayList<>();
        while (m.find()) {
            starts.add(m.start());
            // no upper bound; Arabic-Indic digits come out as ASCII
            numbers.add(new BigInteger(m.group(1)).toString());
        }

        if (starts.isEmpty()) {
            throw new NoScenesFoundException(text.length());
        }

        List<SceneBlock> blocks = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : text.length();
            blocks.add(new SceneBlock(numbers.get(i), text.substring(starts.get(i), end).strip()));
        }

        // List.sort is stable, so duplicate numbers keep document order
        blocks.sort(Comparator.comparing(SceneBlock::ordinal));

        if (starts.get(0) > 0 && !text.substring(0, starts.get(0)).isBlank()) {
            log.debug("Discarded {} characters before the first scene marker", starts.get(0));
        }
        log.info("Split document into {} scenes", blocks.size());
        return blocks;
    }
}
