package com.eainde.breakdown.knowledge;

import com.eainde.breakdown.exception.KnowledgeBaseException;
import com.eainde.breakdown.model.CharacterProfile;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a {@link KnowledgeBase} from JSON.
 *
 * <pre>
 * {
 *   "characters":  [ { "canonical_name": "...", "aliases": [ ... ], "profession": "...", ... } ],
 *   "celebrities": [ ... ],
 *   "brands":      [ ... ],
 *   "songs":       [ ... ]
 * }
 * </pre>
 */
public class KnowledgeBaseLoader {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseLoader.class);

    private final ObjectMapper objectMapper;

    public KnowledgeBaseLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public KnowledgeBase load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            KnowledgeBase kb = load(in);
            log.info("Loaded knowledge base from {}: {} characters, {} celebrities, {} brands, {} songs",
                    resource.getDescription(), kb.characters().size(), kb.celebrities().size(),
                    kb.brands().size(), kb.songs().size());
            return kb;
        } catch (IOException e) {
            throw new KnowledgeBaseException("Cannot read knowledge base " + resource.getDescription(), e);
        }
    }

    public KnowledgeBase load(InputStream in) {
        try {
            Document doc = objectMapper.readValue(in, Document.class);
            return new KnowledgeBase(
                    doc.characters() == null ? List.of() : doc.characters(),
                    asSet(doc.celebrities()),
                    asSet(doc.brands()),
                    asSet(doc.songs()));
        } catch (IOException e) {
            throw new KnowledgeBaseException("Malformed knowledge base JSON", e);
        }
    }

    private static Set<String> asSet(List<String> values) {
        return values == null ? Set.of() : new LinkedHashSet<>(values);
    }

    /**
     * On-disk shape of the knowledge base.
     */
    record Document(
            @JsonProperty("characters")  List<CharacterProfile> characters,
            @JsonProperty("celebrities") List<String> celebrities,
            @JsonProperty("brands")      List<String> brands,
            @JsonProperty("songs")       List<String> songs
    ) {}
}
