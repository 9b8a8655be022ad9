package com.eainde.breakdown.knowledge;

import com.eainde.breakdown.model.CharacterProfile;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Character profiles of one pipeline run. Resolving the same character twice,
 * under any alias, returns the same instance.
 */
public class ProfileRegistry {

    private final KnowledgeBase knowledgeBase;
    private final Map<String, CharacterProfile> byCanonicalName = new ConcurrentHashMap<>();

    public ProfileRegistry(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    /**
     * @param name a name as written in the script
     * @return the run's profile for that character; unknown names get a synthesised profile
     *         whose canonical name is the name itself
     */
    public CharacterProfile resolve(String name) {
        CharacterProfile candidate = knowledgeBase.findByAlias(name)
                .orElseGet(() -> CharacterProfile.synthesized(name.strip()));
        return byCanonicalName.computeIfAbsent(candidate.canonicalName(), k -> candidate);
    }

    public int size() {
        return byCanonicalName.size();
    }
}
