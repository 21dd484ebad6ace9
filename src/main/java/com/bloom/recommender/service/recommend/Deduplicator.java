package com.bloom.recommender.service.recommend;

import com.bloom.recommender.model.CandidateItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses candidates that share a canonical id.
 *
 * <p>Of two colliding candidates the one with the higher preliminary score wins outright (no
 * field merging). On equal scores, or when neither carries one, the earlier candidate wins,
 * which is the source registration order. A scored candidate beats an unscored duplicate.
 * Candidates without a canonical id are dropped and counted. Output keeps first-seen order,
 * so running the deduplicator on its own output is a no-op.
 */
@Component
public class Deduplicator {
    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    public List<CandidateItem> dedupe(List<CandidateItem> candidates) {
        Map<String, CandidateItem> byId = new LinkedHashMap<>();
        int malformed = 0;
        int collisions = 0;
        for (CandidateItem c : candidates) {
            if (c == null || c.getCanonicalId() == null) {
                malformed++;
                continue;
            }
            CandidateItem existing = byId.get(c.getCanonicalId());
            if (existing == null) {
                byId.put(c.getCanonicalId(), c);
            } else {
                collisions++;
                if (beats(c, existing)) byId.put(c.getCanonicalId(), c);
            }
        }
        if (malformed > 0) {
            log.warn("Dropped {} candidates without a canonical id", malformed);
        }
        log.debug("Deduplicated {} candidates into {} ({} collisions)", candidates.size(), byId.size(), collisions);
        return new ArrayList<>(byId.values());
    }

    private static boolean beats(CandidateItem challenger, CandidateItem incumbent) {
        Double a = challenger.getRawScore();
        Double b = incumbent.getRawScore();
        if (a == null) return false;
        if (b == null) return true;
        return a > b;
    }
}
