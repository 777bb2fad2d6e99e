package com.harmoniq.app.service.flow;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.Track;
import com.harmoniq.app.dto.flow.VibeCriteria;
import com.harmoniq.app.service.LibraryCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

@Component
@RequiredArgsConstructor
@Slf4j
public class CandidateSelector {

    private final LibraryCatalog libraryCatalog;
    private final RefinementFilter refinementFilter;

    /**
     * Library tracks carrying at least one vibe tag and passing every active refinement filter,
     * ordered by track id.
     */
    public List<Track> select(VibeCriteria vibe, FlowProperties.Refinement refinement, LocalDateTime now) {
        if (vibe.isEmpty()) {
            log.warn("Vibe has no tags, no candidates can match");
            return List.of();
        }

        Set<Track> matched = libraryCatalog.tracksByTag(vibe.getMoods(), vibe.getStyles());
        if (matched == null || matched.isEmpty()) {
            log.warn("Library returned no tracks for vibe: {}", vibe.describe());
            return List.of();
        }

        Map<String, Track> candidates = new LinkedHashMap<>();
        int offVibe = 0;
        int rating = 0;
        int recency = 0;
        int skips = 0;
        for (Track track : matched) {
            if (track == null || track.getId() == null) {
                continue;
            }
            if (!vibe.matches(track)) {
                offVibe++;
            } else if (!refinementFilter.passesRating(track, refinement)) {
                rating++;
            } else if (!refinementFilter.passesRecency(track, refinement, now)) {
                recency++;
            } else if (!refinementFilter.passesSkips(track, refinement)) {
                skips++;
            } else {
                candidates.putIfAbsent(track.getId(), track);
            }
        }

        List<Track> result = new ArrayList<>(candidates.values());
        result.sort(Comparator.comparing(Track::getId));

        log.info("Candidates: {} of {} library matches kept (off-vibe {}, rating {}, recently played {}, skipped {})",
                result.size(), matched.stream().filter(Objects::nonNull).count(), offVibe, rating, recency, skips);
        if (result.isEmpty()) {
            log.warn("No candidates left after refinement for vibe: {}", vibe.describe());
        }
        return result;
    }
}
