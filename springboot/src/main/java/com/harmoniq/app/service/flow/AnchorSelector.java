package com.harmoniq.app.service.flow;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.AnchorSet;
import com.harmoniq.app.dto.flow.HistoryEntry;
import com.harmoniq.app.dto.flow.Track;
import com.harmoniq.app.dto.flow.VibeCriteria;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks the tracks the flow is built around: unheard-lately discoveries from the candidates
 * ("vibe" anchors) and well-liked tracks from recent history ("familiar" anchors).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnchorSelector {

    private final RefinementFilter refinementFilter;

    public AnchorSet select(List<Track> candidates, List<HistoryEntry> history, VibeCriteria vibe,
                            FlowProperties settings, LocalDateTime now, Random random) {
        FlowProperties.Anchors anchors = settings.getAnchors();

        List<Track> qualifying = qualifyingHistory(history, anchors, settings.getRefinement(), now);
        Set<String> qualifyingIds = qualifying.stream().map(Track::getId).collect(Collectors.toSet());

        List<Track> discovery = candidates.stream()
                .filter(t -> !qualifyingIds.contains(t.getId()))
                .collect(Collectors.toList());
        List<Track> vibeAnchors = sample(discovery, anchors.getVibeAnchorCount(), random);
        Set<String> vibeIds = vibeAnchors.stream().map(Track::getId).collect(Collectors.toSet());

        List<Track> familiarPool = new ArrayList<>(qualifying);
        Collections.shuffle(familiarPool, random);
        familiarPool.sort(Comparator.comparingInt((Track t) -> vibe.overlap(t)).reversed());
        List<Track> familiarAnchors = familiarPool.stream()
                .filter(t -> !vibeIds.contains(t.getId()))
                .limit(Math.max(0, anchors.getTargetHistoryCount()))
                .collect(Collectors.toList());

        AnchorSet anchorSet = new AnchorSet(vibeAnchors, familiarAnchors,
                anchors.getVibeAnchorCount(), anchors.getTargetHistoryCount());

        log.info("Anchors: {}/{} vibe, {}/{} familiar ({} candidates, {} qualifying history tracks)",
                vibeAnchors.size(), anchors.getVibeAnchorCount(),
                familiarAnchors.size(), anchors.getTargetHistoryCount(),
                candidates.size(), qualifying.size());
        if (anchorSet.isUnderFilled()) {
            log.warn("Anchor targets not met, flow will be shorter or lean on sonic expansion");
        }
        return anchorSet;
    }

    /**
     * Distinct tracks from recent history, most recently played first, that were played often enough,
     * rated well enough, and not so recently that the recency filter excludes them.
     */
    List<Track> qualifyingHistory(List<HistoryEntry> history, FlowProperties.Anchors anchors,
                                  FlowProperties.Refinement refinement, LocalDateTime now) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        LocalDateTime windowStart = now.minusDays(anchors.getHistoryLookbackDays());

        List<HistoryEntry> recent = history.stream()
                .filter(e -> e != null && e.getTrack() != null && e.getPlayedAt() != null)
                .filter(e -> !e.getPlayedAt().isBefore(windowStart) && !e.getPlayedAt().isAfter(now))
                .sorted(Comparator.comparing(HistoryEntry::getPlayedAt).reversed())
                .collect(Collectors.toList());

        Map<String, Integer> playsInWindow = new HashMap<>();
        Map<String, HistoryEntry> latest = new LinkedHashMap<>();
        for (HistoryEntry entry : recent) {
            String id = entry.getTrack().getId();
            playsInWindow.merge(id, 1, Integer::sum);
            latest.putIfAbsent(id, entry);
        }

        List<Track> qualifying = new ArrayList<>();
        for (HistoryEntry entry : latest.values()) {
            Track track = entry.getTrack();
            int plays = Math.max(track.getPlayCount(), playsInWindow.get(track.getId()));
            double rating = entry.getRating() != null ? entry.getRating()
                    : track.getRating() != null ? track.getRating() : 0.0;
            if (plays < anchors.getHistoryMinPlays()) {
                log.debug("History track {} has {} plays, below {}", track.getId(), plays, anchors.getHistoryMinPlays());
                continue;
            }
            if (rating < anchors.getHistoryMinRating()) {
                log.debug("History track {} rated {}, below {}", track.getId(), rating, anchors.getHistoryMinRating());
                continue;
            }
            LocalDateTime lastPlayed = track.getLastPlayedAt() != null && track.getLastPlayedAt().isAfter(entry.getPlayedAt())
                    ? track.getLastPlayedAt() : entry.getPlayedAt();
            if (!refinementFilter.passesRecency(lastPlayed, refinement, now)) {
                log.debug("History track {} last played {}, too recent", track.getId(), lastPlayed);
                continue;
            }
            qualifying.add(track);
        }
        return qualifying;
    }

    /**
     * Uniform sample without replacement, in draw order.
     */
    static List<Track> sample(List<Track> pool, int size, Random random) {
        int count = Math.min(Math.max(0, size), pool.size());
        List<Track> working = new ArrayList<>(pool);
        List<Track> drawn = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int pick = i + random.nextInt(working.size() - i);
            Collections.swap(working, i, pick);
            drawn.add(working.get(i));
        }
        return drawn;
    }
}
