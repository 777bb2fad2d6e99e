package com.harmoniq.app.service.flow;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.HistoryEntry;
import com.harmoniq.app.dto.flow.Track;
import com.harmoniq.app.dto.flow.VibeCriteria;
import com.harmoniq.app.dto.flow.VibeProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Learns the listener's current taste from recent plays: the most frequent mood and style tags.
 */
@Component
@Slf4j
public class VibeLearner {

    public VibeProfile learn(List<HistoryEntry> history, LocalDateTime now, FlowProperties.Vibe settings) {
        if (CollectionUtils.isEmpty(history)) {
            log.info("No listening history available, vibe stays on the period defaults");
            return VibeProfile.EMPTY;
        }

        LocalDateTime windowStart = now.minusDays(settings.getLookbackDays());
        Map<String, TagTally> moods = new LinkedHashMap<>();
        Map<String, TagTally> styles = new LinkedHashMap<>();
        Set<String> countedTracks = new HashSet<>();
        int plays = 0;

        for (HistoryEntry entry : history) {
            if (entry == null || entry.getTrack() == null || entry.getPlayedAt() == null) {
                continue;
            }
            LocalDateTime playedAt = entry.getPlayedAt();
            if (playedAt.isBefore(windowStart) || playedAt.isAfter(now)) {
                continue;
            }
            plays++;
            Track track = entry.getTrack();
            // Per-track counting still lets later plays refresh the tie-break timestamp.
            boolean counts = settings.isCountPerPlay() || countedTracks.add(track.getId());
            tally(moods, track.getMoods(), playedAt, counts);
            tally(styles, track.getStyles(), playedAt, counts);
        }

        List<String> topMoods = top(moods, settings.getMinOccurrences(), settings.getTopNMoods());
        List<String> topStyles = top(styles, settings.getMinOccurrences(), settings.getTopMStyles());

        log.info("Learned vibe from {} plays in the last {} days: moods={}, styles={}",
                plays, settings.getLookbackDays(), topMoods, topStyles);
        if (topMoods.isEmpty() && topStyles.isEmpty()) {
            log.debug("No tag reached {} occurrences", settings.getMinOccurrences());
            return VibeProfile.EMPTY;
        }
        return VibeProfile.builder().moods(topMoods).styles(topStyles).build();
    }

    private void tally(Map<String, TagTally> tallies, Collection<String> tags, LocalDateTime playedAt, boolean counts) {
        if (tags == null) {
            return;
        }
        Set<String> seenOnTrack = new HashSet<>();
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                continue;
            }
            String key = VibeCriteria.normalize(tag);
            if (!seenOnTrack.add(key)) {
                continue;
            }
            TagTally tally = tallies.computeIfAbsent(key, k -> new TagTally(tag.trim()));
            if (counts) {
                tally.count++;
            }
            if (tally.lastSeen == null || playedAt.isAfter(tally.lastSeen)) {
                tally.lastSeen = playedAt;
            }
        }
    }

    private List<String> top(Map<String, TagTally> tallies, int minOccurrences, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return tallies.values().stream()
                .filter(t -> t.count >= minOccurrences)
                .sorted(Comparator.comparingInt((TagTally t) -> t.count).reversed()
                        .thenComparing((TagTally t) -> t.lastSeen, Comparator.reverseOrder())
                        .thenComparing(t -> t.display, String.CASE_INSENSITIVE_ORDER))
                .limit(limit)
                .map(t -> t.display)
                .collect(Collectors.toList());
    }

    private static final class TagTally {
        private final String display;
        private int count;
        private LocalDateTime lastSeen;

        private TagTally(String display) {
            this.display = display;
        }
    }
}
