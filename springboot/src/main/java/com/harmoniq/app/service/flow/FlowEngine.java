package com.harmoniq.app.service.flow;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.AnchorSet;
import com.harmoniq.app.dto.flow.FlowResult;
import com.harmoniq.app.dto.flow.HistoryEntry;
import com.harmoniq.app.dto.flow.Period;
import com.harmoniq.app.dto.flow.SonicExpansion;
import com.harmoniq.app.dto.flow.Track;
import com.harmoniq.app.dto.flow.TrackSource;
import com.harmoniq.app.dto.flow.VibeCriteria;
import com.harmoniq.app.dto.flow.VibeProfile;
import com.harmoniq.app.service.LibraryCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Builds one flow playlist: period, vibe, candidates, anchors, sonic expansion or bridging, ordering.
 * Reads no clock and keeps no state between calls; all randomness comes from the supplied {@link Random}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowEngine {

    private final LibraryCatalog libraryCatalog;
    private final PeriodResolver periodResolver;
    private final VibeLearner vibeLearner;
    private final VibeSynthesizer vibeSynthesizer;
    private final CandidateSelector candidateSelector;
    private final AnchorSelector anchorSelector;
    private final SonicExpander sonicExpander;
    private final SonicBridger sonicBridger;
    private final SonicSorter sonicSorter;
    private final PlaylistAssembler playlistAssembler;

    public FlowResult generateFlow(LocalDateTime now, FlowProperties config, Random random) {
        Period period = periodResolver.resolve(now, config.getPeriods());
        log.info("Generating flow for period '{}' at {}", period.getName(), now);

        int historyDays = Math.max(config.getVibe().getLookbackDays(), config.getAnchors().getHistoryLookbackDays());
        List<HistoryEntry> history = libraryCatalog.trackHistory(historyDays);
        if (history == null) {
            history = List.of();
        }
        if (history.isEmpty()) {
            log.warn("No listening history in the last {} days", historyDays);
        }

        VibeProfile learned = vibeLearner.learn(history, now, config.getVibe());
        VibeCriteria vibe = vibeSynthesizer.synthesize(period, learned);

        List<Track> candidates = candidateSelector.select(vibe, config.getRefinement(), now);
        AnchorSet anchors = anchorSelector.select(candidates, history, vibe, config, now, random);

        SonicDistance distance = new SonicDistance(libraryCatalog);
        FlowProperties.Sonic sonic = config.getSonic();
        SonicExpansion expansion = sonicExpander.expand(anchors, candidates, config.getTargetSize(), sonic, distance);

        Map<String, TrackSource> sources = new HashMap<>();
        anchors.getVibeAnchors().forEach(t -> sources.put(t.getId(), TrackSource.VIBE_ANCHOR));
        anchors.getFamiliarAnchors().forEach(t -> sources.put(t.getId(), TrackSource.FAMILIAR_ANCHOR));
        expansion.tracks().forEach(t -> sources.putIfAbsent(t.getId(), TrackSource.SONIC_EXPANSION));

        Track start = startTrack(anchors);
        List<Track> ordered;
        if (sonic.isAdventureBridging()) {
            List<Track> sortedAnchors = sonicSorter.sort(anchors.all(), start, candidates,
                    sonic.getSortSimilarityLimit(), sonic.getSortMaxDistance(), distance);
            Set<String> excluded = new HashSet<>(sources.keySet());
            List<Track> bridged = sonicBridger.bridge(sortedAnchors, candidates, excluded,
                    sonic.getMaxDistance(), distance);

            ordered = new ArrayList<>();
            for (Track track : bridged) {
                ordered.add(track);
                sources.putIfAbsent(track.getId(), TrackSource.BRIDGE);
                ordered.addAll(expansion.forSeed(track.getId()));
            }
        } else {
            List<Track> pool = new ArrayList<>(anchors.all());
            pool.addAll(expansion.tracks());
            ordered = sonicSorter.sort(pool, start, candidates,
                    sonic.getSortSimilarityLimit(), sonic.getSortMaxDistance(), distance);
        }

        FlowResult result = playlistAssembler.assemble(period.getName(), vibe, ordered, sources, config.getTargetSize());

        log.info("Flow for '{}' ready: {} tracks ({} distance lookups)",
                period.getName(), result.size(), distance.cachedPairs());
        return result;
    }

    private static Track startTrack(AnchorSet anchors) {
        if (!anchors.getVibeAnchors().isEmpty()) {
            return anchors.getVibeAnchors().get(0);
        }
        if (!anchors.getFamiliarAnchors().isEmpty()) {
            return anchors.getFamiliarAnchors().get(0);
        }
        return null;
    }
}
