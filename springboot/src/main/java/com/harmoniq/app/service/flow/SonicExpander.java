package com.harmoniq.app.service.flow;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.AnchorSet;
import com.harmoniq.app.dto.flow.SonicExpansion;
import com.harmoniq.app.dto.flow.Track;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Component
@Slf4j
public class SonicExpander {

    /**
     * Adds candidates that sound like the first few anchors, up to the share of the playlist
     * reserved for expansion and never past the target size.
     */
    public SonicExpansion expand(AnchorSet anchors, List<Track> candidates, int targetSize,
                                 FlowProperties.Sonic sonic, SonicDistance distance) {
        if (!sonic.isExpansionEnabled()) {
            return SonicExpansion.NONE;
        }
        int budget = budget(targetSize, sonic.getFinalMixRatio(), anchors.size());
        if (budget == 0 || anchors.isEmpty() || candidates.isEmpty()) {
            log.debug("No sonic expansion (budget {}, {} anchors, {} candidates)",
                    budget, anchors.size(), candidates.size());
            return SonicExpansion.NONE;
        }

        Set<String> selected = new HashSet<>();
        anchors.all().forEach(t -> selected.add(t.getId()));

        List<Track> seeds = anchors.all().stream()
                .limit(sonic.getSeedTracks())
                .collect(Collectors.toList());

        Map<String, List<Track>> bySeed = new LinkedHashMap<>();
        int added = 0;
        for (Track seed : seeds) {
            if (added >= budget) {
                break;
            }
            int take = Math.min(sonic.getSimilarTracksPerSeed(), budget - added);
            List<Track> similar = candidates.stream()
                    .filter(t -> !selected.contains(t.getId()))
                    .filter(t -> distance.isWithin(seed, t, sonic.getMaxDistance()))
                    .sorted(Comparator.comparingDouble((Track t) -> distance.between(seed, t))
                            .thenComparing(Track::getId))
                    .limit(take)
                    .collect(Collectors.toList());
            if (similar.isEmpty()) {
                log.debug("No track within {} of seed '{}'", sonic.getMaxDistance(), seed.displayName());
                continue;
            }
            similar.forEach(t -> selected.add(t.getId()));
            bySeed.put(seed.getId(), similar);
            added += similar.size();
        }

        log.info("Sonic expansion: {} tracks from {} seeds (budget {})", added, seeds.size(), budget);
        return new SonicExpansion(bySeed);
    }

    static int budget(int targetSize, double finalMixRatio, int anchorCount) {
        int share = (int) Math.round(targetSize * finalMixRatio);
        return Math.max(0, Math.min(share, targetSize - anchorCount));
    }
}
