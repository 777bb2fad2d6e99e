package com.harmoniq.app.service.flow;

import com.harmoniq.app.dto.flow.Track;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Inserts at most one transition track between each pair of consecutive anchors.
 */
@Component
@Slf4j
public class SonicBridger {

    /**
     * @param orderedAnchors anchors in traversal order
     * @param excludedIds    ids that may not be used as bridges (anchors, expansion tracks)
     * @return the anchors with bridges inserted between them
     */
    public List<Track> bridge(List<Track> orderedAnchors, List<Track> candidates, Collection<String> excludedIds,
                              double maxDistance, SonicDistance distance) {
        if (orderedAnchors.size() < 2) {
            return new ArrayList<>(orderedAnchors);
        }
        Set<String> used = new HashSet<>(excludedIds);
        orderedAnchors.forEach(t -> used.add(t.getId()));

        List<Track> result = new ArrayList<>();
        int bridges = 0;
        for (int i = 0; i < orderedAnchors.size(); i++) {
            Track from = orderedAnchors.get(i);
            result.add(from);
            if (i == orderedAnchors.size() - 1) {
                break;
            }
            Track to = orderedAnchors.get(i + 1);
            Track bridge = findBridge(from, to, candidates, used, maxDistance, distance);
            if (bridge == null) {
                log.debug("No bridge within {} between '{}' and '{}'", maxDistance, from.displayName(), to.displayName());
                continue;
            }
            used.add(bridge.getId());
            result.add(bridge);
            bridges++;
        }

        log.info("Bridging: {} bridges across {} anchor transitions", bridges, orderedAnchors.size() - 1);
        return result;
    }

    /**
     * Unused candidate within reach of both endpoints that keeps the larger of the two hops smallest.
     * Equal hops go to the lower track id.
     */
    Track findBridge(Track from, Track to, List<Track> candidates, Set<String> used,
                     double maxDistance, SonicDistance distance) {
        Track best = null;
        double bestHop = Double.POSITIVE_INFINITY;
        for (Track candidate : candidates) {
            if (used.contains(candidate.getId())) {
                continue;
            }
            double toFrom = distance.between(from, candidate);
            if (toFrom > maxDistance) {
                continue;
            }
            double toNext = distance.between(candidate, to);
            if (toNext > maxDistance) {
                continue;
            }
            double hop = Math.max(toFrom, toNext);
            if (best == null || hop < bestHop || (hop == bestHop && candidate.getId().compareTo(best.getId()) < 0)) {
                best = candidate;
                bestHop = hop;
            }
        }
        return best;
    }
}
