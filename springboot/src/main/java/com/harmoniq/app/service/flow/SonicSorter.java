package com.harmoniq.app.service.flow;

import com.harmoniq.app.dto.flow.Track;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Greedy nearest-neighbour ordering so consecutive tracks sound alike.
 */
@Component
@Slf4j
public class SonicSorter {

    /**
     * Orders {@code tracks} starting from {@code start}. The result is always a permutation of the input.
     *
     * @param neighbourhood extra tracks considered when looking for the nearest neighbours of the
     *                      current track; only tracks from {@code tracks} are ever emitted
     * @param limit         how many nearest neighbours to look at per step
     * @param maxDistance   neighbours further than this are not considered similar
     */
    public List<Track> sort(List<Track> tracks, Track start, Collection<Track> neighbourhood,
                            int limit, double maxDistance, SonicDistance distance) {
        if (tracks.size() < 2) {
            return new ArrayList<>(tracks);
        }

        // Tracks being sorted come first so equal distances favour input order.
        Map<String, Track> pool = new LinkedHashMap<>();
        tracks.forEach(t -> pool.putIfAbsent(t.getId(), t));
        if (neighbourhood != null) {
            neighbourhood.forEach(t -> pool.putIfAbsent(t.getId(), t));
        }
        List<Track> neighbours = new ArrayList<>(pool.values());

        List<Track> remaining = new ArrayList<>(tracks);
        int startIndex = start == null ? 0 : indexOf(remaining, start.getId());
        Track current = remaining.remove(Math.max(startIndex, 0));

        List<Track> ordered = new ArrayList<>(tracks.size());
        ordered.add(current);
        int fallbacks = 0;

        while (!remaining.isEmpty()) {
            int next = nearestUnvisited(current, remaining, neighbours, limit, maxDistance, distance);
            if (next < 0) {
                next = closestRemaining(current, remaining, distance);
                fallbacks++;
            }
            current = remaining.remove(next);
            ordered.add(current);
        }

        log.debug("Sorted {} tracks from '{}' ({} steps outside the similarity threshold)",
                ordered.size(), ordered.get(0).displayName(), fallbacks);
        return ordered;
    }

    private int nearestUnvisited(Track current, List<Track> remaining, List<Track> neighbours,
                                 int limit, double maxDistance, SonicDistance distance) {
        List<Track> nearest = neighbours.stream()
                .filter(t -> !t.getId().equals(current.getId()))
                .filter(t -> distance.between(current, t) <= maxDistance)
                .sorted(Comparator.comparingDouble((Track t) -> distance.between(current, t)))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());

        Set<String> unvisited = new HashSet<>();
        remaining.forEach(t -> unvisited.add(t.getId()));
        for (Track candidate : nearest) {
            if (unvisited.contains(candidate.getId())) {
                return indexOf(remaining, candidate.getId());
            }
        }
        return -1;
    }

    /**
     * Closest remaining track ignoring the threshold, or the first remaining one when nothing is reachable.
     */
    private int closestRemaining(Track current, List<Track> remaining, SonicDistance distance) {
        int best = 0;
        double bestDistance = SonicDistance.UNREACHABLE;
        for (int i = 0; i < remaining.size(); i++) {
            double d = distance.between(current, remaining.get(i));
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        return best;
    }

    private static int indexOf(List<Track> tracks, String id) {
        for (int i = 0; i < tracks.size(); i++) {
            if (tracks.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
