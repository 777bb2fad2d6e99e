package com.harmoniq.app.dto.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Expansion tracks grouped by the seed they were found from, in seed order.
 */
public class SonicExpansion {

    public static final SonicExpansion NONE = new SonicExpansion(Map.of());

    private final Map<String, List<Track>> bySeed;

    public SonicExpansion(Map<String, List<Track>> bySeed) {
        this.bySeed = Collections.unmodifiableMap(new LinkedHashMap<>(bySeed));
    }

    public List<Track> forSeed(String seedId) {
        return bySeed.getOrDefault(seedId, List.of());
    }

    public List<Track> tracks() {
        return bySeed.values().stream().flatMap(List::stream).collect(Collectors.toList());
    }

    public int size() {
        return bySeed.values().stream().mapToInt(List::size).sum();
    }
}
