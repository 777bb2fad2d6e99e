package com.harmoniq.app.service.flow;

import com.harmoniq.app.dto.flow.Track;
import com.harmoniq.app.service.LibraryCatalog;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Cycle-scoped view of the catalog's distance function. Lookups are memoised per unordered pair;
 * missing sonic data and lookup failures both read as {@link #UNREACHABLE}.
 */
@Slf4j
public class SonicDistance {

    public static final double UNREACHABLE = Double.POSITIVE_INFINITY;

    private final LibraryCatalog catalog;
    private final Map<String, Double> memo = new HashMap<>();

    public SonicDistance(LibraryCatalog catalog) {
        this.catalog = catalog;
    }

    public double between(Track a, Track b) {
        if (a.getId().equals(b.getId())) {
            return 0.0;
        }
        String key = a.getId().compareTo(b.getId()) < 0
                ? a.getId() + '\u0000' + b.getId()
                : b.getId() + '\u0000' + a.getId();
        Double cached = memo.get(key);
        if (cached == null) {
            cached = lookup(a, b);
            memo.put(key, cached);
        }
        return cached;
    }

    public boolean isWithin(Track a, Track b, double maxDistance) {
        return between(a, b) <= maxDistance;
    }

    private double lookup(Track a, Track b) {
        try {
            OptionalDouble distance = catalog.distance(a, b);
            if (distance == null || distance.isEmpty()) {
                return UNREACHABLE;
            }
            double value = distance.getAsDouble();
            if (Double.isNaN(value) || value < 0) {
                log.debug("Ignoring invalid distance {} between {} and {}", value, a.getId(), b.getId());
                return UNREACHABLE;
            }
            return value;
        } catch (RuntimeException e) {
            log.debug("Distance lookup failed between {} and {}: {}", a.getId(), b.getId(), e.getMessage());
            return UNREACHABLE;
        }
    }

    int cachedPairs() {
        return memo.size();
    }
}
