package com.harmoniq.app.dto.flow;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mood and style tags in effect for one cycle. Tags compare case-insensitively; the first
 * spelling seen is the one kept for display.
 */
public final class VibeCriteria {

    private final Map<String, String> moods;   // normalized -> display
    private final Map<String, String> styles;

    private VibeCriteria(Map<String, String> moods, Map<String, String> styles) {
        this.moods = Collections.unmodifiableMap(moods);
        this.styles = Collections.unmodifiableMap(styles);
    }

    public static VibeCriteria of(Collection<String> moods, Collection<String> styles) {
        Collection<String> moodTags = moods != null ? moods : List.of();
        Collection<String> styleTags = styles != null ? styles : List.of();
        return union(List.of(moodTags), List.of(styleTags));
    }

    /**
     * Builds criteria from several mood and style sources, earlier sources winning the display spelling.
     */
    public static VibeCriteria union(List<? extends Collection<String>> moodSources,
                                     List<? extends Collection<String>> styleSources) {
        return new VibeCriteria(collect(moodSources), collect(styleSources));
    }

    private static Map<String, String> collect(List<? extends Collection<String>> sources) {
        Map<String, String> tags = new LinkedHashMap<>();
        for (Collection<String> source : sources) {
            if (source == null) {
                continue;
            }
            for (String tag : source) {
                if (tag == null || tag.isBlank()) {
                    continue;
                }
                tags.putIfAbsent(normalize(tag), tag.trim());
            }
        }
        return tags;
    }

    public static String normalize(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT);
    }

    public Set<String> getMoods() {
        return new LinkedHashSet<>(moods.values());
    }

    public Set<String> getStyles() {
        return new LinkedHashSet<>(styles.values());
    }

    public boolean isEmpty() {
        return moods.isEmpty() && styles.isEmpty();
    }

    public boolean matches(Track track) {
        return overlap(track) > 0;
    }

    /**
     * Number of the track's mood and style tags present in these criteria.
     */
    public int overlap(Track track) {
        int count = 0;
        for (String mood : track.getMoods()) {
            if (mood != null && moods.containsKey(normalize(mood))) {
                count++;
            }
        }
        for (String style : track.getStyles()) {
            if (style != null && styles.containsKey(normalize(style))) {
                count++;
            }
        }
        return count;
    }

    public String describe() {
        Set<String> all = new LinkedHashSet<>(moods.values());
        all.addAll(styles.values());
        return all.isEmpty() ? "none" : String.join(", ", all);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VibeCriteria that)) return false;
        return moods.keySet().equals(that.moods.keySet()) && styles.keySet().equals(that.styles.keySet());
    }

    @Override
    public int hashCode() {
        return Objects.hash(moods.keySet(), styles.keySet());
    }

    @Override
    public String toString() {
        return "VibeCriteria(moods=" + moods.values() + ", styles=" + styles.values() + ")";
    }
}
