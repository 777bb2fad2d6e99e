package com.harmoniq.app.dto.flow;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Read-only snapshot of a library track for one generation cycle.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString
@EqualsAndHashCode(of = "id")
public class Track {

    private final String id;

    private final String artist;

    private final String title;

    @Builder.Default
    private final Set<String> moods = Set.of();

    @Builder.Default
    private final Set<String> styles = Set.of();

    private final Double rating; // 0.0 - 5.0, null when unrated

    private final LocalDateTime lastPlayedAt;

    private final int skipCount;

    private final int playCount;

    public boolean isRated() {
        return rating != null;
    }

    public String displayName() {
        return (artist != null ? artist : "Unknown Artist") + " - " + (title != null ? title : "Unknown Title");
    }
}
