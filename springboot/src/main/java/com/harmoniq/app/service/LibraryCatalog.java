package com.harmoniq.app.service;

import com.harmoniq.app.dto.flow.HistoryEntry;
import com.harmoniq.app.dto.flow.Track;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Read access to the music library. Implementations own network I/O, auth, timeouts and retries,
 * and signal failure with {@link com.harmoniq.app.exception.LibraryAccessException}.
 */
public interface LibraryCatalog {

    /**
     * Tracks carrying at least one of the given moods or styles.
     */
    Set<Track> tracksByTag(Set<String> moods, Set<String> styles);

    /**
     * Plays recorded in the last {@code lookbackDays} days, most recent first.
     */
    List<HistoryEntry> trackHistory(int lookbackDays);

    /**
     * Sonic distance in [0, 1], lower is more similar. Empty when either track lacks sonic data.
     */
    OptionalDouble distance(Track a, Track b);
}
