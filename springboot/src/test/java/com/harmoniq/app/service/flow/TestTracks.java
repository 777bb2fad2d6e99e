package com.harmoniq.app.service.flow;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.HistoryEntry;
import com.harmoniq.app.dto.flow.Period;
import com.harmoniq.app.dto.flow.Track;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class TestTracks {

    static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 14, 9, 30);

    private TestTracks() {
    }

    static Track track(String id, String... moods) {
        return Track.builder()
                .id(id)
                .artist("Artist " + id)
                .title("Title " + id)
                .moods(Set.of(moods))
                .build();
    }

    static Track styled(String id, Set<String> moods, Set<String> styles) {
        return Track.builder()
                .id(id)
                .artist("Artist " + id)
                .title("Title " + id)
                .moods(moods)
                .styles(styles)
                .build();
    }

    static HistoryEntry played(Track track, LocalDateTime at) {
        return HistoryEntry.builder().track(track).playedAt(at).build();
    }

    static HistoryEntry played(Track track, LocalDateTime at, double rating) {
        return HistoryEntry.builder().track(track).playedAt(at).rating(rating).build();
    }

    static Period period(String name, int startHour) {
        return Period.builder().name(name).startHour(startHour).build();
    }

    static Period period(String name, int startHour, List<String> moods) {
        return Period.builder().name(name).startHour(startHour).moods(new ArrayList<>(moods)).build();
    }

    static FlowProperties properties(Period... periods) {
        FlowProperties properties = new FlowProperties();
        properties.setPeriods(new ArrayList<>(List.of(periods)));
        return properties;
    }
}
