package com.harmoniq.app.dto.flow;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class FlowResult {
    String periodName;
    VibeCriteria vibe;
    List<String> trackIds;
    List<Track> tracks;                 // same order as trackIds
    Map<String, TrackSource> sources;   // track id -> source
    int targetSize;
    String description;

    public int size() {
        return trackIds.size();
    }

    public boolean isEmpty() {
        return trackIds.isEmpty();
    }

    public boolean isUnderFilled() {
        return trackIds.size() < targetSize;
    }

    public long countOf(TrackSource source) {
        return sources.values().stream().filter(source::equals).count();
    }
}
