package com.harmoniq.app.service.flow;

import com.harmoniq.app.dto.flow.FlowResult;
import com.harmoniq.app.dto.flow.Track;
import com.harmoniq.app.dto.flow.TrackSource;
import com.harmoniq.app.dto.flow.VibeCriteria;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@Slf4j
public class PlaylistAssembler {

    /**
     * Drops repeated ids (first occurrence wins) and cuts the list at {@code targetSize}.
     *
     * @throws IllegalStateException when a kept track has no entry in {@code sources}
     */
    public FlowResult assemble(String periodName, VibeCriteria vibe, List<Track> ordered,
                               Map<String, TrackSource> sources, int targetSize) {
        Map<String, Track> unique = new LinkedHashMap<>();
        for (Track track : ordered) {
            if (unique.size() >= targetSize) {
                break;
            }
            unique.putIfAbsent(track.getId(), track);
        }

        List<Track> tracks = new ArrayList<>(unique.values());
        Map<String, TrackSource> kept = new LinkedHashMap<>();
        for (Track track : tracks) {
            TrackSource source = sources.get(track.getId());
            if (source == null) {
                throw new IllegalStateException("No source recorded for track " + track.getId());
            }
            kept.put(track.getId(), source);
        }

        FlowResult result = FlowResult.builder()
                .periodName(periodName)
                .vibe(vibe)
                .trackIds(tracks.stream().map(Track::getId).collect(Collectors.toUnmodifiableList()))
                .tracks(Collections.unmodifiableList(tracks))
                .sources(Collections.unmodifiableMap(kept))
                .targetSize(targetSize)
                .description(describe(periodName, vibe, kept))
                .build();

        if (ordered.size() > tracks.size()) {
            log.debug("Assembler dropped {} repeated or overflow tracks", ordered.size() - tracks.size());
        }
        if (result.isUnderFilled()) {
            log.warn("Flow for '{}' has {} of {} tracks", periodName, result.size(), targetSize);
        }
        return result;
    }

    static String describe(String periodName, VibeCriteria vibe, Map<String, TrackSource> sources) {
        return String.format("%s flow · vibe: %s · %d discovery, %d familiar, %d bridge, %d sonic",
                periodName,
                vibe.describe(),
                count(sources, TrackSource.VIBE_ANCHOR),
                count(sources, TrackSource.FAMILIAR_ANCHOR),
                count(sources, TrackSource.BRIDGE),
                count(sources, TrackSource.SONIC_EXPANSION));
    }

    private static long count(Map<String, TrackSource> sources, TrackSource source) {
        return sources.values().stream().filter(source::equals).count();
    }
}
