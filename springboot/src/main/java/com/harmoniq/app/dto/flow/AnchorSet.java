package com.harmoniq.app.dto.flow;

import lombok.Getter;
import lombok.ToString;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovery ("vibe") and history-derived ("familiar") anchors. The two sequences never share
 * a track and neither repeats one.
 */
@Getter
@ToString
public class AnchorSet {

    private final List<Track> vibeAnchors;
    private final List<Track> familiarAnchors;
    private final int vibeTarget;
    private final int familiarTarget;

    public AnchorSet(List<Track> vibeAnchors, List<Track> familiarAnchors, int vibeTarget, int familiarTarget) {
        this.vibeAnchors = List.copyOf(vibeAnchors);
        this.familiarAnchors = List.copyOf(familiarAnchors);
        this.vibeTarget = vibeTarget;
        this.familiarTarget = familiarTarget;

        Set<String> seen = new HashSet<>();
        for (Track track : this.vibeAnchors) {
            if (!seen.add(track.getId())) {
                throw new IllegalArgumentException("Track " + track.getId() + " repeats within vibe anchors");
            }
        }
        Set<String> familiarSeen = new HashSet<>();
        for (Track track : this.familiarAnchors) {
            if (!familiarSeen.add(track.getId())) {
                throw new IllegalArgumentException("Track " + track.getId() + " repeats within familiar anchors");
            }
            if (seen.contains(track.getId())) {
                throw new IllegalArgumentException("Track " + track.getId() + " is both a vibe and a familiar anchor");
            }
        }
    }

    /**
     * Vibe anchors first, then familiar anchors.
     */
    public List<Track> all() {
        return Stream.concat(vibeAnchors.stream(), familiarAnchors.stream()).collect(Collectors.toList());
    }

    public List<String> vibeAnchorIds() {
        return vibeAnchors.stream().map(Track::getId).collect(Collectors.toList());
    }

    public List<String> familiarAnchorIds() {
        return familiarAnchors.stream().map(Track::getId).collect(Collectors.toList());
    }

    public int size() {
        return vibeAnchors.size() + familiarAnchors.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean isUnderFilled() {
        return vibeAnchors.size() < vibeTarget || familiarAnchors.size() < familiarTarget;
    }
}
