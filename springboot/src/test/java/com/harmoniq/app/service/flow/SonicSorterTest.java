package com.harmoniq.app.service.flow;

import com.harmoniq.app.dto.flow.Track;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.harmoniq.app.service.flow.TestTracks.track;
import static org.assertj.core.api.Assertions.assertThat;

class SonicSorterTest {

    private final SonicSorter sorter = new SonicSorter();
    private final InMemoryLibraryCatalog catalog = new InMemoryLibraryCatalog();
    private final SonicDistance distance = new SonicDistance(catalog);

    @Test
    void walksToNearestNeighbourEachStep() {
        Track a = catalog.onCircle("a", 0);
        Track b = catalog.onCircle("b", 10);
        Track c = catalog.onCircle("c", 100);
        Track d = catalog.onCircle("d", 50);

        List<Track> sorted = sorter.sort(List.of(a, c, b, d), a, List.of(), 10, 0.4, distance);

        assertThat(sorted).extracting(Track::getId).containsExactly("a", "b", "d", "c");
    }

    @Test
    void equalDistancesKeepInputOrder() {
        catalog.distance("s", "x", 0.1).distance("s", "y", 0.1);
        Track s = track("s");
        Track x = track("x");
        Track y = track("y");

        List<Track> sorted = sorter.sort(List.of(s, y, x), s, List.of(), 10, 0.4, distance);

        assertThat(sorted).extracting(Track::getId).containsExactly("s", "y", "x");
    }

    @Test
    void unreachableTracksFollowInInputOrder() {
        List<Track> sorted = sorter.sort(List.of(track("a"), track("b"), track("c")), track("b"),
                List.of(), 10, 0.4, distance);

        assertThat(sorted).extracting(Track::getId).containsExactly("b", "a", "c");
    }

    @Test
    void fallsBackToClosestTrackBeyondThreshold() {
        Track a = catalog.onCircle("a", 0);
        Track far = catalog.onCircle("far", 150);
        Track farther = catalog.onCircle("farther", 180);

        List<Track> sorted = sorter.sort(List.of(a, farther, far), a, List.of(), 10, 0.1, distance);

        assertThat(sorted).extracting(Track::getId).containsExactly("a", "far", "farther");
    }

    @Test
    void neighbourhoodTracksAreNeverEmitted() {
        Track a = catalog.onCircle("a", 0);
        Track b = catalog.onCircle("b", 40);
        Track pool = catalog.onCircle("pool", 5);

        List<Track> sorted = sorter.sort(List.of(b, a), a, List.of(pool, a), 1, 0.4, distance);

        assertThat(sorted).extracting(Track::getId).containsExactly("a", "b");
    }

    @Test
    void startsWithFirstTrackWhenNoStartGiven() {
        List<Track> sorted = sorter.sort(List.of(catalog.onCircle("x", 90), catalog.onCircle("y", 0)), null, List.of(), 10, 0.4, distance);

        assertThat(sorted.get(0).getId()).isEqualTo("x");
    }

    @Test
    void outputIsPermutationOfInput() {
        Random random = new Random(11);
        for (int round = 0; round < 20; round++) {
            List<Track> tracks = new ArrayList<>();
            int size = 1 + random.nextInt(25);
            for (int i = 0; i < size; i++) {
                tracks.add(i % 4 == 3 ? track("r" + round + "-" + i) : catalog.onCircle("r" + round + "-" + i, random.nextInt(360)));
            }
            Collections.shuffle(tracks, random);
            Track start = tracks.get(random.nextInt(tracks.size()));

            List<Track> sorted = sorter.sort(tracks, start, List.of(), 1 + random.nextInt(5), 0.2, distance);

            assertThat(sorted).hasSameSizeAs(tracks).containsExactlyInAnyOrderElementsOf(tracks);
            assertThat(sorted.get(0)).isEqualTo(start);
        }
    }
}
