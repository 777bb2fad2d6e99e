package com.harmoniq.app.service.flow;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.HistoryEntry;
import com.harmoniq.app.dto.flow.Track;
import com.harmoniq.app.dto.flow.VibeProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.harmoniq.app.service.flow.TestTracks.NOW;
import static com.harmoniq.app.service.flow.TestTracks.played;
import static com.harmoniq.app.service.flow.TestTracks.styled;
import static com.harmoniq.app.service.flow.TestTracks.track;
import static org.assertj.core.api.Assertions.assertThat;

class VibeLearnerTest {

    private final VibeLearner learner = new VibeLearner();
    private FlowProperties.Vibe settings;

    @BeforeEach
    void setUp() {
        settings = new FlowProperties.Vibe();
        settings.setLookbackDays(30);
        settings.setMinOccurrences(2);
        settings.setTopNMoods(1);
        settings.setTopMStyles(1);
    }

    @Test
    void learnsDominantMood() {
        Track calm = track("1", "Calm");
        List<HistoryEntry> history = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            history.add(played(calm, NOW.minusDays(i + 1)));
        }
        history.add(played(track("2", "Angry"), NOW.minusDays(2)));

        VibeProfile learned = learner.learn(history, NOW, settings);

        assertThat(learned.getMoods()).containsExactly("Calm");
    }

    @Test
    void emptyHistoryGivesEmptyProfile() {
        assertThat(learner.learn(List.of(), NOW, settings).isEmpty()).isTrue();
        assertThat(learner.learn(null, NOW, settings).isEmpty()).isTrue();
    }

    @Test
    void dropsTagsBelowMinimumOccurrences() {
        settings.setTopNMoods(5);
        settings.setMinOccurrences(3);
        List<HistoryEntry> history = List.of(
                played(track("1", "Calm"), NOW.minusDays(1)),
                played(track("2", "Calm"), NOW.minusDays(2)),
                played(track("3", "Calm", "Dreamy"), NOW.minusDays(3)),
                played(track("4", "Dreamy"), NOW.minusDays(4)));

        VibeProfile learned = learner.learn(history, NOW, settings);

        assertThat(learned.getMoods()).containsExactly("Calm");
    }

    @Test
    void ignoresPlaysOutsideLookbackWindow() {
        Track old = track("1", "Calm");
        List<HistoryEntry> history = List.of(
                played(old, NOW.minusDays(40)),
                played(old, NOW.minusDays(41)),
                played(old, NOW.plusHours(1)));

        assertThat(learner.learn(history, NOW, settings).isEmpty()).isTrue();
    }

    @Test
    void countsTagsCaseInsensitively() {
        List<HistoryEntry> history = List.of(
                played(track("1", "calm"), NOW.minusDays(1)),
                played(track("2", "CALM"), NOW.minusDays(2)));

        VibeProfile learned = learner.learn(history, NOW, settings);

        assertThat(learned.getMoods()).hasSize(1);
        assertThat(learned.getMoods().get(0)).isEqualToIgnoringCase("calm");
    }

    @Test
    void perTrackCountingIgnoresRepeatPlays() {
        settings.setCountPerPlay(false);
        Track calm = track("1", "Calm");
        List<HistoryEntry> history = List.of(
                played(calm, NOW.minusDays(1)),
                played(calm, NOW.minusDays(2)),
                played(calm, NOW.minusDays(3)));

        assertThat(learner.learn(history, NOW, settings).isEmpty()).isTrue();
    }

    @Test
    void breaksCountTiesByMostRecentOccurrence() {
        List<HistoryEntry> history = List.of(
                played(track("1", "Older"), NOW.minusDays(10)),
                played(track("2", "Older"), NOW.minusDays(9)),
                played(track("3", "Newer"), NOW.minusDays(2)),
                played(track("4", "Newer"), NOW.minusDays(1)));

        assertThat(learner.learn(history, NOW, settings).getMoods()).containsExactly("Newer");
    }

    @Test
    void learnsStylesSeparatelyFromMoods() {
        Track jazz = styled("1", Set.of("Mellow"), Set.of("Jazz"));
        List<HistoryEntry> history = List.of(played(jazz, NOW.minusDays(1)), played(jazz, NOW.minusDays(2)));

        VibeProfile learned = learner.learn(history, NOW, settings);

        assertThat(learned.getMoods()).containsExactly("Mellow");
        assertThat(learned.getStyles()).containsExactly("Jazz");
    }
}
