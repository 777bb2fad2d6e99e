package com.harmoniq.app.service;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.FlowResult;
import com.harmoniq.app.dto.flow.Period;
import com.harmoniq.app.dto.flow.Track;
import com.harmoniq.app.dto.flow.TrackSource;
import com.harmoniq.app.dto.flow.VibeCriteria;
import com.harmoniq.app.dto.response.FlowPreviewResponse;
import com.harmoniq.app.dto.response.FlowRunResponse;
import com.harmoniq.app.dto.response.TrackResponse;
import com.harmoniq.app.entity.FlowRun;
import com.harmoniq.app.entity.FlowRunStatus;
import com.harmoniq.app.exception.FlowAlreadyRunningException;
import com.harmoniq.app.exception.LibraryAccessException;
import com.harmoniq.app.repository.FlowRunRepository;
import com.harmoniq.app.service.flow.FlowEngine;
import com.harmoniq.app.service.flow.PeriodResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FlowOrchestrationServiceTest {

    private static final Instant INSTANT = Instant.parse("2024-05-14T07:30:00Z");

    @Mock
    private FlowEngine flowEngine;
    @Mock
    private PlaylistSync playlistSync;
    @Mock
    private FlowRunRepository flowRunRepository;

    private FlowProperties properties;
    private FlowOrchestrationService service;

    @BeforeEach
    void setUp() {
        properties = new FlowProperties();
        properties.setPlaylistName("Daily Flow");
        properties.setTimezone("Europe/Berlin");
        properties.setRandomSeed(42L);
        properties.setPeriods(List.of(
                Period.builder().name("Morning").startHour(6).build(),
                Period.builder().name("Evening").startHour(18).build()));
        service = new FlowOrchestrationService(flowEngine, new PeriodResolver(), playlistSync, flowRunRepository,
                properties, Clock.fixed(INSTANT, ZoneOffset.UTC));
    }

    private FlowResult result(int size, int target) {
        List<Track> tracks = new ArrayList<>();
        Map<String, TrackSource> sources = new HashMap<>();
        for (int i = 0; i < size; i++) {
            Track track = Track.builder().id("t" + i).build();
            tracks.add(track);
            sources.put(track.getId(), i == 0 ? TrackSource.FAMILIAR_ANCHOR : TrackSource.VIBE_ANCHOR);
        }
        return FlowResult.builder()
                .periodName("Morning")
                .vibe(VibeCriteria.of(List.of("Calm"), List.of()))
                .tracks(tracks)
                .trackIds(tracks.stream().map(Track::getId).collect(Collectors.toList()))
                .sources(sources)
                .targetSize(target)
                .description("Morning flow")
                .build();
    }

    @Test
    void writesPlaylistAndRecordsSuccess() {
        when(flowEngine.generateFlow(any(), eq(properties), any())).thenReturn(result(3, 3));
        when(flowRunRepository.save(any(FlowRun.class))).thenAnswer(inv -> inv.getArgument(0));

        FlowRunResponse response = service.runFlow();

        verify(playlistSync).upsertPlaylist("Daily Flow", List.of("t0", "t1", "t2"), "Morning flow");
        assertThat(response.getStatus()).isEqualTo(FlowRunStatus.SUCCESS);
        assertThat(response.getTrackCount()).isEqualTo(3);
        assertThat(response.getFamiliarAnchorCount()).isEqualTo(1);
        assertThat(response.getVibeAnchorCount()).isEqualTo(2);
        assertThat(response.getVibe()).isEqualTo("Calm");
    }

    @Test
    void usesConfiguredTimezoneForNow() {
        when(flowEngine.generateFlow(any(), any(), any())).thenReturn(result(1, 1));
        when(flowRunRepository.save(any(FlowRun.class))).thenAnswer(inv -> inv.getArgument(0));
        ArgumentCaptor<LocalDateTime> now = ArgumentCaptor.forClass(LocalDateTime.class);

        service.runFlow();

        verify(flowEngine).generateFlow(now.capture(), any(), any(Random.class));
        assertThat(now.getValue()).isEqualTo(LocalDateTime.of(2024, 5, 14, 9, 30));
    }

    @Test
    void emptyResultLeavesPlaylistUntouched() {
        when(flowEngine.generateFlow(any(), any(), any())).thenReturn(result(0, 5));
        when(flowRunRepository.save(any(FlowRun.class))).thenAnswer(inv -> inv.getArgument(0));

        FlowRunResponse response = service.runFlow();

        verifyNoInteractions(playlistSync);
        assertThat(response.getStatus()).isEqualTo(FlowRunStatus.EMPTY);
    }

    @Test
    void underFilledResultIsStillWritten() {
        when(flowEngine.generateFlow(any(), any(), any())).thenReturn(result(2, 10));
        when(flowRunRepository.save(any(FlowRun.class))).thenAnswer(inv -> inv.getArgument(0));

        assertThat(service.runFlow().getStatus()).isEqualTo(FlowRunStatus.SUCCESS);
        verify(playlistSync).upsertPlaylist(anyString(), anyList(), anyString());
    }

    @Test
    void libraryFailureIsRecordedAndRethrown() {
        when(flowEngine.generateFlow(any(), any(), any())).thenThrow(new LibraryAccessException("Plex down"));
        ArgumentCaptor<FlowRun> saved = ArgumentCaptor.forClass(FlowRun.class);

        assertThatThrownBy(() -> service.runFlow()).isInstanceOf(LibraryAccessException.class);

        verify(flowRunRepository).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo(FlowRunStatus.FAILED);
        assertThat(saved.getValue().getErrorMessage()).isEqualTo("Plex down");
        verifyNoInteractions(playlistSync);
    }

    @Test
    void rejectsSecondRunWhileFirstIsInProgress() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(flowEngine.generateFlow(any(), any(), any())).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return result(1, 1);
        });
        when(flowRunRepository.save(any(FlowRun.class))).thenAnswer(inv -> inv.getArgument(0));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<FlowRunResponse> first = executor.submit(() -> service.runFlow());
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> service.runFlow()).isInstanceOf(FlowAlreadyRunningException.class);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).getStatus()).isEqualTo(FlowRunStatus.SUCCESS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void previewNeitherWritesNorRecords() {
        when(flowEngine.generateFlow(any(), any(), any())).thenReturn(result(2, 2));

        FlowPreviewResponse preview = service.preview(LocalDateTime.of(2024, 5, 14, 20, 0));

        assertThat(preview.getTracks()).extracting(TrackResponse::getPosition).containsExactly(1, 2);
        assertThat(preview.getTracks().get(0).getSource()).isEqualTo(TrackSource.FAMILIAR_ANCHOR);
        verifyNoInteractions(playlistSync);
        verify(flowRunRepository, never()).save(any());
    }

    @Test
    void activePeriodUsesConfiguredPeriods() {
        assertThat(service.activePeriod(LocalDateTime.of(2024, 5, 14, 3, 0)).getName()).isEqualTo("Evening");
        assertThat(service.activePeriod(null).getName()).isEqualTo("Morning");
    }
}
