package com.harmoniq.app.service;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.FlowResult;
import com.harmoniq.app.dto.flow.Period;
import com.harmoniq.app.dto.flow.Track;
import com.harmoniq.app.dto.flow.TrackSource;
import com.harmoniq.app.dto.response.FlowPreviewResponse;
import com.harmoniq.app.dto.response.FlowRunResponse;
import com.harmoniq.app.dto.response.TrackResponse;
import com.harmoniq.app.entity.FlowRun;
import com.harmoniq.app.entity.FlowRunStatus;
import com.harmoniq.app.exception.FlowAlreadyRunningException;
import com.harmoniq.app.exception.FlowConfigurationException;
import com.harmoniq.app.repository.FlowRunRepository;
import com.harmoniq.app.service.flow.FlowEngine;
import com.harmoniq.app.service.flow.PeriodResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs flow cycles: resolves "now" in the configured timezone, generates the flow, writes it to the
 * library and records the outcome. At most one cycle per playlist runs at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowOrchestrationService {

    private final FlowEngine flowEngine;
    private final PeriodResolver periodResolver;
    private final PlaylistSync playlistSync;
    private final FlowRunRepository flowRunRepository;
    private final FlowProperties flowProperties;
    private final Clock clock;

    private final Map<String, ReentrantLock> runLocks = new ConcurrentHashMap<>();

    /**
     * Generate the flow for the current time and write it to the playlist.
     *
     * @throws FlowAlreadyRunningException when a cycle for the same playlist is in progress
     */
    public FlowRunResponse runFlow() {
        String playlistName = flowProperties.getPlaylistName();
        ReentrantLock lock = runLocks.computeIfAbsent(playlistName, name -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.warn("Flow run for '{}' requested while another is in progress", playlistName);
            throw new FlowAlreadyRunningException(playlistName);
        }
        try {
            return toRunResponse(runCycle(playlistName));
        } finally {
            lock.unlock();
        }
    }

    private FlowRun runCycle(String playlistName) {
        long startTime = System.currentTimeMillis();
        log.info("Starting flow cycle for playlist '{}'", playlistName);

        FlowRun run = FlowRun.builder()
                .playlistName(playlistName)
                .targetSize(flowProperties.getTargetSize())
                .build();

        try {
            FlowResult result = flowEngine.generateFlow(currentTime(), flowProperties, newRandom());
            applyResult(run, result);

            if (result.isEmpty()) {
                log.warn("Flow for period '{}' came out empty, playlist '{}' left unchanged",
                        result.getPeriodName(), playlistName);
                run.setStatus(FlowRunStatus.EMPTY);
            } else {
                if (result.isUnderFilled()) {
                    log.warn("Flow for period '{}' has only {} of {} tracks",
                            result.getPeriodName(), result.size(), result.getTargetSize());
                }
                playlistSync.upsertPlaylist(playlistName, result.getTrackIds(), result.getDescription());
                run.setStatus(FlowRunStatus.SUCCESS);
            }
        } catch (RuntimeException e) {
            log.error("Flow cycle for playlist '{}' failed: {}", playlistName, e.getMessage(), e);
            run.setStatus(FlowRunStatus.FAILED);
            run.setErrorMessage(e.getMessage());
            run.setGenerationTimeMs(System.currentTimeMillis() - startTime);
            try {
                flowRunRepository.save(run);
            } catch (RuntimeException saveError) {
                e.addSuppressed(saveError);
            }
            throw e;
        }

        run.setGenerationTimeMs(System.currentTimeMillis() - startTime);
        FlowRun saved = flowRunRepository.save(run);
        log.info("Flow cycle complete. Playlist: '{}', Period: '{}', Status: {}, Tracks: {}, Time: {}ms",
                playlistName, saved.getPeriodName(), saved.getStatus(), saved.getTrackCount(), saved.getGenerationTimeMs());
        return saved;
    }

    /**
     * Dry run: generate the flow for {@code at} (default now) without writing or recording anything.
     */
    public FlowPreviewResponse preview(LocalDateTime at) {
        LocalDateTime when = at != null ? at : currentTime();
        log.info("Previewing flow for {}", when);
        FlowResult result = flowEngine.generateFlow(when, flowProperties, newRandom());
        return toPreviewResponse(when, result);
    }

    public Period activePeriod(LocalDateTime at) {
        LocalDateTime when = at != null ? at : currentTime();
        return periodResolver.resolve(when, flowProperties.getPeriods());
    }

    public List<FlowRunResponse> recentRuns() {
        return flowRunRepository.findTop20ByOrderByCreatedAtDesc().stream()
                .map(this::toRunResponse)
                .collect(Collectors.toList());
    }

    LocalDateTime currentTime() {
        try {
            return LocalDateTime.now(clock.withZone(ZoneId.of(flowProperties.getTimezone())));
        } catch (DateTimeException e) {
            throw new FlowConfigurationException("Unknown timezone '" + flowProperties.getTimezone() + "'");
        }
    }

    private Random newRandom() {
        Long seed = flowProperties.getRandomSeed();
        return seed != null ? new Random(seed) : new Random();
    }

    private void applyResult(FlowRun run, FlowResult result) {
        run.setPeriodName(result.getPeriodName());
        run.setVibeTags(result.getVibe().describe());
        run.setTrackCount(result.size());
        run.setVibeAnchorCount((int) result.countOf(TrackSource.VIBE_ANCHOR));
        run.setFamiliarAnchorCount((int) result.countOf(TrackSource.FAMILIAR_ANCHOR));
        run.setBridgeCount((int) result.countOf(TrackSource.BRIDGE));
        run.setExpansionCount((int) result.countOf(TrackSource.SONIC_EXPANSION));
    }

    private FlowRunResponse toRunResponse(FlowRun run) {
        return FlowRunResponse.builder()
                .id(run.getId())
                .playlistName(run.getPlaylistName())
                .periodName(run.getPeriodName())
                .vibe(run.getVibeTags())
                .status(run.getStatus())
                .trackCount(run.getTrackCount())
                .targetSize(run.getTargetSize())
                .vibeAnchorCount(run.getVibeAnchorCount())
                .familiarAnchorCount(run.getFamiliarAnchorCount())
                .bridgeCount(run.getBridgeCount())
                .expansionCount(run.getExpansionCount())
                .errorMessage(run.getErrorMessage())
                .generationTimeMs(run.getGenerationTimeMs())
                .createdAt(run.getCreatedAt())
                .build();
    }

    private FlowPreviewResponse toPreviewResponse(LocalDateTime when, FlowResult result) {
        List<TrackResponse> tracks = new ArrayList<>();
        int position = 1;
        for (Track track : result.getTracks()) {
            tracks.add(TrackResponse.builder()
                    .id(track.getId())
                    .artist(track.getArtist())
                    .title(track.getTitle())
                    .position(position++)
                    .source(result.getSources().get(track.getId()))
                    .rating(track.getRating())
                    .moods(track.getMoods())
                    .styles(track.getStyles())
                    .build());
        }
        return FlowPreviewResponse.builder()
                .generatedFor(when)
                .periodName(result.getPeriodName())
                .vibeMoods(result.getVibe().getMoods())
                .vibeStyles(result.getVibe().getStyles())
                .description(result.getDescription())
                .targetSize(result.getTargetSize())
                .trackCount(result.size())
                .tracks(tracks)
                .build();
    }
}
