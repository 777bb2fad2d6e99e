package com.harmoniq.app.scheduler;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.exception.FlowAlreadyRunningException;
import com.harmoniq.app.service.FlowOrchestrationService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs a flow cycle once the application is up, then every {@code app.flow.run-interval-minutes}.
 */
@Component
@ConditionalOnProperty(prefix = "app.flow.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FlowScheduler {

    private final FlowOrchestrationService flowOrchestrationService;
    private final FlowProperties flowProperties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private ScheduledFuture<?> scheduledRuns;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        int interval = flowProperties.getRunIntervalMinutes();
        if (interval > 0) {
            log.info("Scheduling flow '{}' every {} minutes", flowProperties.getPlaylistName(), interval);
            scheduledRuns = taskScheduler.scheduleWithFixedDelay(this::runCycle, clock.instant(), Duration.ofMinutes(interval));
        } else {
            log.info("Flow interval is {}, running '{}' once", interval, flowProperties.getPlaylistName());
            scheduledRuns = taskScheduler.schedule(this::runCycle, clock.instant());
        }
    }

    void runCycle() {
        try {
            flowOrchestrationService.runFlow();
        } catch (FlowAlreadyRunningException e) {
            log.warn("Skipping scheduled cycle: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled flow cycle failed, next attempt at the regular interval", e);
        }
    }

    @PreDestroy
    public void stop() {
        if (scheduledRuns != null) {
            log.info("Cancelling scheduled flow runs");
            scheduledRuns.cancel(false);
        }
    }
}
