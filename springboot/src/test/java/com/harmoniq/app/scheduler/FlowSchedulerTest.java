package com.harmoniq.app.scheduler;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.exception.FlowAlreadyRunningException;
import com.harmoniq.app.exception.LibraryAccessException;
import com.harmoniq.app.service.FlowOrchestrationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FlowSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-14T07:30:00Z");

    @Mock
    private FlowOrchestrationService flowOrchestrationService;
    @Mock
    private TaskScheduler taskScheduler;

    private FlowProperties properties;
    private FlowScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new FlowProperties();
        scheduler = new FlowScheduler(flowOrchestrationService, properties, taskScheduler, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void schedulesFixedDelayRunsStartingNow() {
        properties.setRunIntervalMinutes(30);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(NOW), eq(Duration.ofMinutes(30)));

        scheduler.start();
        scheduler.stop();

        verify(future).cancel(false);
    }

    @Test
    void runsOnceWhenIntervalIsZero() {
        properties.setRunIntervalMinutes(0);

        scheduler.start();

        verify(taskScheduler).schedule(any(Runnable.class), eq(NOW));
    }

    @Test
    void failedCycleDoesNotEscape() {
        when(flowOrchestrationService.runFlow()).thenThrow(new LibraryAccessException("Plex down"));

        assertThatCode(() -> scheduler.runCycle()).doesNotThrowAnyException();
    }

    @Test
    void busyCycleIsSkipped() {
        when(flowOrchestrationService.runFlow()).thenThrow(new FlowAlreadyRunningException("Daily Flow"));

        assertThatCode(() -> scheduler.runCycle()).doesNotThrowAnyException();
    }
}
