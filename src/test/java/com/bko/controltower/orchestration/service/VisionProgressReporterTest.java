package com.bko.controltower.orchestration.service;

import com.bko.controltower.config.ControlTowerProperties;
import com.bko.controltower.stream.WorkflowEventService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VisionProgressReporterTest {

    @Mock
    private WorkflowEventService events;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final ControlTowerProperties properties = new ControlTowerProperties();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void emitsEachStepOnceThenStops() throws Exception {
        properties.getProgress().setInterval(Duration.ofMillis(10));
        properties.getProgress().setSteps(List.of("one", "two"));
        VisionProgressReporter reporter = new VisionProgressReporter(scheduler, events, properties);

        VisionProgressReporter.Ticker ticker = reporter.start();
        Thread.sleep(200);

        assertEquals(2, ticker.emitted());
        verify(events).emitVisionProgress(1, 2, "one");
        verify(events).emitVisionProgress(2, 2, "two");
        verifyNoMoreInteractions(events);
    }

    @Test
    void nothingIsEmittedAfterStop() throws Exception {
        properties.getProgress().setInterval(Duration.ofMillis(50));
        VisionProgressReporter reporter = new VisionProgressReporter(scheduler, events, properties);

        VisionProgressReporter.Ticker ticker = reporter.start();
        ticker.stop();
        ticker.stop();
        Thread.sleep(150);

        assertTrue(ticker.isStopped());
        verify(events, never()).emitVisionProgress(anyInt(), anyInt(), anyString());
    }

    @Test
    void zeroIntervalDisablesProgress() {
        properties.getProgress().setInterval(Duration.ZERO);
        VisionProgressReporter reporter = new VisionProgressReporter(scheduler, events, properties);

        assertTrue(reporter.start().isStopped());
    }
}
