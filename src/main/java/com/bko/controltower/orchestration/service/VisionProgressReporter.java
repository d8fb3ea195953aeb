package com.bko.controltower.orchestration.service;

import com.bko.controltower.config.ControlTowerProperties;
import com.bko.controltower.stream.WorkflowEventService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Emits synthetic {@code vision_progress} events while the analysis call is outstanding. The
 * events are cosmetic; they say nothing about what the agent is actually doing.
 */
@Component
public class VisionProgressReporter {

    private final ScheduledExecutorService scheduler;
    private final WorkflowEventService events;
    private final ControlTowerProperties properties;

    public VisionProgressReporter(@Qualifier("progressScheduler") ScheduledExecutorService scheduler,
                                  WorkflowEventService events,
                                  ControlTowerProperties properties) {
        this.scheduler = scheduler;
        this.events = events;
        this.properties = properties;
    }

    public Ticker start() {
        List<String> steps = List.copyOf(properties.getProgress().getSteps());
        Duration interval = properties.getProgress().getInterval();
        Ticker ticker = new Ticker(steps);
        if (steps.isEmpty() || interval == null || interval.isZero() || interval.isNegative()) {
            ticker.stop();
            return ticker;
        }
        long millis = interval.toMillis();
        ticker.attach(scheduler.scheduleAtFixedRate(ticker::tick, millis, millis, TimeUnit.MILLISECONDS));
        return ticker;
    }

    /**
     * Once {@link #stop()} returns no further progress event is published.
     */
    public final class Ticker {
        private final List<String> steps;
        private final Object lock = new Object();
        private int next;
        private boolean stopped;
        private ScheduledFuture<?> future;

        private Ticker(List<String> steps) {
            this.steps = steps;
        }

        private void attach(ScheduledFuture<?> future) {
            synchronized (lock) {
                this.future = future;
                if (stopped) {
                    future.cancel(false);
                }
            }
        }

        private void tick() {
            synchronized (lock) {
                if (stopped) {
                    return;
                }
                if (next >= steps.size()) {
                    cancelFuture();
                    return;
                }
                int index = next++;
                events.emitVisionProgress(index + 1, steps.size(), steps.get(index));
            }
        }

        public void stop() {
            synchronized (lock) {
                if (stopped) {
                    return;
                }
                stopped = true;
                cancelFuture();
            }
        }

        public boolean isStopped() {
            synchronized (lock) {
                return stopped;
            }
        }

        public int emitted() {
            synchronized (lock) {
                return next;
            }
        }

        private void cancelFuture() {
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
