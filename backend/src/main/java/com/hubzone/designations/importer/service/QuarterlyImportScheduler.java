package com.hubzone.designations.importer.service;

import com.hubzone.designations.config.ImportProperties;
import com.hubzone.designations.importer.error.ActiveImportExecutionException;
import com.hubzone.designations.importer.model.ImportOptions;
import com.hubzone.designations.importer.model.SchedulerStatus;
import com.hubzone.designations.importer.model.TriggerType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class QuarterlyImportScheduler {
    private static final Logger log = LoggerFactory.getLogger(QuarterlyImportScheduler.class);
    static final String ACTOR = "scheduler";

    private final ImportExecutionService executionService;
    private final ImportProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService timer;
    private volatile Instant nextFireTime;
    private volatile Instant lastFireTime;
    private volatile String lastOutcome;
    private volatile Long lastExecutionId;

    public QuarterlyImportScheduler(ImportExecutionService executionService, ImportProperties properties, Clock clock) {
        this.executionService = executionService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("import-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            arm(null);
            log.info("Import scheduler started; next run at {}", nextFireTime);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (timer != null) {
                timer.shutdownNow();
                try {
                    timer.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                timer = null;
            }
            nextFireTime = null;
            log.info("Import scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(running.get(), zone().getId(), nextFireTime, lastFireTime, lastOutcome, lastExecutionId);
    }

    Long fire() {
        lastFireTime = clock.instant();
        try {
            long executionId = executionService.trigger(TriggerType.SCHEDULED, ACTOR, ImportOptions.defaults());
            lastExecutionId = executionId;
            lastOutcome = "TRIGGERED";
            log.info("Scheduled import {} triggered", executionId);
            return executionId;
        } catch (ActiveImportExecutionException e) {
            lastOutcome = "SKIPPED_ACTIVE";
            log.info("Scheduled import skipped; import {} is still running", e.activeExecutionId());
            return null;
        } catch (RuntimeException e) {
            lastOutcome = "FAILED";
            log.warn("Scheduled import could not be triggered", e);
            return null;
        }
    }

    private void fireAndRearm(Instant scheduledFor) {
        try {
            fire();
        } finally {
            synchronized (lifecycleLock) {
                if (running.get()) {
                    arm(scheduledFor);
                }
            }
        }
    }

    private void arm(Instant lastScheduled) {
        Instant now = clock.instant();
        Instant next = nextFireAfter(now, lastScheduled);
        nextFireTime = next;
        long delayMs = Math.max(0L, Duration.between(now, next).toMillis());
        timer.schedule(() -> fireAndRearm(next), delayMs, TimeUnit.MILLISECONDS);
    }

    // The timer may wake just before the quarter start, so never re-arm for the quarter that just fired.
    Instant nextFireAfter(Instant now, Instant lastScheduled) {
        Instant from = lastScheduled != null && lastScheduled.isAfter(now) ? lastScheduled : now;
        return QuarterlySchedule.nextFireTime(from, zone());
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getScheduler().getZone());
    }
}
