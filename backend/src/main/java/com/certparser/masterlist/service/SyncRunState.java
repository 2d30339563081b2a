package com.certparser.masterlist.service;

import com.certparser.masterlist.model.SyncRunSummary;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide run status shared by the scheduler, the sync service and the health endpoints.
 */
@Component
public class SyncRunState {
    private final AtomicBoolean schedulerDisabled = new AtomicBoolean(false);
    private final AtomicBoolean schedulerStarted = new AtomicBoolean(false);
    private final AtomicBoolean schedulerRunning = new AtomicBoolean(false);
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private final AtomicBoolean syncInProgress = new AtomicBoolean(false);
    private final AtomicReference<String> startupError = new AtomicReference<>();
    private final AtomicReference<SyncRunSummary> lastRun = new AtomicReference<>();

    public void markSchedulerStarted() {
        schedulerStarted.set(true);
        schedulerRunning.set(true);
        ready.set(true);
    }

    /**
     * The scheduler is switched off by configuration; the service still accepts manual triggers.
     */
    public void markSchedulerDisabled() {
        schedulerDisabled.set(true);
    }

    public void markSchedulerStopped() {
        schedulerRunning.set(false);
        ready.set(false);
    }

    public void recordStartupError(String message) {
        startupError.set(message);
        schedulerStarted.set(true);
        ready.set(false);
    }

    public void markRunStarted() {
        syncInProgress.set(true);
    }

    public void finishRun(SyncRunSummary summary) {
        lastRun.set(summary);
        syncInProgress.set(false);
    }

    public boolean isSchedulerDisabled() {
        return schedulerDisabled.get();
    }

    public boolean isSchedulerStarted() {
        return schedulerStarted.get();
    }

    public boolean isSchedulerRunning() {
        return schedulerRunning.get();
    }

    public boolean isReady() {
        return (ready.get() || schedulerDisabled.get()) && startupError.get() == null;
    }

    public boolean isSyncInProgress() {
        return syncInProgress.get();
    }

    public boolean hasError() {
        return startupError.get() != null;
    }

    public String getStartupError() {
        return startupError.get();
    }

    public SyncRunSummary getLastRun() {
        return lastRun.get();
    }
}
