package com.certparser.masterlist.service;

import com.certparser.config.CertParserProperties;
import com.certparser.railway.ErrorCode;
import com.certparser.railway.FailureDescription;
import com.certparser.railway.Result;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

@Service
public class MasterListSyncScheduler {
    private static final Logger log = LoggerFactory.getLogger(MasterListSyncScheduler.class);

    private final CertParserProperties properties;
    private final MasterListSyncService syncService;
    private final SyncRunState state;
    private final TaskScheduler taskScheduler;
    private final Object lifecycleLock = new Object();

    private ScheduledFuture<?> scheduledRun;

    public MasterListSyncScheduler(
        CertParserProperties properties,
        MasterListSyncService syncService,
        SyncRunState state,
        @Qualifier("syncTaskScheduler") TaskScheduler taskScheduler
    ) {
        this.properties = properties;
        this.syncService = syncService;
        this.state = state;
        this.taskScheduler = taskScheduler;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        } else {
            state.markSchedulerDisabled();
            log.info("Master list sync scheduler disabled; only manual triggers will run");
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (scheduledRun != null) {
                return;
            }
            Result<CronTrigger> trigger = properties.validate()
                .flatMap(valid -> Result.fromComputation(
                    () -> new CronTrigger(valid.getScheduler().springCron()),
                    ErrorCode.CONFIGURATION_ERROR,
                    "Invalid cron expression '" + valid.getScheduler().getCron() + "'"
                ));
            if (trigger.isFailure()) {
                FailureDescription error = trigger.unwrapFailure();
                log.error("Master list sync not scheduled: {}", error.message());
                state.recordStartupError(error.message());
                return;
            }
            scheduledRun = taskScheduler.schedule(() -> submitRun("scheduled"), trigger.unwrapSuccess());
            state.markSchedulerStarted();
            log.info("Master list sync scheduled with cron '{}'", properties.getScheduler().getCron());
            if (properties.isRunOnStartup()) {
                submitRun("startup");
            }
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduledRun == null) {
                return;
            }
            scheduledRun.cancel(false);
            scheduledRun = null;
            state.markSchedulerStopped();
            log.info("Master list sync scheduler stopped");
        }
    }

    private void submitRun(String trigger) {
        try {
            syncService.submit(trigger);
        } catch (RejectedExecutionException e) {
            log.warn("Master list sync ({}) rejected; executor is shutting down", trigger, e);
        }
    }
}
