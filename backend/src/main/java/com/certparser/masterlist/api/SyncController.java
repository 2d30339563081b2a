package com.certparser.masterlist.api;

import com.certparser.masterlist.model.HealthResponse;
import com.certparser.masterlist.model.InfoResponse;
import com.certparser.masterlist.model.TriggerResponse;
import com.certparser.masterlist.service.MasterListSyncService;
import com.certparser.masterlist.service.SyncRunState;
import com.certparser.masterlist.service.SyncStatusService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
public class SyncController {
    private static final String SCHEDULER_DISABLED = "scheduler disabled";

    private final SyncRunState state;
    private final MasterListSyncService syncService;
    private final SyncStatusService statusService;

    public SyncController(SyncRunState state, MasterListSyncService syncService, SyncStatusService statusService) {
        this.state = state;
        this.syncService = syncService;
        this.statusService = statusService;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        if (state.hasError()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new HealthResponse("unhealthy", state.isSchedulerRunning(), state.getStartupError(), null));
        }
        if (state.isSchedulerDisabled()) {
            return ResponseEntity.ok(new HealthResponse("healthy", false, null, SCHEDULER_DISABLED));
        }
        if (!state.isSchedulerRunning()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new HealthResponse("unhealthy", false, null, "scheduler not running"));
        }
        return ResponseEntity.ok(new HealthResponse("healthy", true, null, null));
    }

    @GetMapping("/ready")
    public ResponseEntity<HealthResponse> ready() {
        if (state.isSchedulerDisabled() && !state.hasError()) {
            return ResponseEntity.ok(new HealthResponse("ready", null, null, SCHEDULER_DISABLED));
        }
        if (!state.isSchedulerStarted()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new HealthResponse("starting", null, null, "scheduler not started"));
        }
        if (state.hasError()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new HealthResponse("not_ready", null, state.getStartupError(), null));
        }
        if (!state.isReady()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new HealthResponse("not_ready", null, null, "scheduler stopped"));
        }
        return ResponseEntity.ok(new HealthResponse("ready", null, null, null));
    }

    @GetMapping("/info")
    public InfoResponse info() {
        return statusService.getInfo();
    }

    // the run happens on the sync executor; the servlet thread is released while it is in flight
    @PostMapping("/trigger")
    public CompletableFuture<ResponseEntity<TriggerResponse>> trigger() {
        return syncService.submit("manual")
            .thenApply(result -> result.fold(
                rows -> ResponseEntity.ok(TriggerResponse.success(rows)),
                error -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(TriggerResponse.failed(error.code(), error.message()))
            ));
    }
}
