package com.certparser.masterlist.service;

import com.certparser.masterlist.model.SyncRunSummary;
import com.certparser.masterlist.port.AccessTokenProvider;
import com.certparser.masterlist.port.BinaryDownloader;
import com.certparser.masterlist.port.CertificateRepository;
import com.certparser.masterlist.port.MasterListParser;
import com.certparser.masterlist.port.SfcTokenProvider;
import com.certparser.railway.ErrorCode;
import com.certparser.railway.ExecutionContext;
import com.certparser.railway.LoggingExecutionContext;
import com.certparser.railway.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Service
public class MasterListSyncService {
    private static final Logger log = LoggerFactory.getLogger(MasterListSyncService.class);
    static final String ABORTED_MESSAGE = "Master list sync aborted";

    private final AccessTokenProvider accessTokenProvider;
    private final SfcTokenProvider sfcTokenProvider;
    private final BinaryDownloader downloader;
    private final MasterListParser parser;
    private final CertificateRepository repository;
    private final SyncRunState state;
    private final ExecutorService syncExecutor;
    private final ExecutionContext runContext = new LoggingExecutionContext("MasterListSync");

    public MasterListSyncService(
        AccessTokenProvider accessTokenProvider,
        SfcTokenProvider sfcTokenProvider,
        BinaryDownloader downloader,
        MasterListParser parser,
        CertificateRepository repository,
        SyncRunState state,
        @Qualifier("syncExecutor") ExecutorService syncExecutor
    ) {
        this.accessTokenProvider = accessTokenProvider;
        this.sfcTokenProvider = sfcTokenProvider;
        this.downloader = downloader;
        this.parser = parser;
        this.repository = repository;
        this.state = state;
        this.syncExecutor = syncExecutor;
    }

    /**
     * Queues a run on the single sync thread. Runs never overlap inside one process.
     */
    public CompletableFuture<Result<Integer>> submit(String trigger) {
        return CompletableFuture.supplyAsync(() -> runOnce(trigger), syncExecutor);
    }

    public Result<Integer> runOnce(String trigger) {
        Instant startedAt = Instant.now();
        state.markRunStarted();
        log.info("Master list sync triggered by {}", trigger);
        Result<Integer> result;
        try {
            result = runContext.execute(() -> MasterListPipeline.run(
                accessTokenProvider,
                sfcTokenProvider,
                downloader,
                parser,
                repository
            ));
        } catch (Error e) {
            state.finishRun(new SyncRunSummary(
                trigger,
                startedAt,
                Instant.now(),
                false,
                null,
                ErrorCode.TECHNICAL_ERROR,
                ABORTED_MESSAGE
            ));
            throw e;
        }
        SyncRunSummary summary = result.fold(
            rows -> new SyncRunSummary(trigger, startedAt, Instant.now(), true, rows, null, null),
            error -> new SyncRunSummary(trigger, startedAt, Instant.now(), false, null, error.code(), error.message())
        );
        state.finishRun(summary);
        return result
            .peek(rows -> log.info("Master list sync ({}) stored {} rows", trigger, rows))
            .peekFailure(error -> {
                log.error("Master list sync ({}) failed code={} message={}", trigger, error.code(), error.message());
                if (error.hasCause()) {
                    log.debug("Failure cause", error.cause());
                }
            });
    }
}
