package com.certparser.masterlist.service;

import com.certparser.config.CertParserProperties;
import com.certparser.masterlist.model.InfoResponse;
import com.certparser.masterlist.persistence.CertificateJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class SyncStatusService {
    private static final Logger log = LoggerFactory.getLogger(SyncStatusService.class);

    private final CertificateJdbcRepository repository;
    private final SyncRunState state;
    private final CertParserProperties properties;
    private final String applicationName;
    private final String version;

    public SyncStatusService(
        CertificateJdbcRepository repository,
        SyncRunState state,
        CertParserProperties properties,
        @Value("${spring.application.name:cert-parser}") String applicationName,
        @Value("${cert-parser.version:0.1.0}") String version
    ) {
        this.repository = repository;
        this.state = state;
        this.properties = properties;
        this.applicationName = applicationName;
        this.version = version;
    }

    public InfoResponse getInfo() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Certificate database unreachable", e);
            dbConnected = false;
        }
        Map<String, Long> counts = dbConnected ? repository.tableCounts() : new LinkedHashMap<>();
        return new InfoResponse(
            applicationName,
            version,
            properties.getScheduler().isEnabled(),
            state.isSchedulerStarted(),
            state.isSchedulerRunning(),
            state.isReady(),
            state.hasError(),
            dbConnected,
            state.getLastRun(),
            counts
        );
    }
}
