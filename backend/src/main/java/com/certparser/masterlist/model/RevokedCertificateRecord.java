package com.certparser.masterlist.model;

import java.time.Instant;
import java.util.UUID;

public record RevokedCertificateRecord(
    UUID id,
    String source,
    String country,
    String isn,
    UUID crlId,
    String revocationReason,
    Instant revocationDate,
    Instant updatedAt
) {
}
