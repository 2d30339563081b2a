package com.certparser.masterlist.model;

import java.time.Instant;
import java.util.UUID;

public record CrlRecord(
    byte[] crl,
    UUID id,
    String source,
    String issuer,
    String country,
    Instant updatedAt
) {
}
