package com.certparser.masterlist.model;

import java.time.Instant;
import java.util.UUID;

public record CertificateRecord(
    byte[] certificate,
    UUID id,
    String subjectKeyIdentifier,
    String authorityKeyIdentifier,
    String issuer,
    byte[] x500Issuer,
    String source,
    String isn,
    Instant updatedAt
) {
}
