package com.certparser.masterlist.model;

import com.certparser.railway.Result;
import com.certparser.railway.ResultFailures;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Everything extracted from one Master List download. Revoked entries always point at a CRL of the
 * same payload.
 */
public record MasterListPayload(
    List<CertificateRecord> rootCas,
    List<CertificateRecord> dscs,
    List<CrlRecord> crls,
    List<RevokedCertificateRecord> revokedCertificates
) {
    public MasterListPayload {
        rootCas = rootCas == null ? List.of() : List.copyOf(rootCas);
        dscs = dscs == null ? List.of() : List.copyOf(dscs);
        crls = crls == null ? List.of() : List.copyOf(crls);
        revokedCertificates = revokedCertificates == null ? List.of() : List.copyOf(revokedCertificates);
    }

    public static Result<MasterListPayload> create(
        List<CertificateRecord> rootCas,
        List<CertificateRecord> dscs,
        List<CrlRecord> crls,
        List<RevokedCertificateRecord> revokedCertificates
    ) {
        Set<UUID> crlIds = new HashSet<>();
        if (crls != null) {
            for (CrlRecord crl : crls) {
                crlIds.add(crl.id());
            }
        }
        if (revokedCertificates != null) {
            for (RevokedCertificateRecord revoked : revokedCertificates) {
                if (revoked.crlId() == null || !crlIds.contains(revoked.crlId())) {
                    return ResultFailures.validationError(
                        "Revoked certificate " + revoked.isn() + " references unknown CRL " + revoked.crlId()
                    );
                }
            }
        }
        return Result.success(new MasterListPayload(rootCas, dscs, crls, revokedCertificates));
    }

    public int totalCertificates() {
        return rootCas.size() + dscs.size();
    }

    public int totalItems() {
        return totalCertificates() + crls.size() + revokedCertificates.size();
    }
}
