package com.certparser.masterlist.port;

import com.certparser.masterlist.model.MasterListPayload;
import com.certparser.railway.Result;

public interface CertificateRepository {

    /**
     * Replaces all stored certificates, CRLs and revocations with the payload in one transaction.
     *
     * @return number of rows inserted
     */
    Result<Integer> store(MasterListPayload payload);
}
