package com.certparser.masterlist.port;

import com.certparser.masterlist.model.MasterListPayload;
import com.certparser.railway.Result;

public interface MasterListParser {

    Result<MasterListPayload> parse(byte[] rawBinary);
}
