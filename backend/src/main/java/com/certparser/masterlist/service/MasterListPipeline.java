package com.certparser.masterlist.service;

import com.certparser.masterlist.model.AuthCredentials;
import com.certparser.masterlist.port.AccessTokenProvider;
import com.certparser.masterlist.port.BinaryDownloader;
import com.certparser.masterlist.port.CertificateRepository;
import com.certparser.masterlist.port.MasterListParser;
import com.certparser.masterlist.port.SfcTokenProvider;
import com.certparser.railway.Result;

/**
 * One synchronisation run: access token, SFC token, download, parse, store. The first failing
 * stage ends the run and its failure is returned unchanged.
 */
public final class MasterListPipeline {

    private MasterListPipeline() {
    }

    public static Result<Integer> run(
        AccessTokenProvider accessTokenProvider,
        SfcTokenProvider sfcTokenProvider,
        BinaryDownloader downloader,
        MasterListParser parser,
        CertificateRepository repository
    ) {
        return accessTokenProvider.acquireToken()
            .flatMap(accessToken -> sfcTokenProvider.acquireToken(accessToken)
                .map(sfcToken -> new AuthCredentials(accessToken, sfcToken)))
            .flatMap(downloader::download)
            .flatMap(parser::parse)
            .flatMap(repository::store);
    }
}
