package com.certparser.masterlist.model;

/**
 * Both bearer tokens needed for one download. Never persisted; {@link #toString()} masks the values.
 */
public record AuthCredentials(String accessToken, String sfcToken) {

    @Override
    public String toString() {
        return "AuthCredentials[accessToken=***, sfcToken=***]";
    }
}
