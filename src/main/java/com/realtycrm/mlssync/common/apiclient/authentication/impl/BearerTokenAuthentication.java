package com.realtycrm.mlssync.common.apiclient.authentication.impl;

import com.realtycrm.mlssync.common.apiclient.authentication.Authentication;
import org.springframework.http.HttpHeaders;

import java.util.Map;

/**
 * OAuth2 bearer token authentication with a pre-issued access token.
 */
public record BearerTokenAuthentication(String accessToken) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
    }

    @Override
    public String toString() {
        return "BearerTokenAuthentication[***]";
    }
}
