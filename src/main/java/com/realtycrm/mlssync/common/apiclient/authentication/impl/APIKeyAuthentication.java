package com.realtycrm.mlssync.common.apiclient.authentication.impl;

import com.realtycrm.mlssync.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Sends a static API key in a provider-specific header.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        log.debug("Applying API key authentication using header: '{}'", headerName);
        headers.put(headerName, apiKey);
    }

    @Override
    public String toString() {
        return "APIKeyAuthentication[headerName=" + headerName + "]";
    }
}
