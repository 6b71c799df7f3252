package com.realtycrm.mlssync.common.apiclient.authentication.impl;

import com.realtycrm.mlssync.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * HTTP Basic authentication, used by RETS-era MLS gateways that expose a RESO facade.
 */
@Slf4j
public record BasicAuthentication(String username, String password) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        log.debug("Applying basic authentication for user '{}'", username);
        final String token = Base64.getEncoder()
                                   .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        headers.put(HttpHeaders.AUTHORIZATION, "Basic " + token);
    }

    @Override
    public String toString() {
        return "BasicAuthentication[username=" + username + "]";
    }
}
