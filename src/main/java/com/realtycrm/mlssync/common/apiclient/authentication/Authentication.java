package com.realtycrm.mlssync.common.apiclient.authentication;

import java.util.Map;

/**
 * Applies one authentication scheme to the headers of an outbound request.
 */
public interface Authentication {

    /**
     * Adds or replaces the authentication headers.
     *
     * @param headers Mutable header map of the request being prepared.
     */
    void applyAuthentication(Map<String, String> headers);

    /**
     * An authentication that adds nothing, for providers that are open or authenticate by network.
     */
    static Authentication none() {
        return headers -> {
        };
    }
}
