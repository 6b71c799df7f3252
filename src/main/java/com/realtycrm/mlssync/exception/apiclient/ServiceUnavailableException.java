package com.realtycrm.mlssync.exception.apiclient;

import java.io.Serial;

/**
 * The remote API is unavailable or could not be reached (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5113729874623008178L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
