package com.realtycrm.mlssync.exception.apiclient;

import java.io.Serial;

/**
 * The request did not complete in time (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = -772310563301297664L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
