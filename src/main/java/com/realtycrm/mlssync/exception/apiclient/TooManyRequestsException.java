package com.realtycrm.mlssync.exception.apiclient;

import java.io.Serial;

/**
 * The remote API is throttling this client (HTTP 429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -483098127741921154L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
