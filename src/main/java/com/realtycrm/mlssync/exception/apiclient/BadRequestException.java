package com.realtycrm.mlssync.exception.apiclient;

import java.io.Serial;

/**
 * The remote API rejected the request as malformed (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2239183204447321890L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
