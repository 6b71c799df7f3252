package com.realtycrm.mlssync.exception.apiclient;

import java.io.Serial;

/**
 * The remote API did not accept the supplied credentials (HTTP 401).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6346735715117211441L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
