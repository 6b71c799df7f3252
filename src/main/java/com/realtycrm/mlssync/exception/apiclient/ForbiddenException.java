package com.realtycrm.mlssync.exception.apiclient;

import java.io.Serial;

/**
 * The credentials are valid but lack access to the resource (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7263610298376402281L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
