package com.realtycrm.mlssync.exception.apiclient;

import java.io.Serial;

/**
 * The requested resource does not exist on the remote API (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = 1520943758843215532L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
