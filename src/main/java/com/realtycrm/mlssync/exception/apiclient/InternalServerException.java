package com.realtycrm.mlssync.exception.apiclient;

import java.io.Serial;

/**
 * The remote API failed while handling the request (HTTP 500).
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3306921087112264711L;

    public InternalServerException(String message) {
        super(message, 500);
    }
}
