package com.realtycrm.mlssync.exception.apiclient;

import java.io.Serial;

/**
 * An upstream gateway returned an invalid response (HTTP 502).
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = -8826341309813772413L;

    public BadGatewayException(String message) {
        super(message, 502);
    }
}
