package com.realtycrm.mlssync.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Failure of an outbound HTTP call made through {@link com.realtycrm.mlssync.common.apiclient.ApiClient}.
 * Subclasses exist for the status codes callers branch on.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 8174310921345023981L;
    private final int statusCode;

    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * @return {@code true} for status codes that indicate rejected credentials.
     */
    public boolean isAuthenticationFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
