package com.realtycrm.mlssync.exception;

import java.io.Serial;

/**
 * The provider could not be reached or answered with a server-side error. Retryable; aborts the current run
 * once retries are exhausted.
 */
public class ConnectivityException extends MlsSyncException {
    @Serial
    private static final long serialVersionUID = -1370936116284915243L;

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
