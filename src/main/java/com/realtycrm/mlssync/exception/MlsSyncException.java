package com.realtycrm.mlssync.exception;

import java.io.Serial;

/**
 * Base exception for failures raised by the synchronization engine.
 */
public class MlsSyncException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2871650243310940761L;

    public MlsSyncException(String message) {
        super(message);
    }

    public MlsSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
