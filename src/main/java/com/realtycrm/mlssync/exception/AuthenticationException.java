package com.realtycrm.mlssync.exception;

import java.io.Serial;

/**
 * The provider rejected the configured credentials, or they could not be resolved. Fatal for the run and
 * never retried automatically.
 */
public class AuthenticationException extends MlsSyncException {
    @Serial
    private static final long serialVersionUID = 6099218377000914573L;

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
