package com.realtycrm.mlssync.exception;

import java.io.Serial;

/**
 * An operator request collides with the current state, e.g. triggering a provider that is already running.
 */
public class SyncConflictException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -3007760916446128817L;

    public SyncConflictException(String message) {
        super(message);
    }
}
