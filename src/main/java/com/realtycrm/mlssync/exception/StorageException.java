package com.realtycrm.mlssync.exception;

import java.io.Serial;

/**
 * Thrown when the object store rejects or fails a write.
 */
public class StorageException extends MlsSyncException {
    @Serial
    private static final long serialVersionUID = -8712044915270617343L;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
