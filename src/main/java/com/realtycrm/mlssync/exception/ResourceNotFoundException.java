package com.realtycrm.mlssync.exception;

import java.io.Serial;

public class ResourceNotFoundException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1917480254371245063L;

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
