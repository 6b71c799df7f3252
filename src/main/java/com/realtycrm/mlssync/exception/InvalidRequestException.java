package com.realtycrm.mlssync.exception;

import java.io.Serial;

public class InvalidRequestException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 5270993962357061874L;

    public InvalidRequestException(String message) {
        super(message);
    }
}
