package com.realtycrm.mlssync.exception.json;

import java.io.Serial;

/**
 * Thrown when a provider payload or fixture cannot be parsed as JSON.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -4315221486898941505L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
