package com.realtycrm.mlssync.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * One provider record could not be converted to the canonical schema. Carries the offending field so the
 * error ledger can point at it.
 */
@Getter
public class MappingException extends MlsSyncException {
    @Serial
    private static final long serialVersionUID = -5025519407446133307L;

    private final String field;

    public MappingException(String field, String message) {
        super(message);
        this.field = field;
    }

    public MappingException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }
}
