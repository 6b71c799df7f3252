package com.realtycrm.mlssync.service.sync;

public enum UpsertOutcome {
    CREATED,
    UPDATED,
    UNCHANGED,
    /**
     * The incoming record is older than the stored row and was ignored.
     */
    STALE
}
