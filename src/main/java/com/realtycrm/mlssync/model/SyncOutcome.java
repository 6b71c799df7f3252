package com.realtycrm.mlssync.model;

/**
 * Final classification of a completed run, as written to {@link SyncHistory}.
 */
public enum SyncOutcome {
    SUCCESS,
    FAILED,
    CANCELLED;

    public SyncState toState() {
        return switch (this) {
            case SUCCESS -> SyncState.SUCCESS;
            case FAILED -> SyncState.FAILED;
            case CANCELLED -> SyncState.CANCELLED;
        };
    }
}
