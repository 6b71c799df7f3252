package com.realtycrm.mlssync.model;

public enum SyncState {
    IDLE,
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED
}
