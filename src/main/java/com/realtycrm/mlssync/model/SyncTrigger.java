package com.realtycrm.mlssync.model;

/**
 * What started a run.
 */
public enum SyncTrigger {
    SCHEDULED,
    MANUAL
}
