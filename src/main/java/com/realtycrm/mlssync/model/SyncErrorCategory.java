package com.realtycrm.mlssync.model;

/**
 * Error taxonomy recorded in the error ledger.
 */
public enum SyncErrorCategory {
    CONNECTIVITY,
    AUTHENTICATION,
    MAPPING,
    MEDIA,
    PERSISTENCE
}
