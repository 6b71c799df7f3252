package com.realtycrm.mlssync.model;

public enum SyncType {
    FULL,
    INCREMENTAL
}
