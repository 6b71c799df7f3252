package com.realtycrm.mlssync.model;

public enum ChangeEventType {
    CREATED,
    STATUS_CHANGED,
    PRICE_CHANGED
}
