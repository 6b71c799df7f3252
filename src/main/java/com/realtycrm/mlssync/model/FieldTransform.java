package com.realtycrm.mlssync.model;

/**
 * Value conversion applied by a field-mapping rule before the value is assigned to its canonical field.
 * {@code NONE} defers to the canonical field's natural conversion.
 */
public enum FieldTransform {
    NONE,
    TEXT,
    UPPER_CASE,
    DECIMAL,
    INTEGER,
    LISTING_STATUS,
    TIMESTAMP
}
