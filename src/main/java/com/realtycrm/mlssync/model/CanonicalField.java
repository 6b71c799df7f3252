package com.realtycrm.mlssync.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Target fields of the canonical property schema that a provider field can be mapped onto.
 */
@Getter
@AllArgsConstructor
public enum CanonicalField {
    EXTERNAL_ID(FieldTransform.TEXT, true),
    STATUS(FieldTransform.LISTING_STATUS, false),
    PRICE(FieldTransform.DECIMAL, false),
    ADDRESS_LINE(FieldTransform.TEXT, false),
    CITY(FieldTransform.TEXT, false),
    STATE(FieldTransform.UPPER_CASE, false),
    POSTAL_CODE(FieldTransform.TEXT, false),
    PROPERTY_TYPE(FieldTransform.TEXT, false),
    BEDROOMS(FieldTransform.INTEGER, false),
    BATHROOMS(FieldTransform.DECIMAL, false),
    SQUARE_FEET(FieldTransform.INTEGER, false),
    LOT_SIZE(FieldTransform.DECIMAL, false),
    YEAR_BUILT(FieldTransform.INTEGER, false),
    LATITUDE(FieldTransform.DECIMAL, false),
    LONGITUDE(FieldTransform.DECIMAL, false),
    DESCRIPTION(FieldTransform.TEXT, false),
    AGENT_NAME(FieldTransform.TEXT, false),
    OFFICE_NAME(FieldTransform.TEXT, false),
    LISTED_AT(FieldTransform.TIMESTAMP, false),
    SOURCE_MODIFIED_AT(FieldTransform.TIMESTAMP, false);

    private final FieldTransform naturalTransform;
    private final boolean required;
}
