package com.realtycrm.mlssync.service.mapping;

import com.realtycrm.mlssync.model.PropertyStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A provider record after mapping, ready to be upserted.
 */
@Value
@Builder
public class CanonicalProperty {
    String providerId;
    String externalId;
    PropertyStatus status;
    BigDecimal price;
    String addressLine;
    String city;
    String state;
    String postalCode;
    String propertyType;
    Integer bedrooms;
    BigDecimal bathrooms;
    Integer squareFeet;
    BigDecimal lotSize;
    Integer yearBuilt;
    BigDecimal latitude;
    BigDecimal longitude;
    String description;
    String agentName;
    String officeName;
    Instant listedAt;
    Instant sourceModifiedAt;
}
