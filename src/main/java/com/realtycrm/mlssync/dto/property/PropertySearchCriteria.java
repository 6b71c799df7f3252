package com.realtycrm.mlssync.dto.property;

import com.realtycrm.mlssync.model.PropertyStatus;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Optional filters for the property listing endpoint; null members are ignored.
 */
@Builder
public record PropertySearchCriteria(
        String providerId,
        PropertyStatus status,
        String city,
        String state,
        String postalCode,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        Integer minBedrooms,
        String query
) {
}
