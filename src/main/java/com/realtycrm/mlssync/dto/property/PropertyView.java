package com.realtycrm.mlssync.dto.property;

import com.realtycrm.mlssync.model.Property;
import com.realtycrm.mlssync.model.PropertyStatus;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;

@Builder
public record PropertyView(
        Long id,
        String providerId,
        String externalListingId,
        PropertyStatus status,
        BigDecimal price,
        String addressLine,
        String city,
        String state,
        String postalCode,
        String propertyType,
        Integer bedrooms,
        BigDecimal bathrooms,
        Integer squareFeet,
        BigDecimal lotSize,
        Integer yearBuilt,
        BigDecimal latitude,
        BigDecimal longitude,
        String description,
        String agentName,
        String officeName,
        Instant listedAt,
        Instant sourceModifiedAt,
        Instant lastSynchronizedAt
) {

    public static PropertyView from(final Property property) {
        return PropertyView.builder()
                           .id(property.getId())
                           .providerId(property.getProviderId())
                           .externalListingId(property.getExternalListingId())
                           .status(property.getStatus())
                           .price(property.getPrice())
                           .addressLine(property.getAddressLine())
                           .city(property.getCity())
                           .state(property.getState())
                           .postalCode(property.getPostalCode())
                           .propertyType(property.getPropertyType())
                           .bedrooms(property.getBedrooms())
                           .bathrooms(property.getBathrooms())
                           .squareFeet(property.getSquareFeet())
                           .lotSize(property.getLotSize())
                           .yearBuilt(property.getYearBuilt())
                           .latitude(property.getLatitude())
                           .longitude(property.getLongitude())
                           .description(property.getDescription())
                           .agentName(property.getAgentName())
                           .officeName(property.getOfficeName())
                           .listedAt(property.getListedAt())
                           .sourceModifiedAt(property.getSourceModifiedAt())
                           .lastSynchronizedAt(property.getLastSynchronizedAt())
                           .build();
    }
}
