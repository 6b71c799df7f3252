package com.realtycrm.mlssync.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The canonical listing row populated by synchronization. A listing is identified by the pair
 * (provider, external listing id); re-syncing the same listing updates this row in place.
 */
@Entity
@Table(name = "property",
        uniqueConstraints = @UniqueConstraint(name = "uk_property_provider_listing",
                columnNames = {"provider_id", "external_listing_id"}),
        indexes = {
                @Index(name = "idx_property_status", columnList = "status"),
                @Index(name = "idx_property_city", columnList = "city")
        })
@Data
public class Property {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false, length = 64)
    private String providerId;

    @Column(name = "external_listing_id", nullable = false)
    private String externalListingId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private PropertyStatus status;

    @Column(precision = 14, scale = 2)
    private BigDecimal price;

    @Column
    private String addressLine;

    @Column
    private String city;

    @Column(length = 32)
    private String state;

    @Column(length = 16)
    private String postalCode;

    @Column
    private String propertyType;

    @Column
    private Integer bedrooms;

    @Column(precision = 5, scale = 2)
    private BigDecimal bathrooms;

    @Column
    private Integer squareFeet;

    @Column(precision = 14, scale = 2)
    private BigDecimal lotSize;

    @Column
    private Integer yearBuilt;

    @Column(precision = 10, scale = 7)
    private BigDecimal latitude;

    @Column(precision = 10, scale = 7)
    private BigDecimal longitude;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column
    private String agentName;

    @Column
    private String officeName;

    /**
     * When the provider reports the listing went on the market.
     */
    @Column
    private Instant listedAt;

    /**
     * The provider's own modification timestamp for this listing; used to reject out-of-order updates.
     */
    @Column
    private Instant sourceModifiedAt;

    @Column(nullable = false)
    private Instant lastSynchronizedAt;

    @Column(length = 36)
    private String lastSyncRunId;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;
}
