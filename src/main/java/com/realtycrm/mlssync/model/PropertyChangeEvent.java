package com.realtycrm.mlssync.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * One entry in a property's change timeline: creation, status transitions and price changes.
 */
@Entity
@Immutable
@Table(name = "property_change_event", indexes = @Index(name = "idx_change_property", columnList = "property_id"))
@Data
public class PropertyChangeEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "property_id", nullable = false)
    private Long propertyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ChangeEventType eventType;

    @Column
    private String oldValue;

    @Column
    private String newValue;

    @Column(length = 36)
    private String syncRunId;

    @Column(nullable = false)
    private Instant occurredAt;
}
