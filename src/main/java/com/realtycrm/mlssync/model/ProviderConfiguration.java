package com.realtycrm.mlssync.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator-managed configuration of one MLS data source. The synchronization process only ever writes the
 * {@code lastSyncedAt} and {@code lastFullSyncAt} bookkeeping fields.
 */
@Entity
@Table(name = "provider_configuration")
@Data
public class ProviderConfiguration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String providerId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ProviderType providerType;

    /**
     * Base URL of the provider API, or the fixture location for {@link ProviderType#STATIC_FIXTURE}.
     */
    @Column(length = 1024)
    private String endpoint;

    /**
     * Protocol specific settings and credentials. Values may hold {@code ${ENV_VAR}} placeholders, which are
     * resolved when an adapter is created.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_connection_parameter", joinColumns = @JoinColumn(name = "provider_config_id"))
    @MapKeyColumn(name = "param_name", length = 128)
    @Column(name = "param_value", length = 2048)
    private Map<String, String> connectionParameters = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_field_mapping", joinColumns = @JoinColumn(name = "provider_config_id"))
    @OrderColumn(name = "rule_order")
    private List<FieldMappingRule> fieldMappings = new ArrayList<>();

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(nullable = false)
    private int syncIntervalMinutes = 60;

    @Column(nullable = false)
    private int fullSyncIntervalHours = 24;

    @Column(nullable = false)
    private boolean includeMedia = true;

    /**
     * Records per page and per upsert batch; falls back to the application default when null.
     */
    @Column
    private Integer batchSize;

    @Column
    private Instant lastSyncedAt;

    @Column
    private Instant lastFullSyncAt;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;
}
