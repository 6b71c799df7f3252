package com.realtycrm.mlssync.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * One entry of the error ledger. Everything but the resolution marker is immutable once written.
 */
@Entity
@Table(name = "sync_error", indexes = {
        @Index(name = "idx_sync_error_provider_resolved", columnList = "provider_id, resolved"),
        @Index(name = "idx_sync_error_run", columnList = "run_id")
})
@Data
public class SyncError {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false, length = 64, updatable = false)
    private String providerId;

    @Column(name = "run_id", length = 36, updatable = false)
    private String runId;

    @Column(updatable = false)
    private String externalRecordId;

    @Column(updatable = false)
    private Long propertyId;

    @Column(updatable = false)
    private Long mediaId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private SyncErrorCategory category;

    @Column(updatable = false)
    private String field;

    @Column(nullable = false, columnDefinition = "TEXT", updatable = false)
    private String message;

    @Column(nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(nullable = false)
    private boolean resolved;

    @Column
    private Instant resolvedAt;
}
