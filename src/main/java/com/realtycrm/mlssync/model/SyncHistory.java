package com.realtycrm.mlssync.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only audit row, written once per finished run.
 */
@Entity
@Immutable
@Table(name = "sync_history", indexes = @Index(name = "idx_history_provider_started", columnList = "provider_id, started_at"))
@Data
public class SyncHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String runId;

    @Column(name = "provider_id", nullable = false, length = 64)
    private String providerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SyncType syncType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SyncTrigger syncTrigger;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(nullable = false)
    private Instant finishedAt;

    @Column(nullable = false)
    private int processedCount;

    @Column(nullable = false)
    private int createdCount;

    @Column(nullable = false)
    private int updatedCount;

    @Column(nullable = false)
    private int unchangedCount;

    @Column(nullable = false)
    private int failedCount;

    @Column(nullable = false)
    private int mediaQueuedCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SyncOutcome outcome;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;
}
