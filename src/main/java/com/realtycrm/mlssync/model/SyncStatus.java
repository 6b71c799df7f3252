package com.realtycrm.mlssync.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Live state of a provider's current or most recent run. The row doubles as the per-provider run lock:
 * a run may only start by atomically moving {@code state} to {@link SyncState#RUNNING}.
 */
@Entity
@Table(name = "sync_status")
@Data
public class SyncStatus {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String providerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SyncState state = SyncState.IDLE;

    @Column(length = 36)
    private String currentRunId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private SyncType syncType;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private SyncTrigger syncTrigger;

    @Column
    private Instant startedAt;

    @Column
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
    private boolean cancelRequested;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    @Column
    private Instant lastSuccessAt;

    @Column(nullable = false)
    private int consecutiveFailures;

    @Column(nullable = false)
    private long totalRuns;
}
