package com.realtycrm.mlssync.dto.admin;

import com.realtycrm.mlssync.model.SyncState;
import com.realtycrm.mlssync.model.SyncTrigger;
import com.realtycrm.mlssync.model.SyncType;
import lombok.Builder;

import java.time.Instant;

/**
 * Live state of one provider, joined with its configuration and run history.
 *
 * @param successRate share of finished runs that succeeded, between 0 and 1; {@code null} before the first run.
 */
@Builder
public record SyncStatusView(
        String providerId,
        String providerName,
        boolean enabled,
        SyncState state,
        String currentRunId,
        SyncType syncType,
        SyncTrigger syncTrigger,
        Instant startedAt,
        Instant finishedAt,
        int processedCount,
        int createdCount,
        int updatedCount,
        int unchangedCount,
        int failedCount,
        boolean cancelRequested,
        String lastError,
        Instant lastSuccessAt,
        Instant lastSyncedAt,
        Instant lastFullSyncAt,
        int consecutiveFailures,
        long totalRuns,
        Double successRate
) {
}
