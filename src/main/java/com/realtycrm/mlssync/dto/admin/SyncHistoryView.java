package com.realtycrm.mlssync.dto.admin;

import com.realtycrm.mlssync.model.SyncHistory;
import com.realtycrm.mlssync.model.SyncOutcome;
import com.realtycrm.mlssync.model.SyncTrigger;
import com.realtycrm.mlssync.model.SyncType;

import java.time.Instant;

public record SyncHistoryView(
        String runId,
        String providerId,
        SyncType syncType,
        SyncTrigger syncTrigger,
        Instant startedAt,
        Instant finishedAt,
        long durationMillis,
        int processedCount,
        int createdCount,
        int updatedCount,
        int unchangedCount,
        int failedCount,
        int mediaQueuedCount,
        SyncOutcome outcome,
        String errorMessage
) {

    public static SyncHistoryView from(final SyncHistory history) {
        return new SyncHistoryView(history.getRunId(), history.getProviderId(), history.getSyncType(),
                                   history.getSyncTrigger(), history.getStartedAt(), history.getFinishedAt(),
                                   history.getFinishedAt().toEpochMilli() - history.getStartedAt().toEpochMilli(),
                                   history.getProcessedCount(), history.getCreatedCount(), history.getUpdatedCount(),
                                   history.getUnchangedCount(), history.getFailedCount(),
                                   history.getMediaQueuedCount(), history.getOutcome(), history.getErrorMessage());
    }
}
