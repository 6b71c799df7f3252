package com.realtycrm.mlssync.service.sync;

import com.realtycrm.mlssync.model.SyncHistory;
import com.realtycrm.mlssync.model.SyncOutcome;
import com.realtycrm.mlssync.model.SyncState;
import com.realtycrm.mlssync.model.SyncStatus;
import com.realtycrm.mlssync.model.SyncTrigger;
import com.realtycrm.mlssync.model.SyncType;
import com.realtycrm.mlssync.repository.ProviderConfigurationRepository;
import com.realtycrm.mlssync.repository.SyncHistoryRepository;
import com.realtycrm.mlssync.repository.SyncStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Finalizes runs: releases the run lock, appends the history row and, for successful runs, moves the
 * provider's sync watermark. Every method commits independently of the caller's transaction.
 * <p>
 * The lock is released with a conditional update on the run id. If it changes no row the run no longer owns
 * the status row (it was reclaimed as stale), so nothing else is written for it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncRunLifecycleManager {

    static final String ABANDONED_MESSAGE = "Run abandoned: no progress within the stale-run threshold";
    private static final int MAX_ERROR_LENGTH = 4000;

    private final SyncStatusRepository syncStatusRepository;
    private final SyncHistoryRepository syncHistoryRepository;
    private final ProviderConfigurationRepository providerConfigurationRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean completeRun(final SyncRunContext context, final SyncRunCounters counters) {
        final Instant finishedAt = clock.instant();
        final int released = syncStatusRepository.releaseSucceeded(context.runId(), finishedAt, SyncState.SUCCESS,
                                                                    SyncState.RUNNING);
        if (released == 0) {
            warnLockLost(context);
            return false;
        }
        writeHistory(context, counters, SyncOutcome.SUCCESS, null, finishedAt);
        // The watermark is the run's start: records modified while the run was in flight are picked up next time.
        if (context.syncType() == SyncType.FULL) {
            providerConfigurationRepository.markFullSynced(context.providerId(), context.startedAt());
        } else {
            providerConfigurationRepository.markSynced(context.providerId(), context.startedAt());
        }
        log.info("[{}] Run {} completed: {}", context.providerId(), context.runId(), counters);
        return true;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean failRun(final SyncRunContext context, final SyncRunCounters counters, final String error) {
        final Instant finishedAt = clock.instant();
        final String message = truncate(error);
        final int released = syncStatusRepository.releaseFailed(context.runId(), finishedAt, message,
                                                                SyncState.FAILED, SyncState.RUNNING);
        if (released == 0) {
            warnLockLost(context);
            return false;
        }
        writeHistory(context, counters, SyncOutcome.FAILED, message, finishedAt);
        log.error("[{}] Run {} failed: {} ({})", context.providerId(), context.runId(), message, counters);
        return true;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean cancelRun(final SyncRunContext context, final SyncRunCounters counters) {
        final Instant finishedAt = clock.instant();
        final int released = syncStatusRepository.releaseCancelled(context.runId(), finishedAt,
                                                                   SyncState.CANCELLED, SyncState.RUNNING);
        if (released == 0) {
            warnLockLost(context);
            return false;
        }
        writeHistory(context, counters, SyncOutcome.CANCELLED, "Cancelled by operator", finishedAt);
        log.info("[{}] Run {} cancelled: {}", context.providerId(), context.runId(), counters);
        return true;
    }

    /**
     * Force-fails a RUNNING status whose run started before {@code staleBefore}, so the provider can be
     * synced again. The abandoned run keeps its progress counters in the history row.
     *
     * @return {@code true} if the row was reclaimed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean abandonStaleRun(final String providerId, final Instant staleBefore) {
        final SyncStatus status = syncStatusRepository.findByProviderId(providerId).orElse(null);
        if (status == null || status.getState() != SyncState.RUNNING || status.getCurrentRunId() == null) {
            return false;
        }
        final Instant now = clock.instant();
        final int reclaimed = syncStatusRepository.reclaimStale(providerId, status.getCurrentRunId(), staleBefore,
                                                                now, ABANDONED_MESSAGE, SyncState.RUNNING,
                                                                SyncState.FAILED);
        if (reclaimed == 0) {
            return false;
        }
        if (!syncHistoryRepository.existsByRunId(status.getCurrentRunId())) {
            final SyncHistory history = new SyncHistory();
            history.setRunId(status.getCurrentRunId());
            history.setProviderId(providerId);
            history.setSyncType(status.getSyncType() == null ? SyncType.INCREMENTAL : status.getSyncType());
            history.setSyncTrigger(status.getSyncTrigger() == null ? SyncTrigger.SCHEDULED : status.getSyncTrigger());
            history.setStartedAt(status.getStartedAt());
            history.setFinishedAt(now);
            history.setProcessedCount(status.getProcessedCount());
            history.setCreatedCount(status.getCreatedCount());
            history.setUpdatedCount(status.getUpdatedCount());
            history.setUnchangedCount(status.getUnchangedCount());
            history.setFailedCount(status.getFailedCount());
            history.setOutcome(SyncOutcome.FAILED);
            history.setErrorMessage(ABANDONED_MESSAGE);
            syncHistoryRepository.save(history);
        }
        log.warn("[{}] Reclaimed stale run {} started at {}", providerId, status.getCurrentRunId(),
                 status.getStartedAt());
        return true;
    }

    private void writeHistory(final SyncRunContext context, final SyncRunCounters counters,
                              final SyncOutcome outcome, final String error, final Instant finishedAt) {
        final SyncHistory history = new SyncHistory();
        history.setRunId(context.runId());
        history.setProviderId(context.providerId());
        history.setSyncType(context.syncType());
        history.setSyncTrigger(context.trigger());
        history.setStartedAt(context.startedAt());
        history.setFinishedAt(finishedAt);
        history.setProcessedCount(counters.getProcessed());
        history.setCreatedCount(counters.getCreated());
        history.setUpdatedCount(counters.getUpdated());
        history.setUnchangedCount(counters.getUnchanged());
        history.setFailedCount(counters.getFailed());
        history.setMediaQueuedCount(counters.getMediaQueued());
        history.setOutcome(outcome);
        history.setErrorMessage(error);
        syncHistoryRepository.save(history);
    }

    private static void warnLockLost(final SyncRunContext context) {
        log.warn("[{}] Run {} no longer owns the sync status row; its result is discarded", context.providerId(),
                 context.runId());
    }

    private static String truncate(final String message) {
        if (message == null) {
            return "Unknown error";
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
