package com.realtycrm.mlssync.service.sync;

import com.realtycrm.mlssync.model.SyncState;
import com.realtycrm.mlssync.model.SyncStatus;
import com.realtycrm.mlssync.repository.SyncStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * The per-provider run lock, held in the provider's {@link SyncStatus} row. Acquisition is a single
 * conditional UPDATE, so it holds across threads, restarts and multiple application instances.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncRunLockService {

    private final SyncStatusRepository syncStatusRepository;
    private SyncRunLockService self;

    @Autowired
    public void setSelf(@Lazy SyncRunLockService self) {
        this.self = self;
    }

    /**
     * Attempts to move the provider to RUNNING on behalf of {@code context}.
     *
     * @return {@code true} if this run now owns the lock, {@code false} if another run holds it.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean acquire(final SyncRunContext context) {
        if (syncStatusRepository.findByProviderId(context.providerId()).isEmpty()) {
            try {
                self.createStatusRow(context.providerId());
            } catch (DataIntegrityViolationException e) {
                // Lost the insert race; the row exists either way.
                log.debug("[{}] Sync status row was created concurrently", context.providerId());
            }
        }
        final int rowsUpdated = syncStatusRepository.tryAcquire(context.providerId(), context.runId(),
                                                                context.syncType(), context.trigger(),
                                                                context.startedAt(), SyncState.RUNNING);
        if (rowsUpdated > 0) {
            log.info("[{}] Run lock acquired by run {} ({} sync)", context.providerId(), context.runId(),
                     context.syncType());
            return true;
        }
        log.info("[{}] Run lock is held by another run; trigger skipped", context.providerId());
        return false;
    }

    /**
     * Inserts the IDLE status row for a provider that has never run, in its own transaction.
     *
     * @throws DataIntegrityViolationException if another instance inserted the row first.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void createStatusRow(final String providerId) {
        final SyncStatus status = new SyncStatus();
        status.setProviderId(providerId);
        status.setState(SyncState.IDLE);
        syncStatusRepository.saveAndFlush(status);
        log.info("[{}] Created sync status row", providerId);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void updateProgress(final String runId, final SyncRunCounters counters) {
        syncStatusRepository.updateProgress(runId, counters.getProcessed(), counters.getCreated(),
                                            counters.getUpdated(), counters.getUnchanged(), counters.getFailed());
    }

    /**
     * @return {@code true} if an operator asked the run to stop, or the run no longer owns the status row.
     */
    @Transactional(readOnly = true)
    public boolean isCancelRequested(final String runId) {
        return syncStatusRepository.findCancelRequestedByRunId(runId).orElse(true);
    }

    /**
     * Flags the provider's running run for cancellation at its next batch boundary.
     *
     * @return {@code false} when the provider has no running run.
     */
    @Transactional
    public boolean requestCancel(final String providerId) {
        final boolean flagged = syncStatusRepository.requestCancel(providerId, SyncState.RUNNING) > 0;
        if (flagged) {
            log.info("[{}] Cancellation requested", providerId);
        }
        return flagged;
    }
}
