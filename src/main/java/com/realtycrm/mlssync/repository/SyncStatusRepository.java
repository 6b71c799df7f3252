package com.realtycrm.mlssync.repository;

import com.realtycrm.mlssync.model.SyncState;
import com.realtycrm.mlssync.model.SyncStatus;
import com.realtycrm.mlssync.model.SyncTrigger;
import com.realtycrm.mlssync.model.SyncType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Spring Data JPA repository for {@link SyncStatus}. The conditional updates below are the run lock: each
 * returns the number of rows changed, and a run owns the lock only if its update changed exactly one row.
 */
@Repository
public interface SyncStatusRepository extends JpaRepository<SyncStatus, Long> {

    Optional<SyncStatus> findByProviderId(String providerId);

    Optional<SyncStatus> findByCurrentRunId(String runId);

    long countByState(SyncState state);

    /**
     * Moves a provider to RUNNING unless it already is, resetting the per-run counters.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE SyncStatus s
               SET s.state = :running, s.currentRunId = :runId, s.syncType = :syncType, s.syncTrigger = :trigger,
                   s.startedAt = :startedAt, s.finishedAt = null, s.processedCount = 0, s.createdCount = 0,
                   s.updatedCount = 0, s.unchangedCount = 0, s.failedCount = 0, s.cancelRequested = false,
                   s.lastError = null
             WHERE s.providerId = :providerId AND s.state <> :running
            """)
    int tryAcquire(@Param("providerId") String providerId,
                   @Param("runId") String runId,
                   @Param("syncType") SyncType syncType,
                   @Param("trigger") SyncTrigger trigger,
                   @Param("startedAt") Instant startedAt,
                   @Param("running") SyncState running);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE SyncStatus s
               SET s.processedCount = :processed, s.createdCount = :created, s.updatedCount = :updated,
                   s.unchangedCount = :unchanged, s.failedCount = :failed
             WHERE s.currentRunId = :runId
            """)
    int updateProgress(@Param("runId") String runId,
                       @Param("processed") int processed,
                       @Param("created") int created,
                       @Param("updated") int updated,
                       @Param("unchanged") int unchanged,
                       @Param("failed") int failed);

    @Query("SELECT s.cancelRequested FROM SyncStatus s WHERE s.currentRunId = :runId")
    Optional<Boolean> findCancelRequestedByRunId(@Param("runId") String runId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SyncStatus s SET s.cancelRequested = true WHERE s.providerId = :providerId AND s.state = :running")
    int requestCancel(@Param("providerId") String providerId, @Param("running") SyncState running);

    /**
     * Releases the lock held by {@code runId} after a successful run and resets the failure streak.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE SyncStatus s
               SET s.state = :succeeded, s.finishedAt = :finishedAt, s.lastError = null, s.lastSuccessAt = :finishedAt,
                   s.totalRuns = s.totalRuns + 1, s.consecutiveFailures = 0
             WHERE s.currentRunId = :runId AND s.state = :running
            """)
    int releaseSucceeded(@Param("runId") String runId,
                         @Param("finishedAt") Instant finishedAt,
                         @Param("succeeded") SyncState succeeded,
                         @Param("running") SyncState running);

    /**
     * Releases the lock held by {@code runId} after a failed run and extends the failure streak.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE SyncStatus s
               SET s.state = :failed, s.finishedAt = :finishedAt, s.lastError = :lastError,
                   s.totalRuns = s.totalRuns + 1, s.consecutiveFailures = s.consecutiveFailures + 1
             WHERE s.currentRunId = :runId AND s.state = :running
            """)
    int releaseFailed(@Param("runId") String runId,
                      @Param("finishedAt") Instant finishedAt,
                      @Param("lastError") String lastError,
                      @Param("failed") SyncState failed,
                      @Param("running") SyncState running);

    /**
     * Releases the lock held by {@code runId} after a cancelled run; the failure streak is left untouched.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE SyncStatus s
               SET s.state = :cancelled, s.finishedAt = :finishedAt, s.totalRuns = s.totalRuns + 1
             WHERE s.currentRunId = :runId AND s.state = :running
            """)
    int releaseCancelled(@Param("runId") String runId,
                         @Param("finishedAt") Instant finishedAt,
                         @Param("cancelled") SyncState cancelled,
                         @Param("running") SyncState running);

    /**
     * Marks a RUNNING row whose run started before {@code staleBefore} as FAILED, so a new run can acquire it.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE SyncStatus s
               SET s.state = :failed, s.finishedAt = :now, s.lastError = :reason, s.totalRuns = s.totalRuns + 1,
                   s.consecutiveFailures = s.consecutiveFailures + 1
             WHERE s.providerId = :providerId AND s.currentRunId = :runId AND s.state = :running
               AND s.startedAt < :staleBefore
            """)
    int reclaimStale(@Param("providerId") String providerId,
                     @Param("runId") String runId,
                     @Param("staleBefore") Instant staleBefore,
                     @Param("now") Instant now,
                     @Param("reason") String reason,
                     @Param("running") SyncState running,
                     @Param("failed") SyncState failed);
}
