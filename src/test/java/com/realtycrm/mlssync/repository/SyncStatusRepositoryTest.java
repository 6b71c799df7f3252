package com.realtycrm.mlssync.repository;

import com.realtycrm.mlssync.model.SyncState;
import com.realtycrm.mlssync.model.SyncStatus;
import com.realtycrm.mlssync.model.SyncTrigger;
import com.realtycrm.mlssync.model.SyncType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class SyncStatusRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    SyncStatusRepository syncStatusRepository;

    @BeforeEach
    void setUp() {
        SyncStatus status = new SyncStatus();
        status.setProviderId("mls-a");
        syncStatusRepository.saveAndFlush(status);
    }

    private int acquire(String runId) {
        return syncStatusRepository.tryAcquire("mls-a", runId, SyncType.INCREMENTAL, SyncTrigger.MANUAL, T0,
                                               SyncState.RUNNING);
    }

    @Test
    @DisplayName("only one run can hold the provider lock")
    void tryAcquire_isExclusive() {
        assertThat(acquire("run-1")).isEqualTo(1);
        assertThat(acquire("run-2")).isZero();

        SyncStatus status = syncStatusRepository.findByProviderId("mls-a").orElseThrow();
        assertThat(status.getState()).isEqualTo(SyncState.RUNNING);
        assertThat(status.getCurrentRunId()).isEqualTo("run-1");
    }

    @Test
    @DisplayName("releasing frees the lock and only the owning run may release")
    void release_requiresOwner() {
        acquire("run-1");

        assertThat(syncStatusRepository.releaseSucceeded("run-other", T0.plusSeconds(60), SyncState.SUCCESS,
                                                         SyncState.RUNNING)).isZero();
        assertThat(syncStatusRepository.releaseSucceeded("run-1", T0.plusSeconds(60), SyncState.SUCCESS,
                                                         SyncState.RUNNING)).isEqualTo(1);

        SyncStatus status = syncStatusRepository.findByProviderId("mls-a").orElseThrow();
        assertThat(status.getState()).isEqualTo(SyncState.SUCCESS);
        assertThat(status.getLastSuccessAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(status.getTotalRuns()).isEqualTo(1);
        assertThat(acquire("run-2")).isEqualTo(1);
    }

    @Test
    @DisplayName("cancel flag is visible to the running run")
    void requestCancel() {
        acquire("run-1");

        assertThat(syncStatusRepository.requestCancel("mls-a", SyncState.RUNNING)).isEqualTo(1);
        assertThat(syncStatusRepository.findCancelRequestedByRunId("run-1")).contains(true);
    }

    @Test
    @DisplayName("a stale run can be reclaimed, a fresh one cannot")
    void reclaimStale() {
        acquire("run-1");

        assertThat(syncStatusRepository.reclaimStale("mls-a", "run-1", T0.minusSeconds(60), T0.plusSeconds(60),
                                                     "abandoned", SyncState.RUNNING, SyncState.FAILED)).isZero();
        assertThat(syncStatusRepository.reclaimStale("mls-a", "run-1", T0.plusSeconds(60), T0.plusSeconds(120),
                                                     "abandoned", SyncState.RUNNING, SyncState.FAILED)).isEqualTo(1);

        SyncStatus status = syncStatusRepository.findByProviderId("mls-a").orElseThrow();
        assertThat(status.getState()).isEqualTo(SyncState.FAILED);
        assertThat(status.getLastError()).isEqualTo("abandoned");
    }
}
