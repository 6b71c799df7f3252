package com.realtycrm.mlssync.service.sync;

import com.realtycrm.mlssync.model.SyncState;
import com.realtycrm.mlssync.model.SyncStatus;
import com.realtycrm.mlssync.model.SyncTrigger;
import com.realtycrm.mlssync.model.SyncType;
import com.realtycrm.mlssync.repository.SyncStatusRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncRunLockServiceTest {

    private static final Instant STARTED = Instant.parse("2024-05-01T11:00:00Z");

    @Mock
    SyncStatusRepository syncStatusRepository;
    @Mock
    SyncRunLockService self;

    private SyncRunLockService lockService;

    @BeforeEach
    void setUp() {
        lockService = new SyncRunLockService(syncStatusRepository);
        lockService.setSelf(self);
    }

    private static SyncRunContext context() {
        return SyncRunContext.builder()
                             .runId("run-1")
                             .providerId("mls-a")
                             .syncType(SyncType.FULL)
                             .trigger(SyncTrigger.MANUAL)
                             .startedAt(STARTED)
                             .batchSize(100)
                             .fieldMappings(List.of())
                             .build();
    }

    @Test
    @DisplayName("a lost status-row insert race still goes on to the conditional acquire")
    void acquire_statusRowInsertedConcurrently() {
        when(syncStatusRepository.findByProviderId("mls-a")).thenReturn(Optional.empty());
        doThrow(new DataIntegrityViolationException("duplicate key"))
                .when(self).createStatusRow("mls-a");
        when(syncStatusRepository.tryAcquire("mls-a", "run-1", SyncType.FULL, SyncTrigger.MANUAL, STARTED,
                                             SyncState.RUNNING)).thenReturn(1);

        assertThat(lockService.acquire(context())).isTrue();
        verify(self).createStatusRow("mls-a");
    }

    @Test
    @DisplayName("an existing status row is not inserted again")
    void acquire_existingRow() {
        when(syncStatusRepository.findByProviderId("mls-a")).thenReturn(Optional.of(new SyncStatus()));
        when(syncStatusRepository.tryAcquire("mls-a", "run-1", SyncType.FULL, SyncTrigger.MANUAL, STARTED,
                                             SyncState.RUNNING)).thenReturn(0);

        assertThat(lockService.acquire(context())).isFalse();
        verify(self, never()).createStatusRow("mls-a");
    }

    @Test
    @DisplayName("the status-row insert itself propagates a constraint violation to its caller")
    void createStatusRow_propagatesViolation() {
        when(syncStatusRepository.saveAndFlush(any(SyncStatus.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatThrownBy(() -> lockService.createStatusRow("mls-a"))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
