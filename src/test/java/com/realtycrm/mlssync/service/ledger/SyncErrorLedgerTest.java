package com.realtycrm.mlssync.service.ledger;

import com.realtycrm.mlssync.exception.ResourceNotFoundException;
import com.realtycrm.mlssync.model.SyncError;
import com.realtycrm.mlssync.model.SyncErrorCategory;
import com.realtycrm.mlssync.repository.SyncErrorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyncErrorLedgerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    SyncErrorRepository syncErrorRepository;

    private SyncErrorLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new SyncErrorLedger(syncErrorRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("record stamps the time and truncates long messages")
    void record_truncates() {
        when(syncErrorRepository.save(any(SyncError.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SyncError saved = ledger.record(SyncErrorEntry.builder()
                                                      .providerId("mls-a")
                                                      .runId("run-1")
                                                      .externalRecordId("L-1")
                                                      .category(SyncErrorCategory.MAPPING)
                                                      .field("ListPrice")
                                                      .message("x".repeat(5000))
                                                      .build());

        assertThat(saved.getOccurredAt()).isEqualTo(NOW);
        assertThat(saved.getMessage()).hasSize(SyncErrorLedger.MAX_MESSAGE_LENGTH);
        assertThat(saved.getField()).isEqualTo("ListPrice");
        assertThat(saved.isResolved()).isFalse();
    }

    @Test
    @DisplayName("summary reports zero for categories without errors")
    void summarize_fillsZeros() {
        when(syncErrorRepository.countUnresolvedByCategoryForProvider("mls-a"))
                .thenReturn(List.<Object[]>of(new Object[]{SyncErrorCategory.MEDIA, 4L}));

        Map<SyncErrorCategory, Long> summary = ledger.summarizeUnresolved("mls-a");

        assertThat(summary).containsEntry(SyncErrorCategory.MEDIA, 4L)
                           .containsEntry(SyncErrorCategory.MAPPING, 0L)
                           .hasSize(SyncErrorCategory.values().length);
    }

    @Test
    @DisplayName("resolve marks the error resolved once")
    void resolve_marksResolved() {
        SyncError error = new SyncError();
        error.setId(7L);
        error.setProviderId("mls-a");
        when(syncErrorRepository.findById(7L)).thenReturn(Optional.of(error));
        when(syncErrorRepository.save(error)).thenReturn(error);

        SyncError resolved = ledger.resolve(7L);

        assertThat(resolved.isResolved()).isTrue();
        assertThat(resolved.getResolvedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("resolve of an unknown error is not found")
    void resolve_unknown() {
        when(syncErrorRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> ledger.resolve(99L)).isInstanceOf(ResourceNotFoundException.class);
    }
}
