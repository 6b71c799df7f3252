package com.realtycrm.mlssync.service.sync;

import com.realtycrm.mlssync.exception.AuthenticationException;
import com.realtycrm.mlssync.exception.ConnectivityException;
import com.realtycrm.mlssync.exception.ResourceNotFoundException;
import com.realtycrm.mlssync.model.CanonicalField;
import com.realtycrm.mlssync.model.FieldMappingRule;
import com.realtycrm.mlssync.model.ProviderConfiguration;
import com.realtycrm.mlssync.model.ProviderType;
import com.realtycrm.mlssync.model.SyncErrorCategory;
import com.realtycrm.mlssync.model.SyncTrigger;
import com.realtycrm.mlssync.model.SyncType;
import com.realtycrm.mlssync.repository.ProviderConfigurationRepository;
import com.realtycrm.mlssync.service.ledger.SyncErrorEntry;
import com.realtycrm.mlssync.service.ledger.SyncErrorLedger;
import com.realtycrm.mlssync.service.mapping.CanonicalProperty;
import com.realtycrm.mlssync.service.mapping.FieldMapper;
import com.realtycrm.mlssync.service.media.MediaRegistrationService;
import com.realtycrm.mlssync.service.provider.MediaReference;
import com.realtycrm.mlssync.service.provider.MlsProviderAdapter;
import com.realtycrm.mlssync.service.provider.ProviderAdapterFactory;
import com.realtycrm.mlssync.service.provider.ProviderRecord;
import com.realtycrm.mlssync.service.provider.RecordPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ConcurrentTaskExecutor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String PROVIDER = "mls-a";

    @Mock
    ProviderConfigurationRepository providerConfigurationRepository;
    @Mock
    ProviderAdapterFactory adapterFactory;
    @Mock
    PropertyUpsertService upsertService;
    @Mock
    MediaRegistrationService mediaRegistrationService;
    @Mock
    SyncRunLockService lockService;
    @Mock
    SyncRunLifecycleManager lifecycleManager;
    @Mock
    SyncErrorLedger errorLedger;
    @Mock
    MlsProviderAdapter adapter;

    private ProviderConfiguration configuration;
    private SyncOrchestrator orchestrator;

    @Captor
    ArgumentCaptor<List<CanonicalProperty>> batch;

    @BeforeEach
    void setUp() {
        configuration = new ProviderConfiguration();
        configuration.setProviderId(PROVIDER);
        configuration.setProviderType(ProviderType.STATIC_FIXTURE);
        configuration.setIncludeMedia(true);
        configuration.setFieldMappings(List.of(FieldMappingRule.of("ListingKey", CanonicalField.EXTERNAL_ID),
                                               FieldMappingRule.of("ListPrice", CanonicalField.PRICE)));
        configuration.setLastSyncedAt(NOW.minusSeconds(3600));

        when(providerConfigurationRepository.findByProviderId(PROVIDER)).thenReturn(Optional.of(configuration));
        when(adapterFactory.create(configuration)).thenReturn(adapter);
        when(adapterFactory.pageSize(configuration)).thenReturn(100);
        when(lockService.isCancelRequested(anyString())).thenReturn(false);

        orchestrator = orchestrator(new ConcurrentTaskExecutor(Runnable::run));
    }

    private SyncOrchestrator orchestrator(AsyncTaskExecutor executor) {
        RetryTemplate retryTemplate = RetryTemplate.builder()
                                                   .maxAttempts(2)
                                                   .fixedBackoff(1)
                                                   .retryOn(ConnectivityException.class)
                                                   .build();
        return new SyncOrchestrator(providerConfigurationRepository, adapterFactory, new FieldMapper(),
                                    upsertService, mediaRegistrationService, lockService, lifecycleManager,
                                    errorLedger, retryTemplate, executor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ProviderRecord listing(String key, Object price) {
        return new ProviderRecord(Map.of("ListingKey", key, "ListPrice", price));
    }

    @Test
    @DisplayName("valid records are upserted, an unmappable one is logged and the run completes")
    void trigger_mixedPage() {
        when(lockService.acquire(any())).thenReturn(true);
        when(adapter.fetchChangedRecords(NOW.minusSeconds(3600), null)).thenReturn(new RecordPage(
                List.of(listing("A", 100), listing("B", 200), listing("C", "not a price")), null));
        when(upsertService.upsertBatch(eq(PROVIDER), anyList(), anyString())).thenReturn(List.of(
                new RecordUpsert("A", 1L, UpsertOutcome.CREATED),
                new RecordUpsert("B", 2L, UpsertOutcome.UNCHANGED)));
        List<MediaReference> media = List.of(new MediaReference("https://img/a.jpg", null, 1, null));
        when(adapter.fetchMediaReferences("A")).thenReturn(media);
        when(mediaRegistrationService.register(1L, media)).thenReturn(1);

        TriggerResult result = orchestrator.trigger(PROVIDER, SyncType.INCREMENTAL, SyncTrigger.MANUAL);

        assertThat(result.outcome()).isEqualTo(TriggerResult.Outcome.STARTED);
        ArgumentCaptor<SyncRunCounters> counters = ArgumentCaptor.forClass(SyncRunCounters.class);
        verify(lifecycleManager).completeRun(any(SyncRunContext.class), counters.capture());
        assertThat(counters.getValue().getProcessed()).isEqualTo(3);
        assertThat(counters.getValue().getCreated()).isEqualTo(1);
        assertThat(counters.getValue().getUnchanged()).isEqualTo(1);
        assertThat(counters.getValue().getFailed()).isEqualTo(1);
        assertThat(counters.getValue().getMediaQueued()).isEqualTo(1);

        ArgumentCaptor<SyncErrorEntry> error = ArgumentCaptor.forClass(SyncErrorEntry.class);
        verify(errorLedger).record(error.capture());
        assertThat(error.getValue().category()).isEqualTo(SyncErrorCategory.MAPPING);
        assertThat(error.getValue().externalRecordId()).isEqualTo("C");
        assertThat(error.getValue().field()).isEqualTo("ListPrice");
        verify(adapter, never()).fetchMediaReferences("B");
        verify(adapter).disconnect();
    }

    @Test
    @DisplayName("duplicate ids within a page keep the last occurrence")
    void runSync_duplicateIdsLastWins() {
        when(lockService.acquire(any())).thenReturn(true);
        when(adapter.fetchChangedRecords(any(), any())).thenReturn(new RecordPage(
                List.of(listing("A", 100), listing("A", 150)), null));
        when(upsertService.upsertBatch(eq(PROVIDER), anyList(), anyString()))
                .thenReturn(List.of(new RecordUpsert("A", 1L, UpsertOutcome.UPDATED)));

        orchestrator.trigger(PROVIDER, SyncType.INCREMENTAL, SyncTrigger.MANUAL);
        verify(upsertService).upsertBatch(eq(PROVIDER), batch.capture(), anyString());
        assertThat(batch.getValue()).singleElement()
                                    .satisfies(p -> assertThat(p.getPrice()).isEqualByComparingTo("150"));
    }

    @Test
    @DisplayName("first sync of a provider without a watermark runs as FULL")
    void trigger_incrementalWithoutWatermarkBecomesFull() {
        configuration.setLastSyncedAt(null);
        when(lockService.acquire(any())).thenReturn(false);

        TriggerResult result = orchestrator.trigger(PROVIDER, SyncType.INCREMENTAL, SyncTrigger.SCHEDULED);

        assertThat(result.outcome()).isEqualTo(TriggerResult.Outcome.SKIPPED);
        assertThat(result.syncType()).isEqualTo(SyncType.FULL);
        verify(adapterFactory, never()).create(any());
    }

    @Test
    @DisplayName("unknown provider is not found")
    void trigger_unknownProvider() {
        when(providerConfigurationRepository.findByProviderId("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orchestrator.trigger("nope", SyncType.FULL, SyncTrigger.MANUAL))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("saturated executor fails the run and reports REJECTED")
    void trigger_rejected() {
        AsyncTaskExecutor saturated = mock(AsyncTaskExecutor.class);
        doThrow(new TaskRejectedException("full")).when(saturated).execute(any(Runnable.class));
        when(lockService.acquire(any())).thenReturn(true);

        TriggerResult result = orchestrator(saturated).trigger(PROVIDER, SyncType.FULL, SyncTrigger.MANUAL);

        assertThat(result.outcome()).isEqualTo(TriggerResult.Outcome.REJECTED);
        verify(lifecycleManager).failRun(any(SyncRunContext.class), any(SyncRunCounters.class), anyString());
    }

    @Test
    @DisplayName("connectivity failure is retried, then fails the run with a ledger entry")
    void runSync_connectivityFailure() {
        when(lockService.acquire(any())).thenReturn(true);
        when(adapter.fetchChangedRecords(any(), any())).thenThrow(new ConnectivityException("down"));

        orchestrator.trigger(PROVIDER, SyncType.INCREMENTAL, SyncTrigger.MANUAL);

        verify(adapter, times(2)).fetchChangedRecords(any(), any());
        ArgumentCaptor<SyncErrorEntry> error = ArgumentCaptor.forClass(SyncErrorEntry.class);
        verify(errorLedger).record(error.capture());
        assertThat(error.getValue().category()).isEqualTo(SyncErrorCategory.CONNECTIVITY);
        verify(lifecycleManager).failRun(any(SyncRunContext.class), any(SyncRunCounters.class),
                                         eq("Provider unreachable: down"));
        verify(lifecycleManager, never()).completeRun(any(), any());
    }

    @Test
    @DisplayName("rejected credentials fail the run without retrying")
    void runSync_authenticationFailure() {
        when(lockService.acquire(any())).thenReturn(true);
        doThrow(new AuthenticationException("bad token")).when(adapter).connect();

        orchestrator.trigger(PROVIDER, SyncType.INCREMENTAL, SyncTrigger.MANUAL);

        ArgumentCaptor<SyncErrorEntry> error = ArgumentCaptor.forClass(SyncErrorEntry.class);
        verify(errorLedger).record(error.capture());
        assertThat(error.getValue().category()).isEqualTo(SyncErrorCategory.AUTHENTICATION);
        verify(adapter, never()).fetchChangedRecords(any(), any());
        verify(lifecycleManager).failRun(any(SyncRunContext.class), any(SyncRunCounters.class), anyString());
    }

    @Test
    @DisplayName("cancellation is honoured between pages")
    void runSync_cancelBetweenPages() {
        when(lockService.acquire(any())).thenReturn(true);
        when(adapter.fetchChangedRecords(any(), isNull())).thenReturn(new RecordPage(List.of(listing("A", 1)), "1"));
        when(upsertService.upsertBatch(eq(PROVIDER), anyList(), anyString()))
                .thenReturn(List.of(new RecordUpsert("A", 1L, UpsertOutcome.UNCHANGED)));
        when(lockService.isCancelRequested(anyString())).thenReturn(false, true);

        orchestrator.trigger(PROVIDER, SyncType.INCREMENTAL, SyncTrigger.MANUAL);

        verify(adapter, never()).fetchChangedRecords(any(), eq("1"));
        verify(lifecycleManager).cancelRun(any(SyncRunContext.class), any(SyncRunCounters.class));
        verify(lifecycleManager, never()).completeRun(any(), any());
    }

    @Test
    @DisplayName("batch failure falls back to per-record upserts and logs the failing record")
    void runSync_batchFallback() {
        when(lockService.acquire(any())).thenReturn(true);
        configuration.setIncludeMedia(false);
        when(adapter.fetchChangedRecords(any(), any())).thenReturn(new RecordPage(
                List.of(listing("A", 1), listing("B", 2)), null));
        when(upsertService.upsertBatch(eq(PROVIDER), anyList(), anyString()))
                .thenThrow(new IllegalStateException("constraint"));
        when(upsertService.upsertSingle(any(CanonicalProperty.class), anyString())).thenAnswer(invocation -> {
            CanonicalProperty property = invocation.getArgument(0);
            if ("B".equals(property.getExternalId())) {
                throw new IllegalStateException("value too long");
            }
            return new RecordUpsert("A", 1L, UpsertOutcome.CREATED);
        });

        orchestrator.trigger(PROVIDER, SyncType.INCREMENTAL, SyncTrigger.MANUAL);

        ArgumentCaptor<SyncRunCounters> counters = ArgumentCaptor.forClass(SyncRunCounters.class);
        verify(lifecycleManager).completeRun(any(SyncRunContext.class), counters.capture());
        assertThat(counters.getValue().getCreated()).isEqualTo(1);
        assertThat(counters.getValue().getFailed()).isEqualTo(1);
        ArgumentCaptor<SyncErrorEntry> error = ArgumentCaptor.forClass(SyncErrorEntry.class);
        verify(errorLedger).record(error.capture());
        assertThat(error.getValue().category()).isEqualTo(SyncErrorCategory.PERSISTENCE);
        assertThat(error.getValue().externalRecordId()).isEqualTo("B");
        verify(mediaRegistrationService, never()).register(any(), any());
    }
}
