package com.realtycrm.mlssync.service.sync;

import com.realtycrm.mlssync.exception.AuthenticationException;
import com.realtycrm.mlssync.exception.ConnectivityException;
import com.realtycrm.mlssync.exception.MappingException;
import com.realtycrm.mlssync.exception.ResourceNotFoundException;
import com.realtycrm.mlssync.model.CanonicalField;
import com.realtycrm.mlssync.model.FieldMappingRule;
import com.realtycrm.mlssync.model.ProviderConfiguration;
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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Drives one synchronization run per trigger: acquire the provider's run lock, page through the adapter,
 * map and upsert each page, queue media for changed listings, and finalize.
 * <p>
 * Record-level failures (mapping, persistence, media) are written to the error ledger and the run carries on.
 * Authentication and connectivity failures end the run as FAILED. Cancellation is checked before each page.
 */
@Slf4j
@Service
public class SyncOrchestrator {

    private final ProviderConfigurationRepository providerConfigurationRepository;
    private final ProviderAdapterFactory adapterFactory;
    private final FieldMapper fieldMapper;
    private final PropertyUpsertService upsertService;
    private final MediaRegistrationService mediaRegistrationService;
    private final SyncRunLockService lockService;
    private final SyncRunLifecycleManager lifecycleManager;
    private final SyncErrorLedger errorLedger;
    private final RetryTemplate fetchRetryTemplate;
    private final AsyncTaskExecutor syncRunExecutor;
    private final Clock clock;

    public SyncOrchestrator(final ProviderConfigurationRepository providerConfigurationRepository,
                            final ProviderAdapterFactory adapterFactory,
                            final FieldMapper fieldMapper,
                            final PropertyUpsertService upsertService,
                            final MediaRegistrationService mediaRegistrationService,
                            final SyncRunLockService lockService,
                            final SyncRunLifecycleManager lifecycleManager,
                            final SyncErrorLedger errorLedger,
                            @Qualifier("providerFetchRetryTemplate") final RetryTemplate fetchRetryTemplate,
                            @Qualifier("syncRunExecutor") final AsyncTaskExecutor syncRunExecutor,
                            final Clock clock) {
        this.providerConfigurationRepository = providerConfigurationRepository;
        this.adapterFactory = adapterFactory;
        this.fieldMapper = fieldMapper;
        this.upsertService = upsertService;
        this.mediaRegistrationService = mediaRegistrationService;
        this.lockService = lockService;
        this.lifecycleManager = lifecycleManager;
        this.errorLedger = errorLedger;
        this.fetchRetryTemplate = fetchRetryTemplate;
        this.syncRunExecutor = syncRunExecutor;
        this.clock = clock;
    }

    /**
     * Starts a run for {@code providerId} on the sync executor and returns without waiting for it.
     *
     * @return {@code SKIPPED} when another run holds the lock, {@code REJECTED} when the executor is saturated.
     *
     * @throws ResourceNotFoundException when the provider is not configured.
     */
    public TriggerResult trigger(final String providerId, final SyncType requestedType, final SyncTrigger trigger) {
        final ProviderConfiguration configuration = providerConfigurationRepository
                .findByProviderId(providerId)
                .orElseThrow(() -> new ResourceNotFoundException("Provider '" + providerId + "' is not configured"));

        SyncType syncType = requestedType == null ? SyncType.INCREMENTAL : requestedType;
        if (syncType == SyncType.INCREMENTAL && configuration.getLastSyncedAt() == null) {
            log.info("[{}] No previous sync recorded; running a full sync instead", providerId);
            syncType = SyncType.FULL;
        }

        final SyncRunContext context = SyncRunContext.builder()
                                                     .runId(UUID.randomUUID().toString())
                                                     .providerId(providerId)
                                                     .syncType(syncType)
                                                     .trigger(trigger)
                                                     .startedAt(clock.instant())
                                                     .since(syncType == SyncType.FULL ? null
                                                                                      : configuration.getLastSyncedAt())
                                                     .batchSize(adapterFactory.pageSize(configuration))
                                                     .includeMedia(configuration.isIncludeMedia())
                                                     .fieldMappings(List.copyOf(configuration.getFieldMappings()))
                                                     .build();

        if (!lockService.acquire(context)) {
            return TriggerResult.skipped(providerId, syncType);
        }

        try {
            syncRunExecutor.execute(() -> runSync(context, configuration));
        } catch (TaskRejectedException e) {
            log.error("[{}] Sync executor rejected run {}", providerId, context.runId(), e);
            lifecycleManager.failRun(context, new SyncRunCounters(), "Sync executor is saturated");
            return TriggerResult.rejected(providerId, context.runId(), syncType, "Sync executor is saturated");
        }
        log.info("[{}] {} {} sync started as run {}", providerId, trigger, syncType, context.runId());
        return TriggerResult.started(providerId, context.runId(), syncType);
    }

    /**
     * Executes a run whose lock is already held. Always releases the lock before returning.
     */
    void runSync(final SyncRunContext context, final ProviderConfiguration configuration) {
        final SyncRunCounters counters = new SyncRunCounters();
        MlsProviderAdapter adapter = null;
        try {
            adapter = adapterFactory.create(configuration);
            adapter.connect();

            String cursor = null;
            int pageNumber = 0;
            do {
                if (lockService.isCancelRequested(context.runId())) {
                    lifecycleManager.cancelRun(context, counters);
                    return;
                }
                final RecordPage page = fetchPage(adapter, context, cursor);
                pageNumber++;
                log.info("[{}] Run {} fetched page {} with {} records", context.providerId(), context.runId(),
                         pageNumber, page.records().size());
                processPage(context, adapter, page, counters);
                lockService.updateProgress(context.runId(), counters);
                cursor = page.nextCursor();
            } while (cursor != null);

            lifecycleManager.completeRun(context, counters);
        } catch (AuthenticationException e) {
            recordRunError(context, SyncErrorCategory.AUTHENTICATION, e.getMessage());
            lifecycleManager.failRun(context, counters, "Authentication failed: " + e.getMessage());
        } catch (ConnectivityException e) {
            recordRunError(context, SyncErrorCategory.CONNECTIVITY, e.getMessage());
            lifecycleManager.failRun(context, counters, "Provider unreachable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Run {} aborted by an unexpected error", context.providerId(), context.runId(), e);
            lifecycleManager.failRun(context, counters, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            if (adapter != null) {
                adapter.disconnect();
            }
        }
    }

    private RecordPage fetchPage(final MlsProviderAdapter adapter, final SyncRunContext context,
                                 final String cursor) {
        return fetchRetryTemplate.execute(retryContext -> adapter.fetchChangedRecords(context.since(), cursor));
    }

    private void processPage(final SyncRunContext context, final MlsProviderAdapter adapter,
                             final RecordPage page, final SyncRunCounters counters) {
        // Duplicate ids within a page: the last occurrence wins.
        final Map<String, CanonicalProperty> mapped = new LinkedHashMap<>();
        int mappingFailures = 0;
        for (ProviderRecord record : page.records()) {
            try {
                final CanonicalProperty property = fieldMapper.map(record, context.fieldMappings(),
                                                                   context.providerId());
                mapped.put(property.getExternalId(), property);
            } catch (MappingException e) {
                mappingFailures++;
                errorLedger.record(SyncErrorEntry.builder()
                                                 .providerId(context.providerId())
                                                 .runId(context.runId())
                                                 .externalRecordId(rawExternalId(record, context.fieldMappings()))
                                                 .category(SyncErrorCategory.MAPPING)
                                                 .field(e.getField())
                                                 .message(e.getMessage())
                                                 .build());
            }
        }
        counters.recordReceived(mapped.size() + mappingFailures);
        for (int i = 0; i < mappingFailures; i++) {
            counters.recordFailed();
        }
        if (mapped.isEmpty()) {
            return;
        }

        final List<RecordUpsert> results = upsert(context, new ArrayList<>(mapped.values()), counters);
        for (RecordUpsert result : results) {
            switch (result.outcome()) {
                case CREATED -> counters.recordCreated();
                case UPDATED -> counters.recordUpdated();
                case UNCHANGED, STALE -> counters.recordUnchanged();
            }
        }

        if (context.includeMedia()) {
            results.stream()
                   .filter(RecordUpsert::isChanged)
                   .forEach(result -> queueMedia(context, adapter, result, counters));
        }
    }

    private List<RecordUpsert> upsert(final SyncRunContext context, final List<CanonicalProperty> batch,
                                      final SyncRunCounters counters) {
        try {
            return upsertService.upsertBatch(context.providerId(), batch, context.runId());
        } catch (RuntimeException e) {
            log.warn("[{}] Batch upsert of {} records failed in run {}; retrying record by record: {}",
                     context.providerId(), batch.size(), context.runId(), e.getMessage());
        }

        final List<RecordUpsert> results = new ArrayList<>(batch.size());
        for (CanonicalProperty property : batch) {
            try {
                results.add(upsertService.upsertSingle(property, context.runId()));
            } catch (RuntimeException e) {
                counters.recordFailed();
                errorLedger.record(SyncErrorEntry.builder()
                                                 .providerId(context.providerId())
                                                 .runId(context.runId())
                                                 .externalRecordId(property.getExternalId())
                                                 .category(SyncErrorCategory.PERSISTENCE)
                                                 .message(e.getMessage())
                                                 .build());
            }
        }
        return results;
    }

    private void queueMedia(final SyncRunContext context, final MlsProviderAdapter adapter,
                            final RecordUpsert result, final SyncRunCounters counters) {
        try {
            final List<MediaReference> references = adapter.fetchMediaReferences(result.externalId());
            counters.recordMediaQueued(mediaRegistrationService.register(result.propertyId(), references));
        } catch (RuntimeException e) {
            errorLedger.record(SyncErrorEntry.builder()
                                             .providerId(context.providerId())
                                             .runId(context.runId())
                                             .externalRecordId(result.externalId())
                                             .propertyId(result.propertyId())
                                             .category(SyncErrorCategory.MEDIA)
                                             .message("Could not list media: " + e.getMessage())
                                             .build());
        }
    }

    private void recordRunError(final SyncRunContext context, final SyncErrorCategory category,
                                final String message) {
        errorLedger.record(SyncErrorEntry.builder()
                                         .providerId(context.providerId())
                                         .runId(context.runId())
                                         .category(category)
                                         .message(message)
                                         .build());
    }

    private static String rawExternalId(final ProviderRecord record, final List<FieldMappingRule> rules) {
        return rules.stream()
                    .filter(rule -> rule.getTargetField() == CanonicalField.EXTERNAL_ID)
                    .map(rule -> record.valueAt(rule.getSourcePath()))
                    .filter(Objects::nonNull)
                    .map(String::valueOf)
                    .findFirst()
                    .orElse(null);
    }
}
