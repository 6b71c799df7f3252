package com.realtycrm.mlssync.service.admin;

import com.realtycrm.mlssync.dto.admin.SyncErrorView;
import com.realtycrm.mlssync.dto.admin.SyncHistoryView;
import com.realtycrm.mlssync.dto.admin.SyncStatistics;
import com.realtycrm.mlssync.dto.admin.SyncStatusView;
import com.realtycrm.mlssync.dto.admin.SyncTriggerResponse;
import com.realtycrm.mlssync.exception.ResourceNotFoundException;
import com.realtycrm.mlssync.exception.SyncConflictException;
import com.realtycrm.mlssync.model.MediaStatus;
import com.realtycrm.mlssync.model.PropertyStatus;
import com.realtycrm.mlssync.model.ProviderConfiguration;
import com.realtycrm.mlssync.model.SyncError;
import com.realtycrm.mlssync.model.SyncErrorCategory;
import com.realtycrm.mlssync.model.SyncHistory;
import com.realtycrm.mlssync.model.SyncOutcome;
import com.realtycrm.mlssync.model.SyncState;
import com.realtycrm.mlssync.model.SyncStatus;
import com.realtycrm.mlssync.model.SyncTrigger;
import com.realtycrm.mlssync.model.SyncType;
import com.realtycrm.mlssync.repository.PropertyMediaRepository;
import com.realtycrm.mlssync.repository.PropertyRepository;
import com.realtycrm.mlssync.repository.ProviderConfigurationRepository;
import com.realtycrm.mlssync.repository.SyncHistoryRepository;
import com.realtycrm.mlssync.repository.SyncStatusRepository;
import com.realtycrm.mlssync.service.ledger.SyncErrorLedger;
import com.realtycrm.mlssync.service.media.MediaRetryService;
import com.realtycrm.mlssync.service.provider.MlsProviderAdapter;
import com.realtycrm.mlssync.service.provider.ProviderAdapterFactory;
import com.realtycrm.mlssync.service.provider.ProviderHealth;
import com.realtycrm.mlssync.service.sync.SyncOrchestrator;
import com.realtycrm.mlssync.service.sync.SyncRunLockService;
import com.realtycrm.mlssync.service.sync.TriggerResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read and control operations behind the admin API. Control operations only flip the flags and locks the
 * orchestrator already honours; no synchronization logic lives here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MlsAdminService {

    static final int MAX_ERROR_ROWS = 500;

    private final ProviderConfigurationService providerConfigurationService;
    private final ProviderConfigurationRepository providerConfigurationRepository;
    private final SyncStatusRepository syncStatusRepository;
    private final SyncHistoryRepository syncHistoryRepository;
    private final PropertyRepository propertyRepository;
    private final PropertyMediaRepository mediaRepository;
    private final SyncOrchestrator orchestrator;
    private final SyncRunLockService lockService;
    private final SyncErrorLedger errorLedger;
    private final MediaRetryService mediaRetryService;
    private final ProviderAdapterFactory adapterFactory;
    private final Clock clock;

    /**
     * @throws SyncConflictException when the provider is already running or no worker is free.
     */
    public SyncTriggerResponse triggerSync(final String providerId, final SyncType syncType) {
        final TriggerResult result = orchestrator.trigger(providerId, syncType, SyncTrigger.MANUAL);
        if (!result.isStarted()) {
            throw new SyncConflictException(String.format("Sync for provider '%s' was not started: %s", providerId,
                                                          result.message()));
        }
        return new SyncTriggerResponse(providerId, result.runId(), result.syncType(), result.outcome().name());
    }

    public void cancelSync(final String providerId) {
        providerConfigurationService.get(providerId);
        if (!lockService.requestCancel(providerId)) {
            throw new ResourceNotFoundException("No sync is running for provider '" + providerId + "'");
        }
    }

    @Transactional(readOnly = true)
    public List<SyncStatusView> getStatuses() {
        return providerConfigurationService.list().stream().map(this::toStatusView).toList();
    }

    @Transactional(readOnly = true)
    public SyncStatusView getStatus(final String providerId) {
        return toStatusView(providerConfigurationService.get(providerId));
    }

    /**
     * Newest runs first; all providers when {@code providerId} is null.
     */
    @Transactional(readOnly = true)
    public Page<SyncHistoryView> getHistory(final String providerId, final int page, final int size) {
        final Pageable pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "startedAt"));
        final Page<SyncHistory> rows = providerId == null
                ? syncHistoryRepository.findAll(pageable)
                : syncHistoryRepository.findByProviderId(providerId, pageable);
        return rows.map(SyncHistoryView::from);
    }

    @Transactional(readOnly = true)
    public List<SyncErrorView> getRunErrors(final String runId) {
        if (!syncHistoryRepository.existsByRunId(runId) && syncStatusRepository.findByCurrentRunId(runId).isEmpty()) {
            throw new ResourceNotFoundException("Run " + runId + " not found");
        }
        return errorLedger.findByRun(runId).stream().map(SyncErrorView::from).toList();
    }

    public List<SyncErrorView> getUnresolvedErrors(final String providerId, final SyncErrorCategory category) {
        return errorLedger.findUnresolved(providerId, category, MAX_ERROR_ROWS)
                          .stream()
                          .map(SyncErrorView::from)
                          .toList();
    }

    public Map<SyncErrorCategory, Long> getErrorSummary(final String providerId) {
        return errorLedger.summarizeUnresolved(providerId);
    }

    public SyncErrorView resolveError(final Long errorId) {
        final SyncError resolved = errorLedger.resolve(errorId);
        return SyncErrorView.from(resolved);
    }

    @Transactional(readOnly = true)
    public SyncStatistics getStatistics() {
        final Instant dayAgo = clock.instant().minus(Duration.ofHours(24));
        final Map<PropertyStatus, Long> propertiesByStatus = new EnumMap<>(PropertyStatus.class);
        propertyRepository.countGroupedByStatus()
                          .forEach(row -> propertiesByStatus.put((PropertyStatus) row[0], ((Number) row[1]).longValue()));
        final Map<MediaStatus, Long> mediaByStatus = new EnumMap<>(MediaStatus.class);
        mediaRepository.countGroupedByStatus()
                       .forEach(row -> mediaByStatus.put((MediaStatus) row[0], ((Number) row[1]).longValue()));
        final Map<SyncErrorCategory, Long> errorsByCategory = errorLedger.summarizeUnresolved(null);

        return SyncStatistics.builder()
                             .providersTotal(providerConfigurationRepository.count())
                             .providersEnabled(providerConfigurationRepository.countByEnabledTrue())
                             .providersRunning(syncStatusRepository.countByState(SyncState.RUNNING))
                             .propertiesTotal(propertyRepository.count())
                             .propertiesByStatus(propertiesByStatus)
                             .mediaByStatus(mediaByStatus)
                             .mediaDegraded(mediaRepository.countByDegradedTrue())
                             .unresolvedErrors(errorsByCategory.values().stream().mapToLong(Long::longValue).sum())
                             .unresolvedErrorsByCategory(errorsByCategory)
                             .runsLast24Hours(syncHistoryRepository.countByStartedAtAfter(dayAgo))
                             .failedRunsLast24Hours(
                                     syncHistoryRepository.countByStartedAtAfterAndOutcome(dayAgo, SyncOutcome.FAILED))
                             .successRate(rate(syncHistoryRepository.countByOutcome(SyncOutcome.SUCCESS),
                                               syncHistoryRepository.count()))
                             .build();
    }

    /**
     * Checks the provider with a throwaway adapter. Failures are reported, never thrown.
     */
    public ProviderHealth checkHealth(final String providerId) {
        final ProviderConfiguration configuration = providerConfigurationService.get(providerId);
        MlsProviderAdapter adapter = null;
        try {
            adapter = adapterFactory.create(configuration);
            return adapter.healthCheck();
        } catch (RuntimeException e) {
            log.warn("[{}] Health check could not run: {}", providerId, e.getMessage());
            return ProviderHealth.down(e.getMessage(), 0);
        } finally {
            if (adapter != null) {
                adapter.disconnect();
            }
        }
    }

    public int retryMedia(final Long mediaId) {
        return mediaRetryService.retry(mediaId) ? 1 : 0;
    }

    public int retryFailedMedia(final String providerId) {
        providerConfigurationService.get(providerId);
        return mediaRetryService.retryFailed(providerId);
    }

    private SyncStatusView toStatusView(final ProviderConfiguration configuration) {
        final String providerId = configuration.getProviderId();
        final SyncStatus status = syncStatusRepository.findByProviderId(providerId).orElseGet(() -> {
            final SyncStatus idle = new SyncStatus();
            idle.setProviderId(providerId);
            idle.setState(SyncState.IDLE);
            return idle;
        });
        return SyncStatusView.builder()
                             .providerId(providerId)
                             .providerName(configuration.getName())
                             .enabled(configuration.isEnabled())
                             .state(status.getState())
                             .currentRunId(status.getCurrentRunId())
                             .syncType(status.getSyncType())
                             .syncTrigger(status.getSyncTrigger())
                             .startedAt(status.getStartedAt())
                             .finishedAt(status.getFinishedAt())
                             .processedCount(status.getProcessedCount())
                             .createdCount(status.getCreatedCount())
                             .updatedCount(status.getUpdatedCount())
                             .unchangedCount(status.getUnchangedCount())
                             .failedCount(status.getFailedCount())
                             .cancelRequested(status.isCancelRequested())
                             .lastError(status.getLastError())
                             .lastSuccessAt(status.getLastSuccessAt())
                             .lastSyncedAt(configuration.getLastSyncedAt())
                             .lastFullSyncAt(configuration.getLastFullSyncAt())
                             .consecutiveFailures(status.getConsecutiveFailures())
                             .totalRuns(status.getTotalRuns())
                             .successRate(rate(syncHistoryRepository.countByProviderIdAndOutcome(providerId,
                                                                                                 SyncOutcome.SUCCESS),
                                               syncHistoryRepository.countByProviderId(providerId)))
                             .build();
    }

    private static Double rate(final long successes, final long total) {
        return total == 0 ? null : (double) successes / total;
    }
}
