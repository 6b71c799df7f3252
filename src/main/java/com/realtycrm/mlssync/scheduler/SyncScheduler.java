package com.realtycrm.mlssync.scheduler;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import com.realtycrm.mlssync.model.ProviderConfiguration;
import com.realtycrm.mlssync.model.SyncState;
import com.realtycrm.mlssync.model.SyncStatus;
import com.realtycrm.mlssync.model.SyncTrigger;
import com.realtycrm.mlssync.model.SyncType;
import com.realtycrm.mlssync.repository.ProviderConfigurationRepository;
import com.realtycrm.mlssync.repository.SyncStatusRepository;
import com.realtycrm.mlssync.service.sync.SyncOrchestrator;
import com.realtycrm.mlssync.service.sync.SyncRunLifecycleManager;
import com.realtycrm.mlssync.service.sync.TriggerResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Periodically starts due provider syncs. Each provider is judged on its own: a failure for one provider
 * never stops the tick, and runs execute on the sync pool so a slow provider cannot delay the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.sync.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SyncScheduler {

    private final ProviderConfigurationRepository providerConfigurationRepository;
    private final SyncStatusRepository syncStatusRepository;
    private final SyncOrchestrator orchestrator;
    private final SyncRunLifecycleManager lifecycleManager;
    private final MlsSyncProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${app.sync.scheduler.tick-cron}")
    public void tick() {
        final List<ProviderConfiguration> providers = providerConfigurationRepository.findByEnabledTrue();
        log.debug("Scheduler tick: {} enabled providers", providers.size());
        final Instant now = clock.instant();
        for (ProviderConfiguration provider : providers) {
            try {
                checkProvider(provider, now);
            } catch (RuntimeException e) {
                log.error("[{}] Scheduler could not evaluate provider", provider.getProviderId(), e);
            }
        }
    }

    /**
     * Starts a run for {@code provider} when it is due and not already running.
     *
     * @return the trigger result, or empty when nothing was triggered.
     */
    Optional<TriggerResult> checkProvider(final ProviderConfiguration provider, final Instant now) {
        final String providerId = provider.getProviderId();
        final Optional<SyncStatus> status = syncStatusRepository.findByProviderId(providerId);
        if (status.isPresent() && status.get().getState() == SyncState.RUNNING) {
            final Instant staleBefore = now.minus(Duration.ofMinutes(properties.getScheduler().getStaleRunMinutes()));
            final Instant startedAt = status.get().getStartedAt();
            if (startedAt != null && startedAt.isAfter(staleBefore)) {
                log.debug("[{}] Run {} still in progress", providerId, status.get().getCurrentRunId());
                return Optional.empty();
            }
            log.warn("[{}] Run {} has been RUNNING since {}, beyond the {} minute threshold; treating it as crashed",
                     providerId, status.get().getCurrentRunId(), startedAt,
                     properties.getScheduler().getStaleRunMinutes());
            if (!lifecycleManager.abandonStaleRun(providerId, staleBefore)) {
                return Optional.empty();
            }
        }

        if (!isDue(provider, now)) {
            return Optional.empty();
        }
        final SyncType syncType = selectSyncType(provider, now);
        final TriggerResult result = orchestrator.trigger(providerId, syncType, SyncTrigger.SCHEDULED);
        if (!result.isStarted()) {
            log.warn("[{}] Scheduled {} sync not started: {}", providerId, syncType, result.message());
        }
        return Optional.of(result);
    }

    static boolean isDue(final ProviderConfiguration provider, final Instant now) {
        if (provider.getLastSyncedAt() == null) {
            return true;
        }
        final Duration elapsed = Duration.between(provider.getLastSyncedAt(), now);
        return elapsed.compareTo(Duration.ofMinutes(provider.getSyncIntervalMinutes())) >= 0;
    }

    static SyncType selectSyncType(final ProviderConfiguration provider, final Instant now) {
        if (provider.getLastFullSyncAt() == null) {
            return SyncType.FULL;
        }
        final Duration sinceFull = Duration.between(provider.getLastFullSyncAt(), now);
        return sinceFull.compareTo(Duration.ofHours(provider.getFullSyncIntervalHours())) >= 0
               ? SyncType.FULL : SyncType.INCREMENTAL;
    }
}
