package com.realtycrm.mlssync.service.admin;

import com.realtycrm.mlssync.dto.admin.FieldMappingRequest;
import com.realtycrm.mlssync.dto.admin.ProviderConfigurationRequest;
import com.realtycrm.mlssync.exception.InvalidRequestException;
import com.realtycrm.mlssync.exception.ResourceNotFoundException;
import com.realtycrm.mlssync.exception.SyncConflictException;
import com.realtycrm.mlssync.model.CanonicalField;
import com.realtycrm.mlssync.model.FieldMappingRule;
import com.realtycrm.mlssync.model.ProviderConfiguration;
import com.realtycrm.mlssync.model.ProviderType;
import com.realtycrm.mlssync.model.SyncState;
import com.realtycrm.mlssync.model.SyncStatus;
import com.realtycrm.mlssync.repository.ProviderConfigurationRepository;
import com.realtycrm.mlssync.repository.SyncStatusRepository;
import com.realtycrm.mlssync.service.mapping.DefaultFieldMappings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator management of provider configurations. Only the operator-owned fields are written here; sync
 * bookkeeping belongs to the run lifecycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderConfigurationService {

    static final int MIN_INTERVAL_MINUTES = 15;
    static final int MAX_INTERVAL_MINUTES = 1440;

    private final ProviderConfigurationRepository providerConfigurationRepository;
    private final SyncStatusRepository syncStatusRepository;

    @Transactional
    public ProviderConfiguration create(final ProviderConfigurationRequest request) {
        final String providerId = request.providerId().trim();
        if (providerConfigurationRepository.existsByProviderId(providerId)) {
            throw new SyncConflictException("Provider '" + providerId + "' already exists");
        }
        if (request.providerType() == ProviderType.RESO_WEB_API && !StringUtils.hasText(request.endpoint())) {
            throw new InvalidRequestException("A RESO Web API provider requires an 'endpoint'");
        }

        final ProviderConfiguration configuration = new ProviderConfiguration();
        configuration.setProviderId(providerId);
        configuration.setName(request.name().trim());
        configuration.setProviderType(request.providerType());
        configuration.setEndpoint(request.endpoint());
        if (request.connectionParameters() != null) {
            configuration.setConnectionParameters(new HashMap<>(request.connectionParameters()));
        }
        if (CollectionUtils.isEmpty(request.fieldMappings())) {
            configuration.setFieldMappings(DefaultFieldMappings.forType(request.providerType()));
        } else {
            final List<FieldMappingRule> rules = request.fieldMappings().stream()
                                                        .map(FieldMappingRequest::toRule)
                                                        .collect(Collectors.toCollection(ArrayList::new));
            requireExternalId(rules);
            configuration.setFieldMappings(rules);
        }
        if (request.enabled() != null) {
            configuration.setEnabled(request.enabled());
        }
        if (request.syncIntervalMinutes() != null) {
            configuration.setSyncIntervalMinutes(request.syncIntervalMinutes());
        }
        if (request.fullSyncIntervalHours() != null) {
            configuration.setFullSyncIntervalHours(request.fullSyncIntervalHours());
        }
        if (request.includeMedia() != null) {
            configuration.setIncludeMedia(request.includeMedia());
        }
        configuration.setBatchSize(request.batchSize());

        final ProviderConfiguration saved = providerConfigurationRepository.save(configuration);
        if (syncStatusRepository.findByProviderId(providerId).isEmpty()) {
            final SyncStatus status = new SyncStatus();
            status.setProviderId(providerId);
            status.setState(SyncState.IDLE);
            syncStatusRepository.save(status);
        }
        log.info("Provider '{}' ({}) created with {} mapping rules", providerId, saved.getProviderType(),
                 saved.getFieldMappings().size());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ProviderConfiguration> list() {
        return providerConfigurationRepository.findAll(Sort.by("providerId"));
    }

    @Transactional(readOnly = true)
    public ProviderConfiguration get(final String providerId) {
        return providerConfigurationRepository.findByProviderId(providerId)
                                              .orElseThrow(() -> new ResourceNotFoundException(
                                                      "Provider '" + providerId + "' is not configured"));
    }

    @Transactional
    public ProviderConfiguration setEnabled(final String providerId, final boolean enabled) {
        final ProviderConfiguration configuration = get(providerId);
        configuration.setEnabled(enabled);
        log.info("Provider '{}' {}", providerId, enabled ? "enabled" : "disabled");
        return providerConfigurationRepository.save(configuration);
    }

    @Transactional
    public ProviderConfiguration setSyncInterval(final String providerId, final int minutes) {
        if (minutes < MIN_INTERVAL_MINUTES || minutes > MAX_INTERVAL_MINUTES) {
            throw new InvalidRequestException(String.format("Sync interval must be between %d and %d minutes",
                                                            MIN_INTERVAL_MINUTES, MAX_INTERVAL_MINUTES));
        }
        final ProviderConfiguration configuration = get(providerId);
        configuration.setSyncIntervalMinutes(minutes);
        log.info("Provider '{}' sync interval set to {} minutes", providerId, minutes);
        return providerConfigurationRepository.save(configuration);
    }

    private static void requireExternalId(final List<FieldMappingRule> rules) {
        final boolean mapped = rules.stream().anyMatch(rule -> rule.getTargetField() == CanonicalField.EXTERNAL_ID);
        if (!mapped) {
            throw new InvalidRequestException("The field mappings must map " + CanonicalField.EXTERNAL_ID);
        }
    }
}
