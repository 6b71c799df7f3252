package com.realtycrm.mlssync.dto.admin;

import com.realtycrm.mlssync.model.FieldMappingRule;
import com.realtycrm.mlssync.model.ProviderConfiguration;
import com.realtycrm.mlssync.model.ProviderType;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Provider configuration as shown to operators. Connection parameter values are never exposed, only their names.
 */
public record ProviderConfigurationView(
        String providerId,
        String name,
        ProviderType providerType,
        String endpoint,
        Set<String> connectionParameterNames,
        List<FieldMappingRule> fieldMappings,
        boolean enabled,
        int syncIntervalMinutes,
        int fullSyncIntervalHours,
        boolean includeMedia,
        Integer batchSize,
        Instant lastSyncedAt,
        Instant lastFullSyncAt
) {

    public static ProviderConfigurationView from(final ProviderConfiguration configuration) {
        return new ProviderConfigurationView(configuration.getProviderId(), configuration.getName(),
                                             configuration.getProviderType(), configuration.getEndpoint(),
                                             new TreeSet<>(configuration.getConnectionParameters().keySet()),
                                             List.copyOf(configuration.getFieldMappings()),
                                             configuration.isEnabled(), configuration.getSyncIntervalMinutes(),
                                             configuration.getFullSyncIntervalHours(),
                                             configuration.isIncludeMedia(), configuration.getBatchSize(),
                                             configuration.getLastSyncedAt(), configuration.getLastFullSyncAt());
    }
}
