package com.realtycrm.mlssync.dto.admin;

import com.realtycrm.mlssync.model.MediaStatus;
import com.realtycrm.mlssync.model.PropertyStatus;
import com.realtycrm.mlssync.model.SyncErrorCategory;
import lombok.Builder;

import java.util.Map;

/**
 * Engine-wide aggregates for the operator dashboard.
 */
@Builder
public record SyncStatistics(
        long providersTotal,
        long providersEnabled,
        long providersRunning,
        long propertiesTotal,
        Map<PropertyStatus, Long> propertiesByStatus,
        Map<MediaStatus, Long> mediaByStatus,
        long mediaDegraded,
        long unresolvedErrors,
        Map<SyncErrorCategory, Long> unresolvedErrorsByCategory,
        long runsLast24Hours,
        long failedRunsLast24Hours,
        Double successRate
) {
}
