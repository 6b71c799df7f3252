package com.realtycrm.mlssync.dto.admin;

import com.realtycrm.mlssync.model.SyncError;
import com.realtycrm.mlssync.model.SyncErrorCategory;

import java.time.Instant;

public record SyncErrorView(
        Long id,
        String providerId,
        String runId,
        String externalRecordId,
        Long propertyId,
        Long mediaId,
        SyncErrorCategory category,
        String field,
        String message,
        Instant occurredAt,
        boolean resolved,
        Instant resolvedAt
) {

    public static SyncErrorView from(final SyncError error) {
        return new SyncErrorView(error.getId(), error.getProviderId(), error.getRunId(), error.getExternalRecordId(),
                                 error.getPropertyId(), error.getMediaId(), error.getCategory(), error.getField(),
                                 error.getMessage(), error.getOccurredAt(), error.isResolved(),
                                 error.getResolvedAt());
    }
}
