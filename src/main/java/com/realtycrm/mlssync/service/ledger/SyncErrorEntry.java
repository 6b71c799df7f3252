package com.realtycrm.mlssync.service.ledger;

import com.realtycrm.mlssync.model.SyncErrorCategory;
import lombok.Builder;

/**
 * Everything the caller knows about one failure; unknown members stay null.
 */
@Builder
public record SyncErrorEntry(
        String providerId,
        String runId,
        String externalRecordId,
        Long propertyId,
        Long mediaId,
        SyncErrorCategory category,
        String field,
        String message
) {
}
