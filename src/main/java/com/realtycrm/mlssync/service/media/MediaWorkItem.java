package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.model.MediaKind;

/**
 * Detached snapshot of what the pipeline needs to process one media row.
 */
public record MediaWorkItem(
        Long mediaId,
        Long propertyId,
        String providerId,
        String externalListingId,
        String syncRunId,
        String sourceUrl,
        String sourceUrlHash,
        MediaKind mediaKind
) {
}
