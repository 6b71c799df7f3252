package com.realtycrm.mlssync.service.sync;

import com.realtycrm.mlssync.model.FieldMappingRule;
import com.realtycrm.mlssync.model.SyncTrigger;
import com.realtycrm.mlssync.model.SyncType;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Immutable facts about one run, fixed when the run lock is acquired.
 *
 * @param since {@code null} for a full run, otherwise the lower bound of the incremental window.
 */
@Builder
public record SyncRunContext(
        String runId,
        String providerId,
        SyncType syncType,
        SyncTrigger trigger,
        Instant startedAt,
        Instant since,
        int batchSize,
        boolean includeMedia,
        List<FieldMappingRule> fieldMappings
) {
}
