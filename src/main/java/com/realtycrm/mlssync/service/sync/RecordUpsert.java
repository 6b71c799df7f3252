package com.realtycrm.mlssync.service.sync;

/**
 * Result of upserting one canonical record.
 */
public record RecordUpsert(String externalId, Long propertyId, UpsertOutcome outcome) {

    public boolean isChanged() {
        return outcome == UpsertOutcome.CREATED || outcome == UpsertOutcome.UPDATED;
    }
}
