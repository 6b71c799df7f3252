package com.realtycrm.mlssync.service.sync;

import lombok.Getter;

/**
 * Running totals of one run. Confined to the run's thread.
 */
@Getter
public class SyncRunCounters {

    private int processed;
    private int created;
    private int updated;
    private int unchanged;
    private int failed;
    private int mediaQueued;

    void recordReceived(int count) {
        processed += count;
    }

    void recordCreated() {
        created++;
    }

    void recordUpdated() {
        updated++;
    }

    void recordUnchanged() {
        unchanged++;
    }

    void recordFailed() {
        failed++;
    }

    void recordMediaQueued(int count) {
        mediaQueued += count;
    }

    @Override
    public String toString() {
        return String.format("processed=%d, created=%d, updated=%d, unchanged=%d, failed=%d, mediaQueued=%d",
                             processed, created, updated, unchanged, failed, mediaQueued);
    }
}
