package com.realtycrm.mlssync.service.sync;

import com.realtycrm.mlssync.model.SyncType;

/**
 * What happened to a trigger request. {@code SKIPPED} means another run holds the provider's lock, which is
 * an expected outcome rather than an error.
 */
public record TriggerResult(Outcome outcome, String providerId, String runId, SyncType syncType, String message) {

    public enum Outcome {
        STARTED,
        SKIPPED,
        REJECTED
    }

    public static TriggerResult started(String providerId, String runId, SyncType syncType) {
        return new TriggerResult(Outcome.STARTED, providerId, runId, syncType, "Sync started");
    }

    public static TriggerResult skipped(String providerId, SyncType syncType) {
        return new TriggerResult(Outcome.SKIPPED, providerId, null, syncType, "A sync is already running");
    }

    public static TriggerResult rejected(String providerId, String runId, SyncType syncType, String message) {
        return new TriggerResult(Outcome.REJECTED, providerId, runId, syncType, message);
    }

    public boolean isStarted() {
        return outcome == Outcome.STARTED;
    }
}
