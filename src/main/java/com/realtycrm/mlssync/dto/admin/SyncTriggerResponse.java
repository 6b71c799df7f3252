package com.realtycrm.mlssync.dto.admin;

import com.realtycrm.mlssync.model.SyncType;

public record SyncTriggerResponse(String providerId, String runId, SyncType syncType, String outcome) {
}
