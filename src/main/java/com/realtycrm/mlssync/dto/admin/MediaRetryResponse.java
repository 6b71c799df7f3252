package com.realtycrm.mlssync.dto.admin;

public record MediaRetryResponse(int queued) {
}
