package com.realtycrm.mlssync.service.provider;

import java.time.Instant;

public record ProviderHealth(Status status, String message, long latencyMs, Instant checkedAt) {

    public enum Status {
        UP,
        DOWN
    }

    public static ProviderHealth up(long latencyMs) {
        return new ProviderHealth(Status.UP, "OK", latencyMs, Instant.now());
    }

    public static ProviderHealth down(String message, long latencyMs) {
        return new ProviderHealth(Status.DOWN, message, latencyMs, Instant.now());
    }
}
