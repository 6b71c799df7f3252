package com.realtycrm.mlssync.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical listing status. Providers report status in their own vocabulary (full words, RETS
 * abbreviations, lifecycle phrases); {@link #normalize(String)} folds them into this enum.
 */
@Getter
@AllArgsConstructor
public enum PropertyStatus {
    ACTIVE(List.of("ACTIVE", "ACT", "A", "NEW", "COMING SOON", "ACTIVE UNDER CONTRACT")),
    PENDING(List.of("PENDING", "PND", "P", "UNDER CONTRACT", "CONTINGENT")),
    SOLD(List.of("SOLD", "SLD", "S", "CLOSED", "CLS")),
    WITHDRAWN(List.of("WITHDRAWN", "WTH", "CANCELLED", "CANCELED", "CAN", "OFF MARKET", "HOLD")),
    EXPIRED(List.of("EXPIRED", "EXP", "X"));

    private static final Map<String, PropertyStatus> ALIASES = new HashMap<>();

    static {
        for (PropertyStatus status : values()) {
            status.aliases.forEach(alias -> ALIASES.put(alias, status));
        }
    }

    private final List<String> aliases;

    /**
     * Resolves a provider status value, ignoring case, surrounding whitespace, underscores and dashes.
     *
     * @param value The raw status string from the provider.
     *
     * @return The canonical status, or empty when the value is not recognised.
     */
    public static Optional<PropertyStatus> normalize(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String key = value.trim().toUpperCase(Locale.ROOT).replace('_', ' ').replace('-', ' ');
        return Optional.ofNullable(ALIASES.get(key.replaceAll("\\s+", " ")));
    }
}
