package com.realtycrm.mlssync.dto.admin;

import com.realtycrm.mlssync.model.ProviderType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /mls/v1/providers}. An empty mapping list selects the provider type's default table.
 */
public record ProviderConfigurationRequest(
        @NotBlank(message = "The 'providerId' cannot be empty.")
        @Size(max = 64, message = "The 'providerId' cannot exceed 64 characters.")
        @Pattern(regexp = "[A-Za-z0-9_-]+", message = "The 'providerId' may only contain letters, digits, '_' and '-'.")
        String providerId,
        @NotBlank(message = "The 'name' cannot be empty.") String name,
        @NotNull(message = "The 'providerType' is required.") ProviderType providerType,
        String endpoint,
        Map<String, String> connectionParameters,
        @Valid List<FieldMappingRequest> fieldMappings,
        Boolean enabled,
        @Min(value = 15, message = "The 'syncIntervalMinutes' must be at least 15.")
        @Max(value = 1440, message = "The 'syncIntervalMinutes' cannot exceed 1440.")
        Integer syncIntervalMinutes,
        @Positive(message = "The 'fullSyncIntervalHours' must be a positive number.") Integer fullSyncIntervalHours,
        Boolean includeMedia,
        @Positive(message = "The 'batchSize' must be a positive number.") Integer batchSize
) {
}
