package com.realtycrm.mlssync.controller;

import com.realtycrm.mlssync.dto.admin.MediaRetryResponse;
import com.realtycrm.mlssync.dto.admin.ProviderConfigurationRequest;
import com.realtycrm.mlssync.dto.admin.ProviderConfigurationView;
import com.realtycrm.mlssync.dto.admin.SyncErrorView;
import com.realtycrm.mlssync.dto.admin.SyncHistoryView;
import com.realtycrm.mlssync.dto.admin.SyncStatistics;
import com.realtycrm.mlssync.dto.admin.SyncStatusView;
import com.realtycrm.mlssync.dto.admin.SyncTriggerResponse;
import com.realtycrm.mlssync.dto.common.ApiResponse;
import com.realtycrm.mlssync.model.SyncErrorCategory;
import com.realtycrm.mlssync.model.SyncType;
import com.realtycrm.mlssync.service.provider.ProviderHealth;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;
import java.util.Map;

@Tag(name = "MLS Sync Administration", description = "Endpoints for triggering and monitoring provider synchronization, inspecting the error ledger and managing provider configurations.")
public interface MlsAdminApi {

    @Operation(summary = "Trigger a Sync",
            description = "Starts a synchronization run for the provider. The run executes in the background; the response carries its run id. An incremental sync of a provider that never synced runs as a full sync.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Sync started.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Started", value = """
                                    {
                                        "displayMessage": "Sync started for provider 'crmls'.",
                                        "response": {
                                            "providerId": "crmls",
                                            "runId": "7f0c5e0e-8a7b-4c36-9d0e-1c2b3f4a5d6e",
                                            "syncType": "INCREMENTAL",
                                            "outcome": "STARTED"
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The provider is not configured.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - A sync is already running for this provider.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<SyncTriggerResponse>> triggerSync(
            @Parameter(description = "Identifier of the provider.", required = true, example = "crmls")
            @PathVariable String providerId,
            @Parameter(description = "FULL re-evaluates every listing; INCREMENTAL only changes since the last sync.")
            @RequestParam(value = "type", defaultValue = "INCREMENTAL") SyncType type);

    @Operation(summary = "Cancel a Running Sync",
            description = "Requests cancellation of the provider's running sync. The run stops at its next batch boundary; records already written are kept.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Cancellation requested."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown provider or no sync running.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Void>> cancelSync(
            @Parameter(description = "Identifier of the provider.", required = true) @PathVariable String providerId);

    @Operation(summary = "Get All Sync Statuses", description = "Live sync state of every configured provider.")
    ResponseEntity<ApiResponse<List<SyncStatusView>>> getStatuses();

    @Operation(summary = "Get Sync Status", description = "Live sync state of one provider, including its historical success rate.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status retrieved."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - The provider is not configured.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<SyncStatusView>> getStatus(
            @Parameter(description = "Identifier of the provider.", required = true) @PathVariable String providerId);

    @Operation(summary = "Get Sync History", description = "Paged list of finished runs, newest first, optionally for one provider.")
    ResponseEntity<ApiResponse<Page<SyncHistoryView>>> getHistory(
            @Parameter(description = "Restrict to one provider.") @RequestParam(value = "providerId", required = false) String providerId,
            @Parameter(description = "Zero-based page index.") @RequestParam(value = "page", defaultValue = "0") @PositiveOrZero(message = "The 'page' cannot be negative.") int page,
            @Parameter(description = "Page size (1-200).") @RequestParam(value = "size", defaultValue = "20") @Min(value = 1, message = "The 'size' must be at least 1.") @Max(value = 200, message = "The 'size' cannot exceed 200.") int size);

    @Operation(summary = "Get Errors of a Run", description = "Every ledger entry written by one run, oldest first: the failed external identifiers and their reasons.")
    ResponseEntity<ApiResponse<List<SyncErrorView>>> getRunErrors(
            @Parameter(description = "The run id.", required = true) @PathVariable String runId);

    @Operation(summary = "Get Unresolved Errors", description = "Unresolved error ledger entries, newest first, optionally filtered by provider and category.")
    ResponseEntity<ApiResponse<List<SyncErrorView>>> getUnresolvedErrors(
            @Parameter(description = "Restrict to one provider.") @RequestParam(value = "providerId", required = false) String providerId,
            @Parameter(description = "Restrict to one category.") @RequestParam(value = "category", required = false) SyncErrorCategory category);

    @Operation(summary = "Summarize Unresolved Errors", description = "Count of unresolved errors per category.")
    ResponseEntity<ApiResponse<Map<SyncErrorCategory, Long>>> getErrorSummary(
            @Parameter(description = "Restrict to one provider.") @RequestParam(value = "providerId", required = false) String providerId);

    @Operation(summary = "Resolve an Error", description = "Marks a ledger entry as handled.")
    ResponseEntity<ApiResponse<SyncErrorView>> resolveError(
            @Parameter(description = "The error id.", required = true) @PathVariable @Positive(message = "The 'errorId' must be a positive number.") Long errorId);

    @Operation(summary = "Get Statistics", description = "Engine-wide aggregates: providers, properties, media and run outcomes.")
    ResponseEntity<ApiResponse<SyncStatistics>> getStatistics();

    @Operation(summary = "List Providers", description = "All provider configurations. Connection parameter values are not returned.")
    ResponseEntity<ApiResponse<List<ProviderConfigurationView>>> listProviders();

    @Operation(summary = "Get Provider", description = "One provider configuration.")
    ResponseEntity<ApiResponse<ProviderConfigurationView>> getProvider(
            @Parameter(description = "Identifier of the provider.", required = true) @PathVariable String providerId);

    @Operation(summary = "Create Provider",
            description = "Registers a new MLS provider. When no field mappings are given the default RESO mapping table is applied.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Provider created."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid configuration.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The provider id is taken.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProviderConfigurationView>> createProvider(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "The provider configuration.", required = true)
            @Valid @RequestBody ProviderConfigurationRequest request);

    @Operation(summary = "Enable or Disable a Provider", description = "Disabled providers are skipped by the scheduler; manual triggers still work.")
    ResponseEntity<ApiResponse<ProviderConfigurationView>> setProviderEnabled(
            @Parameter(description = "Identifier of the provider.", required = true) @PathVariable String providerId,
            @Parameter(description = "The new enabled flag.", required = true) @RequestParam("value") boolean value);

    @Operation(summary = "Update Sync Interval", description = "Sets the scheduled sync interval, between 15 and 1440 minutes.")
    ResponseEntity<ApiResponse<ProviderConfigurationView>> setProviderInterval(
            @Parameter(description = "Identifier of the provider.", required = true) @PathVariable String providerId,
            @Parameter(description = "Interval in minutes.", required = true, example = "60") @RequestParam("minutes") int minutes);

    @Operation(summary = "Check Provider Health", description = "Calls the provider's API with its stored credentials.")
    ResponseEntity<ApiResponse<ProviderHealth>> checkProviderHealth(
            @Parameter(description = "Identifier of the provider.", required = true) @PathVariable String providerId);

    @Operation(summary = "Retry a Media Item", description = "Queues one media row for reprocessing unless it is already fully processed.")
    ResponseEntity<ApiResponse<MediaRetryResponse>> retryMedia(
            @Parameter(description = "The media id.", required = true) @PathVariable @Positive(message = "The 'mediaId' must be a positive number.") Long mediaId);

    @Operation(summary = "Retry Failed Media", description = "Queues every failed media row of a provider for reprocessing.")
    ResponseEntity<ApiResponse<MediaRetryResponse>> retryFailedMedia(
            @Parameter(description = "Identifier of the provider.", required = true) @RequestParam("providerId") String providerId);
}
