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
import com.realtycrm.mlssync.service.admin.MlsAdminService;
import com.realtycrm.mlssync.service.admin.ProviderConfigurationService;
import com.realtycrm.mlssync.service.provider.ProviderHealth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the operator dashboard: sync control, status, history, the error ledger and provider
 * configuration. All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/mls/v1")
@RequiredArgsConstructor
@Validated
public class MlsAdminController implements MlsAdminApi {

    private final MlsAdminService adminService;
    private final ProviderConfigurationService providerConfigurationService;

    // --- 1. SYNC CONTROL ---

    @Override
    @PostMapping("/sync/{providerId}")
    public ResponseEntity<ApiResponse<SyncTriggerResponse>> triggerSync(
            @PathVariable final String providerId,
            @RequestParam(value = "type", defaultValue = "INCREMENTAL") final SyncType type) {

        log.info("Manual {} sync requested for provider '{}'", type, providerId);
        final SyncTriggerResponse responseData = adminService.triggerSync(providerId, type);

        final ApiResponse<SyncTriggerResponse> response = ApiResponse.<SyncTriggerResponse>builder()
                .response(responseData)
                .displayMessage(String.format("Sync started for provider '%s'.", providerId))
                .showMessage(true)
                .statusCode(HttpStatus.ACCEPTED.value())
                .build();

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @Override
    @PostMapping("/sync/{providerId}/cancel")
    public ResponseEntity<ApiResponse<Void>> cancelSync(@PathVariable final String providerId) {
        log.info("Cancellation requested for provider '{}'", providerId);
        adminService.cancelSync(providerId);

        final ApiResponse<Void> response = ApiResponse.<Void>builder()
                .displayMessage(String.format("Cancellation requested for provider '%s'. The run stops at its next batch boundary.", providerId))
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    // --- 2. STATUS & HISTORY ---

    @Override
    @GetMapping("/status")
    public ResponseEntity<ApiResponse<List<SyncStatusView>>> getStatuses() {
        return ok(adminService.getStatuses(), "Sync statuses retrieved successfully.");
    }

    @Override
    @GetMapping("/status/{providerId}")
    public ResponseEntity<ApiResponse<SyncStatusView>> getStatus(@PathVariable final String providerId) {
        return ok(adminService.getStatus(providerId), "Sync status retrieved successfully.");
    }

    @Override
    @GetMapping("/history")
    public ResponseEntity<ApiResponse<Page<SyncHistoryView>>> getHistory(
            @RequestParam(value = "providerId", required = false) final String providerId,
            @RequestParam(value = "page", defaultValue = "0") final int page,
            @RequestParam(value = "size", defaultValue = "20") final int size) {
        return ok(adminService.getHistory(providerId, page, size), "Sync history retrieved successfully.");
    }

    @Override
    @GetMapping("/history/{runId}/errors")
    public ResponseEntity<ApiResponse<List<SyncErrorView>>> getRunErrors(@PathVariable final String runId) {
        return ok(adminService.getRunErrors(runId), "Run errors retrieved successfully.");
    }

    // --- 3. ERROR LEDGER ---

    @Override
    @GetMapping("/errors")
    public ResponseEntity<ApiResponse<List<SyncErrorView>>> getUnresolvedErrors(
            @RequestParam(value = "providerId", required = false) final String providerId,
            @RequestParam(value = "category", required = false) final SyncErrorCategory category) {
        return ok(adminService.getUnresolvedErrors(providerId, category), "Unresolved errors retrieved successfully.");
    }

    @Override
    @GetMapping("/errors/summary")
    public ResponseEntity<ApiResponse<Map<SyncErrorCategory, Long>>> getErrorSummary(
            @RequestParam(value = "providerId", required = false) final String providerId) {
        return ok(adminService.getErrorSummary(providerId), "Error summary retrieved successfully.");
    }

    @Override
    @PostMapping("/errors/{errorId}/resolve")
    public ResponseEntity<ApiResponse<SyncErrorView>> resolveError(
            @PathVariable final Long errorId) {
        log.info("Resolving sync error {}", errorId);
        return ok(adminService.resolveError(errorId), "Error marked as resolved.");
    }

    @Override
    @GetMapping("/statistics")
    public ResponseEntity<ApiResponse<SyncStatistics>> getStatistics() {
        return ok(adminService.getStatistics(), "Statistics retrieved successfully.");
    }

    // --- 4. PROVIDER CONFIGURATION ---

    @Override
    @GetMapping("/providers")
    public ResponseEntity<ApiResponse<List<ProviderConfigurationView>>> listProviders() {
        final List<ProviderConfigurationView> providers = providerConfigurationService.list()
                                                                                      .stream()
                                                                                      .map(ProviderConfigurationView::from)
                                                                                      .toList();
        return ok(providers, "Providers retrieved successfully.");
    }

    @Override
    @GetMapping("/providers/{providerId}")
    public ResponseEntity<ApiResponse<ProviderConfigurationView>> getProvider(@PathVariable final String providerId) {
        return ok(ProviderConfigurationView.from(providerConfigurationService.get(providerId)),
                  "Provider retrieved successfully.");
    }

    @Override
    @PostMapping("/providers")
    public ResponseEntity<ApiResponse<ProviderConfigurationView>> createProvider(
            @RequestBody final ProviderConfigurationRequest request) {
        log.info("Creating provider '{}' of type {}", request.providerId(), request.providerType());
        final ProviderConfigurationView responseData = ProviderConfigurationView.from(
                providerConfigurationService.create(request));

        final ApiResponse<ProviderConfigurationView> response = ApiResponse.<ProviderConfigurationView>builder()
                .response(responseData)
                .displayMessage(String.format("Provider '%s' created successfully.", responseData.providerId()))
                .showMessage(true)
                .statusCode(HttpStatus.CREATED.value())
                .build();

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    @PatchMapping("/providers/{providerId}/enabled")
    public ResponseEntity<ApiResponse<ProviderConfigurationView>> setProviderEnabled(
            @PathVariable final String providerId,
            @RequestParam("value") final boolean value) {
        return ok(ProviderConfigurationView.from(providerConfigurationService.setEnabled(providerId, value)),
                  String.format("Provider '%s' %s.", providerId, value ? "enabled" : "disabled"));
    }

    @Override
    @PatchMapping("/providers/{providerId}/interval")
    public ResponseEntity<ApiResponse<ProviderConfigurationView>> setProviderInterval(
            @PathVariable final String providerId,
            @RequestParam("minutes") final int minutes) {
        return ok(ProviderConfigurationView.from(providerConfigurationService.setSyncInterval(providerId, minutes)),
                  String.format("Sync interval of provider '%s' set to %d minutes.", providerId, minutes));
    }

    @Override
    @GetMapping("/providers/{providerId}/health")
    public ResponseEntity<ApiResponse<ProviderHealth>> checkProviderHealth(@PathVariable final String providerId) {
        return ok(adminService.checkHealth(providerId), "Provider health checked.");
    }

    // --- 5. MEDIA ---

    @Override
    @PostMapping("/media/{mediaId}/retry")
    public ResponseEntity<ApiResponse<MediaRetryResponse>> retryMedia(
            @PathVariable final Long mediaId) {
        log.info("Retry requested for media {}", mediaId);
        final int queued = adminService.retryMedia(mediaId);
        return ok(new MediaRetryResponse(queued),
                  queued > 0 ? "Media queued for reprocessing." : "Media is already fully processed.");
    }

    @Override
    @PostMapping("/media/retry-failed")
    public ResponseEntity<ApiResponse<MediaRetryResponse>> retryFailedMedia(
            @RequestParam("providerId") final String providerId) {
        log.info("Retry of failed media requested for provider '{}'", providerId);
        final int queued = adminService.retryFailedMedia(providerId);
        return ok(new MediaRetryResponse(queued), String.format("%d failed media items queued for reprocessing.", queued));
    }

    private static <T> ResponseEntity<ApiResponse<T>> ok(final T data, final String message) {
        final ApiResponse<T> response = ApiResponse.<T>builder()
                .response(data)
                .displayMessage(message)
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }
}
