package com.realtycrm.mlssync.controller;

import com.realtycrm.mlssync.dto.common.ApiResponse;
import com.realtycrm.mlssync.dto.property.PropertyChangeEventView;
import com.realtycrm.mlssync.dto.property.PropertyMediaView;
import com.realtycrm.mlssync.dto.property.PropertyView;
import com.realtycrm.mlssync.model.PropertyStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

import java.math.BigDecimal;
import java.util.List;

@Tag(name = "Properties", description = "Read access to the canonical property listings populated by synchronization.")
public interface PropertyApi {

    @Operation(summary = "Search Properties", description = "Paged, filtered list of properties, most recently updated first. All filters are optional and combined with AND.")
    ResponseEntity<ApiResponse<Page<PropertyView>>> searchProperties(
            @Parameter(description = "Restrict to one provider.") @RequestParam(value = "providerId", required = false) String providerId,
            @Parameter(description = "Listing status.") @RequestParam(value = "status", required = false) PropertyStatus status,
            @Parameter(description = "City, case-insensitive.") @RequestParam(value = "city", required = false) String city,
            @Parameter(description = "State or province code.") @RequestParam(value = "state", required = false) String state,
            @Parameter(description = "Postal code.") @RequestParam(value = "postalCode", required = false) String postalCode,
            @Parameter(description = "Minimum list price.") @RequestParam(value = "minPrice", required = false) BigDecimal minPrice,
            @Parameter(description = "Maximum list price.") @RequestParam(value = "maxPrice", required = false) BigDecimal maxPrice,
            @Parameter(description = "Minimum bedrooms.") @RequestParam(value = "minBedrooms", required = false) Integer minBedrooms,
            @Parameter(description = "Free text matched against address, city, listing id and description.") @RequestParam(value = "q", required = false) String query,
            @Parameter(description = "Zero-based page index.") @RequestParam(value = "page", defaultValue = "0") @PositiveOrZero(message = "The 'page' cannot be negative.") int page,
            @Parameter(description = "Page size (1-200).") @RequestParam(value = "size", defaultValue = "20") @Min(value = 1, message = "The 'size' must be at least 1.") @Max(value = 200, message = "The 'size' cannot exceed 200.") int size);

    @Operation(summary = "Get Property", description = "One property by its internal id.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Property retrieved."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No property with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<PropertyView>> getProperty(
            @Parameter(description = "The property id.", required = true) @PathVariable Long propertyId);

    @Operation(summary = "Get Property Media", description = "Media of a property in display order, with processing state and stored variants.")
    ResponseEntity<ApiResponse<List<PropertyMediaView>>> getPropertyMedia(
            @Parameter(description = "The property id.", required = true) @PathVariable Long propertyId);

    @Operation(summary = "Get Property Timeline", description = "Creation, status and price changes of a property, oldest first.")
    ResponseEntity<ApiResponse<List<PropertyChangeEventView>>> getPropertyTimeline(
            @Parameter(description = "The property id.", required = true) @PathVariable Long propertyId);
}
