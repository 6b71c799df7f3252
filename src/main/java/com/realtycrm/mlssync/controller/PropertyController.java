package com.realtycrm.mlssync.controller;

import com.realtycrm.mlssync.dto.common.ApiResponse;
import com.realtycrm.mlssync.dto.property.PropertyChangeEventView;
import com.realtycrm.mlssync.dto.property.PropertyMediaView;
import com.realtycrm.mlssync.dto.property.PropertySearchCriteria;
import com.realtycrm.mlssync.dto.property.PropertyView;
import com.realtycrm.mlssync.model.PropertyStatus;
import com.realtycrm.mlssync.service.property.PropertyQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/properties/v1")
@RequiredArgsConstructor
@Validated
public class PropertyController implements PropertyApi {

    private final PropertyQueryService propertyQueryService;

    @Override
    @GetMapping
    public ResponseEntity<ApiResponse<Page<PropertyView>>> searchProperties(
            @RequestParam(value = "providerId", required = false) final String providerId,
            @RequestParam(value = "status", required = false) final PropertyStatus status,
            @RequestParam(value = "city", required = false) final String city,
            @RequestParam(value = "state", required = false) final String state,
            @RequestParam(value = "postalCode", required = false) final String postalCode,
            @RequestParam(value = "minPrice", required = false) final BigDecimal minPrice,
            @RequestParam(value = "maxPrice", required = false) final BigDecimal maxPrice,
            @RequestParam(value = "minBedrooms", required = false) final Integer minBedrooms,
            @RequestParam(value = "q", required = false) final String query,
            @RequestParam(value = "page", defaultValue = "0") final int page,
            @RequestParam(value = "size", defaultValue = "20") final int size) {

        final PropertySearchCriteria criteria = PropertySearchCriteria.builder()
                                                                      .providerId(providerId)
                                                                      .status(status)
                                                                      .city(city)
                                                                      .state(state)
                                                                      .postalCode(postalCode)
                                                                      .minPrice(minPrice)
                                                                      .maxPrice(maxPrice)
                                                                      .minBedrooms(minBedrooms)
                                                                      .query(query)
                                                                      .build();
        log.debug("Searching properties with {}", criteria);
        return ok(propertyQueryService.search(criteria, page, size), "Properties retrieved successfully.");
    }

    @Override
    @GetMapping("/{propertyId}")
    public ResponseEntity<ApiResponse<PropertyView>> getProperty(@PathVariable final Long propertyId) {
        return ok(propertyQueryService.get(propertyId), "Property retrieved successfully.");
    }

    @Override
    @GetMapping("/{propertyId}/media")
    public ResponseEntity<ApiResponse<List<PropertyMediaView>>> getPropertyMedia(@PathVariable final Long propertyId) {
        return ok(propertyQueryService.getMedia(propertyId), "Property media retrieved successfully.");
    }

    @Override
    @GetMapping("/{propertyId}/timeline")
    public ResponseEntity<ApiResponse<List<PropertyChangeEventView>>> getPropertyTimeline(
            @PathVariable final Long propertyId) {
        return ok(propertyQueryService.getTimeline(propertyId), "Property timeline retrieved successfully.");
    }

    private static <T> ResponseEntity<ApiResponse<T>> ok(final T data, final String message) {
        return ResponseEntity.ok(ApiResponse.<T>builder()
                                            .response(data)
                                            .displayMessage(message)
                                            .showMessage(false)
                                            .statusCode(HttpStatus.OK.value())
                                            .build());
    }
}
