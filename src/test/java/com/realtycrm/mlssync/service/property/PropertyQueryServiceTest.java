package com.realtycrm.mlssync.service.property;

import com.realtycrm.mlssync.dto.property.PropertySearchCriteria;
import com.realtycrm.mlssync.dto.property.PropertyView;
import com.realtycrm.mlssync.exception.ResourceNotFoundException;
import com.realtycrm.mlssync.model.Property;
import com.realtycrm.mlssync.model.PropertyStatus;
import com.realtycrm.mlssync.repository.PropertyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(PropertyQueryService.class)
class PropertyQueryServiceTest {

    @Autowired
    PropertyQueryService propertyQueryService;
    @Autowired
    PropertyRepository propertyRepository;

    private Long austinId;

    private Property property(String providerId, String externalId, PropertyStatus status, String city, String price,
                              int bedrooms) {
        Property property = new Property();
        property.setProviderId(providerId);
        property.setExternalListingId(externalId);
        property.setStatus(status);
        property.setCity(city);
        property.setState("TX");
        property.setPrice(new BigDecimal(price));
        property.setBedrooms(bedrooms);
        property.setLastSynchronizedAt(Instant.parse("2024-05-01T12:00:00Z"));
        return propertyRepository.save(property);
    }

    @BeforeEach
    void setUp() {
        austinId = property("mls-a", "A-1", PropertyStatus.ACTIVE, "Austin", "450000", 3).getId();
        property("mls-a", "A-2", PropertyStatus.SOLD, "Austin", "610000", 4);
        property("mls-a", "A-3", PropertyStatus.ACTIVE, "Dallas", "300000", 2);
        property("mls-b", "B-1", PropertyStatus.ACTIVE, "austin", "520000", 4);
    }

    @Test
    @DisplayName("filters combine and city matching ignores case")
    void search_combinedFilters() {
        PropertySearchCriteria criteria = PropertySearchCriteria.builder()
                                                                .status(PropertyStatus.ACTIVE)
                                                                .city(" AUSTIN ")
                                                                .minBedrooms(3)
                                                                .build();

        Page<PropertyView> page = propertyQueryService.search(criteria, 0, 20);

        assertThat(page.getContent()).extracting(PropertyView::externalListingId)
                                     .containsExactlyInAnyOrder("A-1", "B-1");
    }

    @Test
    @DisplayName("price range and provider scope")
    void search_priceRange() {
        PropertySearchCriteria criteria = PropertySearchCriteria.builder()
                                                                .providerId("mls-a")
                                                                .minPrice(new BigDecimal("400000"))
                                                                .maxPrice(new BigDecimal("600000"))
                                                                .build();

        Page<PropertyView> page = propertyQueryService.search(criteria, 0, 20);

        assertThat(page.getTotalElements()).isEqualTo(1);
        assertThat(page.getContent().get(0).externalListingId()).isEqualTo("A-1");
    }

    @Test
    @DisplayName("empty criteria page through everything")
    void search_paging() {
        Page<PropertyView> page = propertyQueryService.search(PropertySearchCriteria.builder().build(), 1, 3);

        assertThat(page.getTotalElements()).isEqualTo(4);
        assertThat(page.getContent()).hasSize(1);
    }

    @Test
    @DisplayName("media and timeline of an unknown property are not found")
    void unknownProperty() {
        assertThat(propertyQueryService.get(austinId).city()).isEqualTo("Austin");
        assertThat(propertyQueryService.getMedia(austinId)).isEmpty();
        assertThatThrownBy(() -> propertyQueryService.getTimeline(-1L)).isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> propertyQueryService.get(-1L)).isInstanceOf(ResourceNotFoundException.class);
    }
}
