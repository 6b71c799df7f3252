package com.realtycrm.mlssync.repository;

import com.realtycrm.mlssync.model.Property;
import com.realtycrm.mlssync.model.PropertyStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class PropertyRepositoryTest {

    @Autowired
    PropertyRepository propertyRepository;

    private static Property property(String providerId, String externalId, PropertyStatus status) {
        Property property = new Property();
        property.setProviderId(providerId);
        property.setExternalListingId(externalId);
        property.setStatus(status);
        property.setLastSynchronizedAt(Instant.parse("2024-05-01T12:00:00Z"));
        return property;
    }

    @Test
    @DisplayName("a provider cannot store the same external listing twice")
    void uniqueProviderListing() {
        propertyRepository.saveAndFlush(property("mls-a", "L-1", PropertyStatus.ACTIVE));

        assertThatThrownBy(() -> propertyRepository.saveAndFlush(property("mls-a", "L-1", PropertyStatus.SOLD)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("batch lookup only returns the requested provider's rows")
    void findByProviderAndIds() {
        propertyRepository.save(property("mls-a", "L-1", PropertyStatus.ACTIVE));
        propertyRepository.save(property("mls-a", "L-2", PropertyStatus.PENDING));
        propertyRepository.save(property("mls-b", "L-1", PropertyStatus.ACTIVE));

        List<Property> found = propertyRepository.findByProviderIdAndExternalListingIdIn("mls-a",
                                                                                         List.of("L-1", "L-3"));

        assertThat(found).singleElement().satisfies(p -> assertThat(p.getProviderId()).isEqualTo("mls-a"));
        assertThat(propertyRepository.countGroupedByStatus()).hasSize(2);
    }
}
