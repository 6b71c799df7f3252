package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.model.MediaStatus;
import com.realtycrm.mlssync.model.Property;
import com.realtycrm.mlssync.model.PropertyMedia;
import com.realtycrm.mlssync.model.PropertyStatus;
import com.realtycrm.mlssync.repository.PropertyMediaRepository;
import com.realtycrm.mlssync.repository.PropertyRepository;
import com.realtycrm.mlssync.service.provider.MediaReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DataJpaTest
@Import(MediaRegistrationService.class)
class MediaRegistrationServiceTest {

    @Autowired
    MediaRegistrationService registrationService;
    @Autowired
    PropertyRepository propertyRepository;
    @Autowired
    PropertyMediaRepository mediaRepository;

    @MockBean
    MediaDispatcher dispatcher;

    private Long propertyId;

    @BeforeEach
    void setUp() {
        Property property = new Property();
        property.setProviderId("mls-a");
        property.setExternalListingId("L-1");
        property.setStatus(PropertyStatus.ACTIVE);
        property.setLastSynchronizedAt(Instant.parse("2024-05-01T12:00:00Z"));
        propertyId = propertyRepository.save(property).getId();
    }

    @Test
    @DisplayName("photos are queued once per source URL, tours are served from the source")
    void register_dedupesAndQueuesPhotos() {
        List<MediaReference> references = List.of(
                new MediaReference("https://img.test/1.jpg", MediaKind.PHOTO, 1, "Front"),
                new MediaReference(" https://img.test/1.jpg ", MediaKind.PHOTO, 2, null),
                new MediaReference("https://tours.test/l-1", MediaKind.VIRTUAL_TOUR, 3, null),
                new MediaReference("", MediaKind.PHOTO, 4, null));

        int queued = registrationService.register(propertyId, references);

        assertThat(queued).isEqualTo(1);
        List<PropertyMedia> rows = mediaRepository.findAll();
        assertThat(rows).hasSize(2);
        assertThat(rows).filteredOn(media -> media.getMediaKind() == MediaKind.VIRTUAL_TOUR)
                        .singleElement()
                        .satisfies(tour -> {
                            assertThat(tour.getStatus()).isEqualTo(MediaStatus.PROCESSED);
                            assertThat(tour.getServedUrl()).isEqualTo("https://tours.test/l-1");
                        });
        assertThat(rows).filteredOn(media -> media.getMediaKind() == MediaKind.PHOTO)
                        .singleElement()
                        .satisfies(photo -> assertThat(photo.getCaption()).isEqualTo("Front"));
        verify(dispatcher).dispatch(anyList());
    }

    @Test
    @DisplayName("re-announcing a URL updates the existing row instead of adding one")
    void register_isIdempotent() {
        registrationService.register(propertyId, List.of(
                new MediaReference("https://img.test/1.jpg", MediaKind.PHOTO, 1, null)));
        registrationService.register(propertyId, List.of(
                new MediaReference("https://img.test/1.jpg", MediaKind.PHOTO, 5, "Kitchen")));

        assertThat(mediaRepository.findAll()).singleElement().satisfies(media -> {
            assertThat(media.getDisplayOrder()).isEqualTo(5);
            assertThat(media.getCaption()).isEqualTo("Kitchen");
        });
    }

    @Test
    @DisplayName("no references, nothing dispatched")
    void register_empty() {
        assertThat(registrationService.register(propertyId, List.of())).isZero();
        verify(dispatcher, never()).dispatch(anyList());
    }
}
