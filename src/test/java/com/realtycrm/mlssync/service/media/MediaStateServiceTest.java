package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import com.realtycrm.mlssync.model.MediaStage;
import com.realtycrm.mlssync.model.MediaStatus;
import com.realtycrm.mlssync.model.MediaVariant;
import com.realtycrm.mlssync.model.Property;
import com.realtycrm.mlssync.model.PropertyMedia;
import com.realtycrm.mlssync.model.PropertyStatus;
import com.realtycrm.mlssync.repository.PropertyMediaRepository;
import com.realtycrm.mlssync.repository.PropertyRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs against the real schema without a surrounding test transaction, so each state change commits on its own.
 */
@DataJpaTest
@Import({MediaStateService.class, MediaStateServiceTest.Config.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class MediaStateServiceTest {

    private static final String SOURCE_URL = "https://images.example.com/l-1/front.jpg";

    @TestConfiguration
    static class Config {

        @Bean
        @Primary
        MlsSyncProperties mlsSyncProperties() {
            return new MlsSyncProperties();
        }

        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }

    @Autowired
    MediaStateService stateService;
    @Autowired
    PropertyMediaRepository mediaRepository;
    @Autowired
    PropertyRepository propertyRepository;
    @Autowired
    MlsSyncProperties properties;
    @Autowired
    PlatformTransactionManager transactionManager;

    @AfterEach
    void cleanUp() {
        mediaRepository.deleteAll();
        propertyRepository.deleteAll();
    }

    private PropertyMedia media(MediaStatus status, boolean degraded) {
        Property property = new Property();
        property.setProviderId("mls-a");
        property.setExternalListingId("L-1");
        property.setStatus(PropertyStatus.ACTIVE);
        property.setLastSynchronizedAt(Instant.parse("2024-05-01T12:00:00Z"));
        property = propertyRepository.saveAndFlush(property);

        PropertyMedia media = new PropertyMedia();
        media.setProperty(property);
        media.setSourceUrl(SOURCE_URL);
        media.setSourceUrlHash(MediaKeyStrategy.hashSourceUrl(SOURCE_URL));
        media.setStatus(status);
        media.setDegraded(degraded);
        if (degraded) {
            media.setServedUrl(SOURCE_URL);
            media.setFailureStage(MediaStage.UPLOAD);
            media.setErrorMessage("storage unavailable");
        }
        return mediaRepository.saveAndFlush(media);
    }

    private List<MediaVariant> variants(MediaKeyStrategy keys) {
        String hash = MediaKeyStrategy.hashSourceUrl(SOURCE_URL);
        return properties.getMedia().getVariants().stream()
                         .map(v -> {
                             String key = keys.variantKey("mls-a", "L-1", hash, v.getName());
                             return MediaVariant.builder()
                                                .name(v.getName())
                                                .storageKey(key)
                                                .url("https://cdn.test/" + key)
                                                .width(v.getWidth())
                                                .height(v.getHeight())
                                                .byteSize(1024)
                                                .build();
                         })
                         .toList();
    }

    @Test
    @DisplayName("a degraded row is reclaimed, uploaded in place and keeps its deterministic keys")
    void degradedRow_reprocessedInPlace() {
        Long id = media(MediaStatus.PROCESSED, true).getId();
        MediaKeyStrategy keys = new MediaKeyStrategy(properties);

        assertThat(stateService.claim(id)).isTrue();
        stateService.markUploaded(id, variants(keys));

        assertThat(mediaRepository.findAll()).singleElement().satisfies(media -> {
            assertThat(media.getId()).isEqualTo(id);
            assertThat(media.getStatus()).isEqualTo(MediaStatus.UPLOADED);
            assertThat(media.isDegraded()).isFalse();
            assertThat(media.getFailureStage()).isNull();
            assertThat(media.getErrorMessage()).isNull();
            assertThat(media.getProcessingStartedAt()).isNull();
            assertThat(media.getAttempts()).isEqualTo(1);
            assertThat(media.getVariants()).extracting(MediaVariant::getStorageKey)
                                           .allSatisfy(key -> assertThat(key).startsWith(
                                                   "properties/mls-a/L-1/"
                                                           + MediaKeyStrategy.hashSourceUrl(SOURCE_URL).substring(0, 16)
                                                           + "/"))
                                           .containsExactlyElementsOf(variants(keys).stream()
                                                                                    .map(MediaVariant::getStorageKey)
                                                                                    .toList());
            assertThat(media.getServedUrl()).isNotEqualTo(SOURCE_URL).startsWith("https://cdn.test/");
        });
    }

    @Test
    @DisplayName("a late failure does not move an uploaded row back, and the row cannot be claimed again")
    void uploadedRow_notRegressed() {
        Long id = media(MediaStatus.PROCESSED, true).getId();
        assertThat(stateService.claim(id)).isTrue();
        stateService.markUploaded(id, variants(new MediaKeyStrategy(properties)));

        stateService.markFailed(id, MediaStage.DOWNLOAD, "late failure");

        PropertyMedia media = mediaRepository.findById(id).orElseThrow();
        assertThat(media.getStatus()).isEqualTo(MediaStatus.UPLOADED);
        assertThat(media.isDegraded()).isFalse();
        assertThat(stateService.claim(id)).isFalse();
    }

    @Test
    @DisplayName("a live claim blocks a second worker until it is released")
    void claim_isExclusive() {
        Long id = media(MediaStatus.PENDING, false).getId();

        assertThat(stateService.claim(id)).isTrue();
        assertThat(stateService.claim(id)).isFalse();

        stateService.release(id);
        assertThat(stateService.claim(id)).isTrue();
        assertThat(mediaRepository.findById(id).orElseThrow().getAttempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("state changes made from an after-commit callback are committed in their own transaction")
    void stateChangesFromAfterCommit() {
        Long id = media(MediaStatus.PENDING, false).getId();
        AtomicBoolean claimed = new AtomicBoolean();

        new TransactionTemplate(transactionManager).executeWithoutResult(status ->
                TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                    @Override
                    public void afterCommit() {
                        claimed.set(stateService.claim(id));
                        stateService.markFailed(id, MediaStage.DOWNLOAD, "source unreachable");
                    }
                }));

        assertThat(claimed).isTrue();
        PropertyMedia media = mediaRepository.findById(id).orElseThrow();
        assertThat(media.getStatus()).isEqualTo(MediaStatus.FAILED);
        assertThat(media.getAttempts()).isEqualTo(1);
        assertThat(media.getProcessingStartedAt()).isNull();
    }
}
