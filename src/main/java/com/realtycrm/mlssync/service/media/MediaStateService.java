package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import com.realtycrm.mlssync.model.MediaStage;
import com.realtycrm.mlssync.model.MediaStatus;
import com.realtycrm.mlssync.model.MediaVariant;
import com.realtycrm.mlssync.model.Property;
import com.realtycrm.mlssync.model.PropertyMedia;
import com.realtycrm.mlssync.repository.PropertyMediaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Short transactions that move a {@link PropertyMedia} row through the pipeline. No transaction is held
 * while the pipeline downloads, renders or uploads.
 * <p>
 * Every method starts its own transaction. A saturated media pool runs the pipeline on the submitting
 * thread, which may be inside the {@code afterCommit} callback of the sync batch, where the finished
 * transaction is still bound and must not be joined.
 */
@Slf4j
@Service
public class MediaStateService {

    private static final int MAX_ERROR_LENGTH = 4000;

    private final PropertyMediaRepository mediaRepository;
    private final Clock clock;
    private final Duration claimTimeout;

    public MediaStateService(final PropertyMediaRepository mediaRepository, final Clock clock,
                             final MlsSyncProperties properties) {
        this.mediaRepository = mediaRepository;
        this.clock = clock;
        this.claimTimeout = Duration.ofMinutes(properties.getMedia().getClaimTimeoutMinutes());
    }

    /**
     * Takes ownership of the row for one worker.
     *
     * @return {@code false} if another worker holds a live claim or the row needs no processing.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean claim(final Long mediaId) {
        final Instant now = clock.instant();
        return mediaRepository.claimForProcessing(mediaId, now, now.minus(claimTimeout), MediaStatus.UPLOADED) > 0;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<MediaWorkItem> load(final Long mediaId) {
        return mediaRepository.findById(mediaId).map(media -> {
            final Property property = media.getProperty();
            return new MediaWorkItem(media.getId(), property.getId(), property.getProviderId(),
                                     property.getExternalListingId(), property.getLastSyncRunId(),
                                     media.getSourceUrl(), media.getSourceUrlHash(), media.getMediaKind());
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markDownloaded(final Long mediaId, final long byteSize) {
        update(mediaId, media -> {
            media.advanceTo(MediaStatus.DOWNLOADED);
            media.setByteSize(byteSize);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markProcessed(final Long mediaId, final SourceImage source) {
        update(mediaId, media -> {
            media.advanceTo(MediaStatus.PROCESSED);
            media.setWidth(source.width());
            media.setHeight(source.height());
            media.setFormat(source.format());
            media.setByteSize(source.byteSize());
        });
    }

    /**
     * Records the stored variants and serves the largest of them.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markUploaded(final Long mediaId, final List<MediaVariant> variants) {
        update(mediaId, media -> {
            media.advanceTo(MediaStatus.UPLOADED);
            media.getVariants().clear();
            media.getVariants().addAll(variants);
            media.setServedUrl(variants.stream()
                                       .max(Comparator.comparingLong(v -> (long) v.getWidth() * v.getHeight()))
                                       .map(MediaVariant::getUrl)
                                       .orElse(media.getSourceUrl()));
            media.setDegraded(false);
            media.setFailureStage(null);
            media.setErrorMessage(null);
            media.setProcessingStartedAt(null);
        });
    }

    /**
     * Storage was unavailable: the source URL is served instead of stored variants.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markDegraded(final Long mediaId, final String message) {
        update(mediaId, media -> {
            media.advanceTo(MediaStatus.PROCESSED);
            media.setDegraded(true);
            media.setServedUrl(media.getSourceUrl());
            media.setFailureStage(MediaStage.UPLOAD);
            media.setErrorMessage(truncate(message));
            media.setProcessingStartedAt(null);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(final Long mediaId, final MediaStage stage, final String message) {
        update(mediaId, media -> {
            if (!media.advanceTo(MediaStatus.FAILED)) {
                log.debug("Media {} stays {} after a failed reprocessing attempt", mediaId, media.getStatus());
            }
            media.setFailureStage(stage);
            media.setErrorMessage(truncate(message));
            media.setProcessingStartedAt(null);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void release(final Long mediaId) {
        update(mediaId, media -> media.setProcessingStartedAt(null));
    }

    private void update(final Long mediaId, final Consumer<PropertyMedia> change) {
        mediaRepository.findById(mediaId).ifPresentOrElse(media -> {
            change.accept(media);
            mediaRepository.save(media);
        }, () -> log.warn("Media {} disappeared during processing", mediaId));
    }

    private static String truncate(final String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
