package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import com.realtycrm.mlssync.exception.ResourceNotFoundException;
import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.model.MediaStatus;
import com.realtycrm.mlssync.model.PropertyMedia;
import com.realtycrm.mlssync.repository.PropertyMediaRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Reprocessing of media rows: operator retries of single or FAILED rows, and the periodic re-queue of rows
 * whose hand-off or worker was lost.
 */
@Slf4j
@Service
public class MediaRetryService {

    private static final EnumSet<MediaStatus> IN_FLIGHT =
            EnumSet.of(MediaStatus.PENDING, MediaStatus.DOWNLOADED, MediaStatus.PROCESSED);

    private final PropertyMediaRepository mediaRepository;
    private final MediaDispatcher dispatcher;
    private final Clock clock;
    private final Duration claimTimeout;
    private final int recoveryBatchSize;

    public MediaRetryService(final PropertyMediaRepository mediaRepository, final MediaDispatcher dispatcher,
                             final Clock clock, final MlsSyncProperties properties) {
        this.mediaRepository = mediaRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.claimTimeout = Duration.ofMinutes(properties.getMedia().getClaimTimeoutMinutes());
        this.recoveryBatchSize = properties.getMedia().getRecoveryBatchSize();
    }

    /**
     * @return {@code true} if the row was queued, {@code false} if it is already fully processed.
     */
    @Transactional(readOnly = true)
    public boolean retry(final Long mediaId) {
        final PropertyMedia media = mediaRepository.findById(mediaId)
                                                   .orElseThrow(() -> new ResourceNotFoundException(
                                                           "Media " + mediaId + " not found"));
        if (!media.needsProcessing()) {
            log.info("Media {} needs no reprocessing (status {})", mediaId, media.getStatus());
            return false;
        }
        dispatcher.dispatch(List.of(mediaId));
        log.info("Media {} queued for reprocessing", mediaId);
        return true;
    }

    /**
     * Queues every FAILED media row of a provider.
     *
     * @return the number of rows queued.
     */
    @Transactional(readOnly = true)
    public int retryFailed(final String providerId) {
        final List<Long> failed = mediaRepository.findIdsByProviderIdAndStatus(providerId, MediaStatus.FAILED);
        dispatcher.dispatch(failed);
        log.info("[{}] {} failed media rows queued for reprocessing", providerId, failed.size());
        return failed.size();
    }

    /**
     * Re-queues photo rows that have made no progress for longer than the claim timeout: rows whose hand-off
     * to the media pool was lost (rejected, or queued when the process stopped) and rows whose worker died
     * while holding the claim. Queuing a row that is still being worked on is harmless; the claim admits one
     * worker.
     *
     * @return the number of rows queued.
     */
    @Transactional(readOnly = true)
    public int requeueStalled() {
        final Instant staleBefore = clock.instant().minus(claimTimeout);
        final List<Long> stalled = mediaRepository.findStalledIds(MediaKind.PHOTO, IN_FLIGHT, staleBefore,
                                                                  PageRequest.of(0, recoveryBatchSize));
        if (!stalled.isEmpty()) {
            dispatcher.dispatch(stalled);
            log.info("{} stalled media rows queued for reprocessing", stalled.size());
        }
        return stalled.size();
    }
}
