package com.realtycrm.mlssync.scheduler;

import com.realtycrm.mlssync.service.media.MediaRetryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-queues media rows left behind by a lost hand-off or a dead worker. Unchanged listings never re-register
 * their media during a sync, so without this sweep such rows would stay PENDING.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.sync.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class MediaRecoveryScheduler {

    private final MediaRetryService mediaRetryService;

    @Scheduled(cron = "${app.sync.media.recovery-cron:0 */10 * * * *}")
    public void requeueStalledMedia() {
        try {
            final int queued = mediaRetryService.requeueStalled();
            log.debug("Media recovery sweep queued {} rows", queued);
        } catch (RuntimeException e) {
            log.error("Media recovery sweep failed", e);
        }
    }
}
