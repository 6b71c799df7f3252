package com.realtycrm.mlssync.service.media;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

/**
 * Hands media rows to the bounded media pool. Inside a transaction the hand-off waits for the commit, so
 * workers never look for rows that are not yet visible.
 */
@Slf4j
@Service
public class MediaDispatcher {

    private final MediaPipelineService pipelineService;
    private final AsyncTaskExecutor mediaTaskExecutor;

    public MediaDispatcher(final MediaPipelineService pipelineService,
                           @Qualifier("mediaTaskExecutor") final AsyncTaskExecutor mediaTaskExecutor) {
        this.pipelineService = pipelineService;
        this.mediaTaskExecutor = mediaTaskExecutor;
    }

    public void dispatch(final List<Long> mediaIds) {
        if (mediaIds.isEmpty()) {
            return;
        }
        final List<Long> ids = List.copyOf(mediaIds);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    log.debug("Transaction committed. Dispatching {} media items", ids.size());
                    submit(ids);
                }
            });
        } else {
            submit(ids);
        }
    }

    private void submit(final List<Long> mediaIds) {
        for (Long mediaId : mediaIds) {
            try {
                mediaTaskExecutor.execute(() -> pipelineService.process(mediaId));
            } catch (TaskRejectedException e) {
                // Shutting down: the row stays PENDING until the media recovery sweep re-queues it.
                log.warn("Media executor rejected media {}: {}", mediaId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Media {} could not be handed to the pipeline; left for the recovery sweep", mediaId, e);
            }
        }
    }
}
