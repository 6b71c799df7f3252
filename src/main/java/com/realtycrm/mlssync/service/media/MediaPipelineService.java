package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.exception.MediaProcessingException;
import com.realtycrm.mlssync.exception.StorageException;
import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.model.MediaStage;
import com.realtycrm.mlssync.model.MediaVariant;
import com.realtycrm.mlssync.model.SyncErrorCategory;
import com.realtycrm.mlssync.service.ledger.SyncErrorEntry;
import com.realtycrm.mlssync.service.ledger.SyncErrorLedger;
import com.realtycrm.mlssync.service.storage.ObjectStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Processes one media row end to end: download, validate, render variants, upload. Each stage's outcome is
 * persisted on the row. A failure is confined to the row and the error ledger; the parent property is never
 * touched. When storage is unavailable the row is kept usable by serving the source URL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaPipelineService {

    private final MediaStateService stateService;
    private final ImageDownloader downloader;
    private final ImageVariantGenerator variantGenerator;
    private final ObjectStorage objectStorage;
    private final MediaKeyStrategy keyStrategy;
    private final SyncErrorLedger errorLedger;

    /**
     * Never throws; every outcome is recorded on the media row.
     */
    public void process(final Long mediaId) {
        if (!stateService.claim(mediaId)) {
            log.debug("Media {} is claimed elsewhere or already uploaded; skipping", mediaId);
            return;
        }
        final Optional<MediaWorkItem> loaded = stateService.load(mediaId);
        if (loaded.isEmpty()) {
            log.warn("Media {} was claimed but could not be loaded", mediaId);
            return;
        }
        final MediaWorkItem item = loaded.get();
        if (item.mediaKind() != MediaKind.PHOTO) {
            stateService.release(mediaId);
            return;
        }

        MediaStage stage = MediaStage.DOWNLOAD;
        try {
            final byte[] content = downloader.download(item.sourceUrl());
            stateService.markDownloaded(mediaId, content.length);

            stage = MediaStage.VALIDATE;
            final SourceImage source = variantGenerator.inspect(content);

            stage = MediaStage.PROCESS;
            final List<RenderedVariant> rendered = variantGenerator.render(source);
            stateService.markProcessed(mediaId, source);

            stage = MediaStage.UPLOAD;
            final List<MediaVariant> stored;
            try {
                stored = upload(item, rendered);
            } catch (StorageException e) {
                log.warn("[{}] Media {} could not be stored; serving the source URL instead: {}",
                         item.providerId(), mediaId, e.getMessage());
                stateService.markDegraded(mediaId, e.getMessage());
                recordFailure(item, MediaStage.UPLOAD, e.getMessage());
                return;
            }
            stateService.markUploaded(mediaId, stored);
            log.info("[{}] Media {} of listing '{}' uploaded with {} variants", item.providerId(), mediaId,
                     item.externalListingId(), stored.size());
        } catch (MediaProcessingException e) {
            log.warn("[{}] Media {} failed at {}: {}", item.providerId(), mediaId, e.getStage(), e.getMessage());
            stateService.markFailed(mediaId, e.getStage(), e.getMessage());
            recordFailure(item, e.getStage(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Media {} failed unexpectedly at {}", item.providerId(), mediaId, stage, e);
            stateService.markFailed(mediaId, stage, e.getMessage());
            recordFailure(item, stage, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private List<MediaVariant> upload(final MediaWorkItem item, final List<RenderedVariant> rendered) {
        final List<MediaVariant> stored = new ArrayList<>(rendered.size());
        for (RenderedVariant variant : rendered) {
            final String key = keyStrategy.variantKey(item.providerId(), item.externalListingId(),
                                                      item.sourceUrlHash(), variant.name());
            objectStorage.put(key, variant.content(), ImageVariantGenerator.CONTENT_TYPE);
            stored.add(MediaVariant.builder()
                                   .name(variant.name())
                                   .storageKey(key)
                                   .url(objectStorage.publicUrl(key))
                                   .width(variant.width())
                                   .height(variant.height())
                                   .byteSize(variant.content().length)
                                   .build());
        }
        return stored;
    }

    private void recordFailure(final MediaWorkItem item, final MediaStage stage, final String message) {
        errorLedger.record(SyncErrorEntry.builder()
                                         .providerId(item.providerId())
                                         .runId(item.syncRunId())
                                         .externalRecordId(item.externalListingId())
                                         .propertyId(item.propertyId())
                                         .mediaId(item.mediaId())
                                         .category(SyncErrorCategory.MEDIA)
                                         .field(stage.name())
                                         .message(message)
                                         .build());
    }
}
