package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.model.MediaStatus;
import com.realtycrm.mlssync.model.Property;
import com.realtycrm.mlssync.model.PropertyMedia;
import com.realtycrm.mlssync.repository.PropertyMediaRepository;
import com.realtycrm.mlssync.repository.PropertyRepository;
import com.realtycrm.mlssync.service.provider.MediaReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records a listing's media references as {@link PropertyMedia} rows and queues the ones that still need
 * processing. A source URL maps to one row per property no matter how often it is re-announced; rows whose
 * URL is no longer announced are kept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaRegistrationService {

    private final PropertyRepository propertyRepository;
    private final PropertyMediaRepository mediaRepository;
    private final MediaDispatcher dispatcher;

    /**
     * @return the number of media rows queued for processing.
     */
    @Transactional
    public int register(final Long propertyId, final List<MediaReference> references) {
        if (references == null || references.isEmpty()) {
            return 0;
        }
        final Map<String, MediaReference> byHash = new LinkedHashMap<>();
        for (MediaReference reference : references) {
            if (StringUtils.hasText(reference.url())) {
                byHash.putIfAbsent(MediaKeyStrategy.hashSourceUrl(reference.url().trim()), reference);
            }
        }

        final Property property = propertyRepository.getReferenceById(propertyId);
        final List<Long> queued = new ArrayList<>();
        byHash.forEach((hash, reference) -> {
            final PropertyMedia media = mediaRepository.findByPropertyIdAndSourceUrlHash(propertyId, hash)
                                                       .orElseGet(() -> newMedia(property, reference, hash));
            media.setDisplayOrder(reference.order());
            media.setCaption(reference.caption());
            final PropertyMedia saved = mediaRepository.save(media);
            if (saved.needsProcessing()) {
                queued.add(saved.getId());
            }
        });

        dispatcher.dispatch(queued);
        log.debug("Property {}: {} media references, {} queued", propertyId, byHash.size(), queued.size());
        return queued.size();
    }

    private static PropertyMedia newMedia(final Property property, final MediaReference reference,
                                          final String hash) {
        final PropertyMedia media = new PropertyMedia();
        media.setProperty(property);
        media.setSourceUrl(reference.url().trim());
        media.setSourceUrlHash(hash);
        media.setMediaKind(reference.kind() == null ? MediaKind.PHOTO : reference.kind());
        media.setStatus(MediaStatus.PENDING);
        if (media.getMediaKind() != MediaKind.PHOTO) {
            // Nothing to render: served straight from the provider.
            media.setServedUrl(media.getSourceUrl());
            media.advanceTo(MediaStatus.PROCESSED);
        }
        return media;
    }
}
