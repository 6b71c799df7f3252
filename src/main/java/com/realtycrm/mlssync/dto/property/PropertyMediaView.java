package com.realtycrm.mlssync.dto.property;

import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.model.MediaStage;
import com.realtycrm.mlssync.model.MediaStatus;
import com.realtycrm.mlssync.model.MediaVariant;
import com.realtycrm.mlssync.model.PropertyMedia;

import java.util.List;

public record PropertyMediaView(
        Long id,
        MediaKind mediaKind,
        Integer displayOrder,
        String caption,
        MediaStatus status,
        boolean degraded,
        MediaStage failureStage,
        String errorMessage,
        String sourceUrl,
        String servedUrl,
        Integer width,
        Integer height,
        List<MediaVariant> variants
) {

    public static PropertyMediaView from(final PropertyMedia media) {
        return new PropertyMediaView(media.getId(), media.getMediaKind(), media.getDisplayOrder(), media.getCaption(),
                                     media.getStatus(), media.isDegraded(), media.getFailureStage(),
                                     media.getErrorMessage(), media.getSourceUrl(), media.getServedUrl(),
                                     media.getWidth(), media.getHeight(), List.copyOf(media.getVariants()));
    }
}
