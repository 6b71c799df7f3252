package com.realtycrm.mlssync.service.provider;

import com.realtycrm.mlssync.model.MediaKind;

/**
 * A media item as announced by the provider, before anything has been downloaded.
 */
public record MediaReference(String url, MediaKind kind, Integer order, String caption) {
}
