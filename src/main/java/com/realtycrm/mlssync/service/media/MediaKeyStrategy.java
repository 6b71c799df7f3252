package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

/**
 * Derives storage keys for media variants. Keys depend only on the listing, the source URL and the variant
 * name, so re-processing a media item overwrites its previous objects.
 */
@Component
public class MediaKeyStrategy {

    static final int HASH_PREFIX_LENGTH = 16;
    static final String EXTENSION = ".jpg";

    private final String keyPrefix;

    public MediaKeyStrategy(final MlsSyncProperties properties) {
        final String prefix = properties.getStorage().getKeyPrefix();
        this.keyPrefix = prefix == null ? "" : prefix.replaceAll("^/+|/+$", "");
    }

    public static String hashSourceUrl(final String sourceUrl) {
        return DigestUtils.sha256Hex(sourceUrl);
    }

    /**
     * @return {@code {prefix}/{providerId}/{externalListingId}/{hash[0..16]}/{variant}.jpg}
     */
    public String variantKey(final String providerId, final String externalListingId, final String sourceUrlHash,
                             final String variantName) {
        final String path = String.join("/", safeSegment(providerId), safeSegment(externalListingId),
                                        sourceUrlHash.substring(0, HASH_PREFIX_LENGTH), variantName + EXTENSION);
        return keyPrefix.isEmpty() ? path : keyPrefix + "/" + path;
    }

    private static String safeSegment(final String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
