package com.realtycrm.mlssync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One stored rendition of a media item.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class MediaVariant {

    @Column(name = "variant_name", nullable = false, length = 32)
    private String name;

    @Column(name = "storage_key", nullable = false)
    private String storageKey;

    @Column(name = "url", nullable = false, length = 2048)
    private String url;

    @Column(name = "width")
    private int width;

    @Column(name = "height")
    private int height;

    @Column(name = "byte_size")
    private long byteSize;
}
