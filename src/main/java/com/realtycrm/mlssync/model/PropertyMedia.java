package com.realtycrm.mlssync.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An image or video attached to a {@link Property}. The row is created from the source URL before any
 * processing starts and is then updated in place by the media pipeline; failures are recorded on the row,
 * the row itself is never dropped.
 */
@Entity
@Table(name = "property_media",
        uniqueConstraints = @UniqueConstraint(name = "uk_media_property_source",
                columnNames = {"property_id", "source_url_hash"}),
        indexes = @Index(name = "idx_media_status", columnList = "status"))
@Data
public class PropertyMedia {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "property_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Property property;

    @Column(nullable = false, length = 2048)
    private String sourceUrl;

    /**
     * SHA-256 of the source URL. Identifies the media within its property and seeds its storage keys.
     */
    @Column(name = "source_url_hash", nullable = false, length = 64)
    private String sourceUrlHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MediaKind mediaKind = MediaKind.PHOTO;

    @Column
    private Integer displayOrder;

    @Column(length = 1024)
    private String caption;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MediaStatus status = MediaStatus.PENDING;

    /**
     * Set when the variants could not be stored and {@link #servedUrl} falls back to the source URL.
     */
    @Column(nullable = false)
    private boolean degraded;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private MediaStage failureStage;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column
    private Integer width;

    @Column
    private Integer height;

    @Column
    private Long byteSize;

    @Column(length = 16)
    private String format;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "property_media_variant", joinColumns = @JoinColumn(name = "media_id"))
    @OrderColumn(name = "variant_order")
    private List<MediaVariant> variants = new ArrayList<>();

    /**
     * The URL consumers should display: the largest stored variant, or the source URL when degraded.
     */
    @Column(length = 2048)
    private String servedUrl;

    @Column(nullable = false)
    private int attempts;

    /**
     * Claim marker for a pipeline worker; null while no worker owns the row.
     */
    @Column
    private Instant processingStartedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    /**
     * Moves the row to {@code next} when the transition is allowed by {@link MediaStatus#canAdvanceTo}.
     *
     * @return {@code true} if the status changed.
     */
    public boolean advanceTo(MediaStatus next) {
        if (!status.canAdvanceTo(next)) {
            return false;
        }
        this.status = next;
        return true;
    }

    /**
     * Only photos are rendered into variants; other kinds are served from their source URL.
     */
    @Transient
    public boolean needsProcessing() {
        return mediaKind == MediaKind.PHOTO && (status != MediaStatus.UPLOADED || degraded);
    }
}
