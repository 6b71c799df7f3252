package com.realtycrm.mlssync.repository;

import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.model.MediaStatus;
import com.realtycrm.mlssync.model.PropertyMedia;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PropertyMediaRepository extends JpaRepository<PropertyMedia, Long> {

    List<PropertyMedia> findByPropertyIdOrderByDisplayOrderAsc(Long propertyId);

    Optional<PropertyMedia> findByPropertyIdAndSourceUrlHash(Long propertyId, String sourceUrlHash);

    @Query("SELECT m.id FROM PropertyMedia m WHERE m.property.providerId = :providerId AND m.status = :status")
    List<Long> findIdsByProviderIdAndStatus(@Param("providerId") String providerId,
                                            @Param("status") MediaStatus status);

    /**
     * Photo rows that stopped short of UPLOADED: never claimed and untouched since {@code staleBefore}, or
     * claimed by a worker whose claim is older than {@code staleBefore}. FAILED rows are left to operators.
     */
    @Query("""
            SELECT m.id FROM PropertyMedia m
             WHERE m.mediaKind = :photo
               AND m.status IN :statuses
               AND ((m.processingStartedAt IS NULL AND m.updatedAt < :staleBefore)
                    OR m.processingStartedAt < :staleBefore)
             ORDER BY m.id
            """)
    List<Long> findStalledIds(@Param("photo") MediaKind photo,
                              @Param("statuses") Collection<MediaStatus> statuses,
                              @Param("staleBefore") Instant staleBefore,
                              Pageable pageable);

    /**
     * @return rows of {@code [MediaStatus, Long]}.
     */
    @Query("SELECT m.status, COUNT(m) FROM PropertyMedia m GROUP BY m.status")
    List<Object[]> countGroupedByStatus();

    long countByDegradedTrue();

    /**
     * Claims a media row for one pipeline worker. A claim older than {@code staleBefore} is considered abandoned
     * and can be taken over. Rows that are fully uploaded are never claimed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE PropertyMedia m
               SET m.processingStartedAt = :now, m.attempts = m.attempts + 1
             WHERE m.id = :mediaId
               AND (m.processingStartedAt IS NULL OR m.processingStartedAt < :staleBefore)
               AND (m.status <> :uploaded OR m.degraded = true)
            """)
    int claimForProcessing(@Param("mediaId") Long mediaId,
                           @Param("now") Instant now,
                           @Param("staleBefore") Instant staleBefore,
                           @Param("uploaded") MediaStatus uploaded);
}
