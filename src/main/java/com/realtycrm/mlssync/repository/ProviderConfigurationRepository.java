package com.realtycrm.mlssync.repository;

import com.realtycrm.mlssync.model.ProviderConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProviderConfigurationRepository extends JpaRepository<ProviderConfiguration, Long> {

    Optional<ProviderConfiguration> findByProviderId(String providerId);

    boolean existsByProviderId(String providerId);

    List<ProviderConfiguration> findByEnabledTrue();

    long countByEnabledTrue();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ProviderConfiguration p SET p.lastSyncedAt = :syncedAt WHERE p.providerId = :providerId")
    int markSynced(@Param("providerId") String providerId, @Param("syncedAt") Instant syncedAt);

    /**
     * A successful full run also counts as an incremental one, so both timestamps move.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ProviderConfiguration p
               SET p.lastSyncedAt = :syncedAt, p.lastFullSyncAt = :syncedAt
             WHERE p.providerId = :providerId
            """)
    int markFullSynced(@Param("providerId") String providerId, @Param("syncedAt") Instant syncedAt);
}
