package com.realtycrm.mlssync.repository;

import com.realtycrm.mlssync.model.Property;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PropertyRepository extends JpaRepository<Property, Long>, JpaSpecificationExecutor<Property> {

    Optional<Property> findByProviderIdAndExternalListingId(String providerId, String externalListingId);

    /**
     * Loads the existing rows for one upsert batch in a single query.
     */
    List<Property> findByProviderIdAndExternalListingIdIn(String providerId, Collection<String> externalListingIds);

    long countByProviderId(String providerId);

    /**
     * @return rows of {@code [PropertyStatus, Long]}.
     */
    @Query("SELECT p.status, COUNT(p) FROM Property p GROUP BY p.status")
    List<Object[]> countGroupedByStatus();
}
