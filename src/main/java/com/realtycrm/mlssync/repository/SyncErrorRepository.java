package com.realtycrm.mlssync.repository;

import com.realtycrm.mlssync.model.SyncError;
import com.realtycrm.mlssync.model.SyncErrorCategory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SyncErrorRepository extends JpaRepository<SyncError, Long> {

    List<SyncError> findByRunIdOrderByOccurredAtAsc(String runId);

    List<SyncError> findByProviderIdAndResolvedFalseOrderByOccurredAtDesc(String providerId, Pageable pageable);

    List<SyncError> findByProviderIdAndCategoryAndResolvedFalseOrderByOccurredAtDesc(String providerId,
                                                                                      SyncErrorCategory category,
                                                                                      Pageable pageable);

    List<SyncError> findByResolvedFalseOrderByOccurredAtDesc(Pageable pageable);

    long countByResolvedFalse();

    long countByRunId(String runId);

    /**
     * @return rows of {@code [SyncErrorCategory, Long]} for unresolved entries.
     */
    @Query("SELECT e.category, COUNT(e) FROM SyncError e WHERE e.resolved = false GROUP BY e.category")
    List<Object[]> countUnresolvedByCategory();

    @Query("""
            SELECT e.category, COUNT(e) FROM SyncError e
             WHERE e.resolved = false AND e.providerId = :providerId
             GROUP BY e.category
            """)
    List<Object[]> countUnresolvedByCategoryForProvider(@Param("providerId") String providerId);
}
