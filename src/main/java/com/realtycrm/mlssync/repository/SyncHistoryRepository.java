package com.realtycrm.mlssync.repository;

import com.realtycrm.mlssync.model.SyncHistory;
import com.realtycrm.mlssync.model.SyncOutcome;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface SyncHistoryRepository extends JpaRepository<SyncHistory, Long> {

    Page<SyncHistory> findByProviderId(String providerId, Pageable pageable);

    Optional<SyncHistory> findByRunId(String runId);

    boolean existsByRunId(String runId);

    long countByProviderId(String providerId);

    long countByProviderIdAndOutcome(String providerId, SyncOutcome outcome);

    long countByOutcome(SyncOutcome outcome);

    long countByStartedAtAfter(Instant since);

    long countByStartedAtAfterAndOutcome(Instant since, SyncOutcome outcome);
}
