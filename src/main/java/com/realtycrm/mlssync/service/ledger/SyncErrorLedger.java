package com.realtycrm.mlssync.service.ledger;

import com.realtycrm.mlssync.exception.ResourceNotFoundException;
import com.realtycrm.mlssync.model.SyncError;
import com.realtycrm.mlssync.model.SyncErrorCategory;
import com.realtycrm.mlssync.repository.SyncErrorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Durable record of per-item failures. Writes commit in their own transaction, so an entry survives even
 * when the surrounding batch rolls back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncErrorLedger {

    static final int MAX_MESSAGE_LENGTH = 4000;

    private final SyncErrorRepository syncErrorRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncError record(final SyncErrorEntry entry) {
        final SyncError error = new SyncError();
        error.setProviderId(entry.providerId());
        error.setRunId(entry.runId());
        error.setExternalRecordId(entry.externalRecordId());
        error.setPropertyId(entry.propertyId());
        error.setMediaId(entry.mediaId());
        error.setCategory(entry.category());
        error.setField(entry.field());
        error.setMessage(truncate(entry.message()));
        error.setOccurredAt(clock.instant());
        final SyncError saved = syncErrorRepository.save(error);
        log.warn("[{}] {} error recorded for record '{}' in run {}: {}", entry.providerId(), entry.category(),
                 entry.externalRecordId(), entry.runId(), entry.message());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<SyncError> findUnresolved(final String providerId, final SyncErrorCategory category,
                                          final int limit) {
        final PageRequest page = PageRequest.of(0, limit);
        if (providerId == null) {
            final List<SyncError> all = syncErrorRepository.findByResolvedFalseOrderByOccurredAtDesc(page);
            return category == null ? all : all.stream().filter(e -> e.getCategory() == category).toList();
        }
        return category == null
                ? syncErrorRepository.findByProviderIdAndResolvedFalseOrderByOccurredAtDesc(providerId, page)
                : syncErrorRepository.findByProviderIdAndCategoryAndResolvedFalseOrderByOccurredAtDesc(
                        providerId, category, page);
    }

    @Transactional(readOnly = true)
    public List<SyncError> findByRun(final String runId) {
        return syncErrorRepository.findByRunIdOrderByOccurredAtAsc(runId);
    }

    /**
     * Counts unresolved entries per category, with zero for categories that have none.
     */
    @Transactional(readOnly = true)
    public Map<SyncErrorCategory, Long> summarizeUnresolved(final String providerId) {
        final Map<SyncErrorCategory, Long> summary = new EnumMap<>(SyncErrorCategory.class);
        for (SyncErrorCategory category : SyncErrorCategory.values()) {
            summary.put(category, 0L);
        }
        final List<Object[]> rows = providerId == null
                ? syncErrorRepository.countUnresolvedByCategory()
                : syncErrorRepository.countUnresolvedByCategoryForProvider(providerId);
        rows.forEach(row -> summary.put((SyncErrorCategory) row[0], ((Number) row[1]).longValue()));
        return summary;
    }

    /**
     * Marks an entry as handled by an operator. Resolving an already resolved entry keeps its original time.
     */
    @Transactional
    public SyncError resolve(final Long errorId) {
        final SyncError error = syncErrorRepository.findById(errorId)
                                                   .orElseThrow(() -> new ResourceNotFoundException(
                                                           "Sync error " + errorId + " not found"));
        if (!error.isResolved()) {
            final Instant now = clock.instant();
            error.setResolved(true);
            error.setResolvedAt(now);
            log.info("Sync error {} for provider '{}' resolved", errorId, error.getProviderId());
        }
        return syncErrorRepository.save(error);
    }

    private static String truncate(final String message) {
        if (message == null) {
            return "(no message)";
        }
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
