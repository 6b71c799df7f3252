package com.realtycrm.mlssync.service.sync;

import com.realtycrm.mlssync.model.ChangeEventType;
import com.realtycrm.mlssync.model.Property;
import com.realtycrm.mlssync.model.PropertyChangeEvent;
import com.realtycrm.mlssync.repository.PropertyChangeEventRepository;
import com.realtycrm.mlssync.repository.PropertyRepository;
import com.realtycrm.mlssync.service.mapping.CanonicalProperty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes canonical records into the {@link Property} table, keyed by (provider, external listing id).
 * <p>
 * A record whose source modification time is older than the stored row's is ignored; otherwise the latest
 * values win. Creation, status and price transitions are appended to the property's change timeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PropertyUpsertService {

    private final PropertyRepository propertyRepository;
    private final PropertyChangeEventRepository changeEventRepository;
    private final Clock clock;

    /**
     * Upserts a whole batch in one transaction. The records must have distinct external ids.
     */
    @Transactional
    public List<RecordUpsert> upsertBatch(final String providerId, final List<CanonicalProperty> records,
                                          final String runId) {
        final List<String> externalIds = records.stream().map(CanonicalProperty::getExternalId).toList();
        final Map<String, Property> existing = propertyRepository
                .findByProviderIdAndExternalListingIdIn(providerId, externalIds)
                .stream()
                .collect(Collectors.toMap(Property::getExternalListingId, Function.identity()));

        final Instant now = clock.instant();
        final List<RecordUpsert> results = new ArrayList<>(records.size());
        for (CanonicalProperty record : records) {
            results.add(apply(existing.get(record.getExternalId()), record, runId, now));
        }
        return results;
    }

    /**
     * Upserts one record in its own transaction; used when a batch had to be rolled back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RecordUpsert upsertSingle(final CanonicalProperty record, final String runId) {
        final Property existing = propertyRepository
                .findByProviderIdAndExternalListingId(record.getProviderId(), record.getExternalId())
                .orElse(null);
        return apply(existing, record, runId, clock.instant());
    }

    private RecordUpsert apply(final Property existing, final CanonicalProperty record, final String runId,
                               final Instant now) {
        if (existing == null) {
            final Property property = new Property();
            property.setProviderId(record.getProviderId());
            property.setExternalListingId(record.getExternalId());
            copyFields(record, property);
            property.setLastSynchronizedAt(now);
            property.setLastSyncRunId(runId);
            final Property saved = propertyRepository.save(property);
            appendEvent(saved.getId(), ChangeEventType.CREATED, null, String.valueOf(saved.getStatus()), runId, now);
            return new RecordUpsert(record.getExternalId(), saved.getId(), UpsertOutcome.CREATED);
        }

        if (isOlderThanStored(record, existing)) {
            log.debug("[{}] Ignoring stale record '{}': source modified {} but stored {}", record.getProviderId(),
                      record.getExternalId(), record.getSourceModifiedAt(), existing.getSourceModifiedAt());
            return new RecordUpsert(record.getExternalId(), existing.getId(), UpsertOutcome.STALE);
        }

        existing.setLastSynchronizedAt(now);
        existing.setLastSyncRunId(runId);
        if (sameFields(record, existing)) {
            return new RecordUpsert(record.getExternalId(), existing.getId(), UpsertOutcome.UNCHANGED);
        }

        if (existing.getStatus() != record.getStatus()) {
            appendEvent(existing.getId(), ChangeEventType.STATUS_CHANGED, String.valueOf(existing.getStatus()),
                        String.valueOf(record.getStatus()), runId, now);
        }
        if (!sameNumber(existing.getPrice(), record.getPrice())) {
            appendEvent(existing.getId(), ChangeEventType.PRICE_CHANGED, plain(existing.getPrice()),
                        plain(record.getPrice()), runId, now);
        }
        copyFields(record, existing);
        return new RecordUpsert(record.getExternalId(), existing.getId(), UpsertOutcome.UPDATED);
    }

    private static boolean isOlderThanStored(final CanonicalProperty record, final Property existing) {
        return record.getSourceModifiedAt() != null && existing.getSourceModifiedAt() != null
               && record.getSourceModifiedAt().isBefore(existing.getSourceModifiedAt());
    }

    private void appendEvent(final Long propertyId, final ChangeEventType type, final String oldValue,
                             final String newValue, final String runId, final Instant now) {
        final PropertyChangeEvent event = new PropertyChangeEvent();
        event.setPropertyId(propertyId);
        event.setEventType(type);
        event.setOldValue(oldValue);
        event.setNewValue(newValue);
        event.setSyncRunId(runId);
        event.setOccurredAt(now);
        changeEventRepository.save(event);
    }

    private static void copyFields(final CanonicalProperty source, final Property target) {
        target.setStatus(source.getStatus());
        target.setPrice(source.getPrice());
        target.setAddressLine(source.getAddressLine());
        target.setCity(source.getCity());
        target.setState(source.getState());
        target.setPostalCode(source.getPostalCode());
        target.setPropertyType(source.getPropertyType());
        target.setBedrooms(source.getBedrooms());
        target.setBathrooms(source.getBathrooms());
        target.setSquareFeet(source.getSquareFeet());
        target.setLotSize(source.getLotSize());
        target.setYearBuilt(source.getYearBuilt());
        target.setLatitude(source.getLatitude());
        target.setLongitude(source.getLongitude());
        target.setDescription(source.getDescription());
        target.setAgentName(source.getAgentName());
        target.setOfficeName(source.getOfficeName());
        target.setListedAt(source.getListedAt());
        target.setSourceModifiedAt(source.getSourceModifiedAt());
    }

    // BigDecimals are compared by value: the database returns them at column scale.
    private static boolean sameFields(final CanonicalProperty source, final Property target) {
        return source.getStatus() == target.getStatus()
               && sameNumber(source.getPrice(), target.getPrice())
               && Objects.equals(source.getAddressLine(), target.getAddressLine())
               && Objects.equals(source.getCity(), target.getCity())
               && Objects.equals(source.getState(), target.getState())
               && Objects.equals(source.getPostalCode(), target.getPostalCode())
               && Objects.equals(source.getPropertyType(), target.getPropertyType())
               && Objects.equals(source.getBedrooms(), target.getBedrooms())
               && sameNumber(source.getBathrooms(), target.getBathrooms())
               && Objects.equals(source.getSquareFeet(), target.getSquareFeet())
               && sameNumber(source.getLotSize(), target.getLotSize())
               && Objects.equals(source.getYearBuilt(), target.getYearBuilt())
               && sameNumber(source.getLatitude(), target.getLatitude())
               && sameNumber(source.getLongitude(), target.getLongitude())
               && Objects.equals(source.getDescription(), target.getDescription())
               && Objects.equals(source.getAgentName(), target.getAgentName())
               && Objects.equals(source.getOfficeName(), target.getOfficeName())
               && Objects.equals(source.getListedAt(), target.getListedAt())
               && Objects.equals(source.getSourceModifiedAt(), target.getSourceModifiedAt());
    }

    private static boolean sameNumber(final BigDecimal a, final BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }

    private static String plain(final BigDecimal value) {
        return value == null ? null : value.stripTrailingZeros().toPlainString();
    }
}
