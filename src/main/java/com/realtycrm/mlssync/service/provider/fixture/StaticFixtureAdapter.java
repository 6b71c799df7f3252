package com.realtycrm.mlssync.service.provider.fixture;

import com.realtycrm.mlssync.common.json.JsonParser;
import com.realtycrm.mlssync.dto.reso.ResoCollectionResponse;
import com.realtycrm.mlssync.exception.ConnectivityException;
import com.realtycrm.mlssync.exception.json.JsonParsingException;
import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.service.mapping.SourceTimestamps;
import com.realtycrm.mlssync.service.provider.MediaReference;
import com.realtycrm.mlssync.service.provider.MlsProviderAdapter;
import com.realtycrm.mlssync.service.provider.ProviderHealth;
import com.realtycrm.mlssync.service.provider.ProviderRecord;
import com.realtycrm.mlssync.service.provider.RecordPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serves listings from a JSON document shaped like a RESO collection ({@code {"value": [...]}}), with each
 * record's media embedded under a configurable field. Used for demos, onboarding and tests.
 */
@Slf4j
public class StaticFixtureAdapter implements MlsProviderAdapter {

    private final Resource resource;
    private final JsonParser jsonParser;
    private final FixtureSettings settings;
    private final int pageSize;
    private List<ProviderRecord> records;

    public StaticFixtureAdapter(final Resource resource, final JsonParser jsonParser,
                                final FixtureSettings settings, final int pageSize) {
        this.resource = resource;
        this.jsonParser = jsonParser;
        this.settings = settings;
        this.pageSize = pageSize;
    }

    @Override
    public void connect() {
        if (records != null) {
            return;
        }
        if (!resource.exists()) {
            throw new ConnectivityException("Fixture not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            final ResoCollectionResponse document = jsonParser.parseObject(in.readAllBytes(),
                                                                           ResoCollectionResponse.class);
            records = document.getValue().stream().filter(Objects::nonNull).map(ProviderRecord::new).toList();
            log.info("Loaded {} fixture records for provider '{}' from {}", records.size(), settings.providerId(),
                     resource.getDescription());
        } catch (IOException | JsonParsingException e) {
            throw new ConnectivityException("Fixture could not be read: " + resource.getDescription(), e);
        }
    }

    @Override
    public RecordPage fetchChangedRecords(final Instant since, final String cursor) {
        connect();
        final List<ProviderRecord> matching = since == null
                ? records
                : records.stream().filter(record -> modifiedAtOrAfter(record, since)).toList();

        final int offset = cursor == null ? 0 : Integer.parseInt(cursor);
        final int end = Math.min(matching.size(), offset + pageSize);
        final List<ProviderRecord> page = offset >= matching.size() ? List.of() : matching.subList(offset, end);
        return new RecordPage(page, end < matching.size() ? String.valueOf(end) : null);
    }

    @Override
    public List<MediaReference> fetchMediaReferences(final String recordId) {
        connect();
        final List<MediaReference> references = new ArrayList<>();
        records.stream()
               .filter(record -> recordId.equals(String.valueOf(record.valueAt(settings.keyField()))))
               .findFirst()
               .map(record -> record.valueAt(settings.mediaField()))
               .filter(List.class::isInstance)
               .ifPresent(media -> {
                   int position = 0;
                   for (Object item : (List<?>) media) {
                       position++;
                       if (item instanceof String url) {
                           references.add(new MediaReference(url, MediaKind.classify(null, url), position, null));
                       } else if (item instanceof Map<?, ?> map && map.get("MediaURL") != null) {
                           final Object order = map.get("Order");
                           references.add(new MediaReference(
                                   map.get("MediaURL").toString(),
                                   MediaKind.classify(Objects.toString(map.get("MediaCategory"), null),
                                                      map.get("MediaURL").toString()),
                                   order instanceof Number number ? number.intValue() : position,
                                   Objects.toString(map.get("ShortDescription"), null)));
                       }
                   }
               });
        return references;
    }

    @Override
    public ProviderHealth healthCheck() {
        return resource.exists()
                ? ProviderHealth.up(0)
                : ProviderHealth.down("Fixture not found: " + resource.getDescription(), 0);
    }

    @Override
    public void disconnect() {
        records = null;
    }

    /**
     * Records without a parseable timestamp are always included, so they are never silently skipped.
     */
    private boolean modifiedAtOrAfter(final ProviderRecord record, final Instant since) {
        final Object value = record.valueAt(settings.timestampField());
        if (value == null) {
            return true;
        }
        final Instant modifiedAt = parseInstant(value.toString());
        return modifiedAt == null || !modifiedAt.isBefore(since);
    }

    private static Instant parseInstant(final String value) {
        try {
            return SourceTimestamps.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable fixture timestamp '{}'", value);
            return null;
        }
    }

    public record FixtureSettings(String providerId, String keyField, String timestampField, String mediaField) {
    }
}
