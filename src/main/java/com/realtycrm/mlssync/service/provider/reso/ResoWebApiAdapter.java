package com.realtycrm.mlssync.service.provider.reso;

import com.realtycrm.mlssync.common.apiclient.ApiClient;
import com.realtycrm.mlssync.common.apiclient.authentication.Authentication;
import com.realtycrm.mlssync.common.apiclient.model.ApiRequest;
import com.realtycrm.mlssync.common.apiclient.model.ApiResponse;
import com.realtycrm.mlssync.common.json.JsonParser;
import com.realtycrm.mlssync.dto.reso.ResoCollectionResponse;
import com.realtycrm.mlssync.exception.AuthenticationException;
import com.realtycrm.mlssync.exception.ConnectivityException;
import com.realtycrm.mlssync.exception.apiclient.ApiException;
import com.realtycrm.mlssync.exception.json.JsonParsingException;
import com.realtycrm.mlssync.model.MediaKind;
import com.realtycrm.mlssync.service.provider.MediaReference;
import com.realtycrm.mlssync.service.provider.MlsProviderAdapter;
import com.realtycrm.mlssync.service.provider.ProviderHealth;
import com.realtycrm.mlssync.service.provider.ProviderRecord;
import com.realtycrm.mlssync.service.provider.RecordPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adapter for RESO Web API (OData v4) providers.
 *
 * <p>Pagination uses {@code $top}/{@code $skip}; the cursor is the next skip offset. Incremental extraction
 * filters on the modification timestamp field with {@code ge}. Media is read from the {@code Media} resource
 * by {@code ResourceRecordKey}.
 */
@Slf4j
public class ResoWebApiAdapter extends ApiClient implements MlsProviderAdapter {

    private final JsonParser jsonParser;
    private final ResoSettings settings;
    private final int pageSize;
    private final Duration timeout;
    private boolean connected;

    public ResoWebApiAdapter(final WebClient webClient, final Authentication authentication,
                             final JsonParser jsonParser, final ResoSettings settings, final int pageSize,
                             final Duration timeout) {
        super(webClient, authentication, new ResoHeaderConfig());
        this.jsonParser = jsonParser;
        this.settings = settings;
        this.pageSize = pageSize;
        this.timeout = timeout;
    }

    @Override
    protected Duration requestTimeout() {
        return timeout;
    }

    @Override
    public void connect() {
        if (connected) {
            return;
        }
        log.info("Connecting to RESO provider '{}'", settings.providerId());
        fetchOneKey();
        connected = true;
    }

    @Override
    public RecordPage fetchChangedRecords(final Instant since, final String cursor) {
        connect();
        final int skip = parseCursor(cursor);
        final Map<String, Object> query = new LinkedHashMap<>();
        query.put("$top", pageSize);
        query.put("$skip", skip);
        query.put("$orderby", settings.timestampField() + " asc");
        if (since != null) {
            query.put("$filter", settings.timestampField() + " ge " + DateTimeFormatter.ISO_INSTANT.format(since));
        }

        final ResoCollectionResponse response = get("/" + settings.resource(), query);
        final List<ProviderRecord> records = response.getValue().stream()
                                                     .filter(Objects::nonNull)
                                                     .map(ProviderRecord::new)
                                                     .toList();
        final boolean hasMore = response.getNextLink() != null || records.size() >= pageSize;
        final String nextCursor = hasMore && !records.isEmpty() ? String.valueOf(skip + records.size()) : null;
        log.debug("Fetched {} records from '{}' at offset {} (next cursor: {})", records.size(),
                  settings.providerId(), skip, nextCursor);
        return new RecordPage(records, nextCursor);
    }

    @Override
    public List<MediaReference> fetchMediaReferences(final String recordId) {
        connect();
        final Map<String, Object> query = new LinkedHashMap<>();
        query.put("$filter", "ResourceRecordKey eq '" + recordId.replace("'", "''") + "'");
        query.put("$orderby", "Order asc");

        final ResoCollectionResponse response = get("/" + settings.mediaResource(), query);
        final List<MediaReference> references = new ArrayList<>();
        for (Map<String, Object> media : response.getValue()) {
            final Object url = media.get("MediaURL");
            if (url == null || url.toString().isBlank()) {
                continue;
            }
            references.add(new MediaReference(
                    url.toString(),
                    MediaKind.classify(asString(media.get("MediaCategory")), url.toString()),
                    asInteger(media.get("Order")),
                    asString(media.get("ShortDescription"))));
        }
        return references;
    }

    @Override
    public ProviderHealth healthCheck() {
        final long start = System.nanoTime();
        try {
            fetchOneKey();
            return ProviderHealth.up(elapsedMillis(start));
        } catch (Exception e) {
            log.warn("Health check failed for RESO provider '{}': {}", settings.providerId(), e.getMessage());
            return ProviderHealth.down(e.getMessage(), elapsedMillis(start));
        }
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    private void fetchOneKey() {
        final Map<String, Object> query = new LinkedHashMap<>();
        query.put("$top", 1);
        query.put("$select", settings.keyField());
        get("/" + settings.resource(), query);
    }

    private ResoCollectionResponse get(final String path, final Map<String, Object> query) {
        final ApiRequest request = ApiRequest.builder()
                                             .method(HttpMethod.GET)
                                             .path(path)
                                             .queryParams(query)
                                             .build();
        try {
            final ApiResponse response = call(request);
            return jsonParser.parseObject(response.getData(), ResoCollectionResponse.class);
        } catch (ApiException e) {
            if (e.isAuthenticationFailure()) {
                throw new AuthenticationException(
                        "Provider '" + settings.providerId() + "' rejected the credentials: " + e.getMessage(), e);
            }
            throw new ConnectivityException(
                    "Provider '" + settings.providerId() + "' request to " + path + " failed: " + e.getMessage(), e);
        } catch (JsonParsingException e) {
            throw new ConnectivityException(
                    "Provider '" + settings.providerId() + "' returned an unreadable response from " + path, e);
        }
    }

    private static int parseCursor(final String cursor) {
        if (cursor == null) {
            return 0;
        }
        try {
            return Integer.parseInt(cursor);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid RESO cursor: " + cursor, e);
        }
    }

    private static String asString(final Object value) {
        return value == null ? null : value.toString();
    }

    private static Integer asInteger(final Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.valueOf(value.toString().trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private static long elapsedMillis(final long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    /**
     * Protocol settings taken from the provider's connection parameters.
     */
    public record ResoSettings(String providerId, String resource, String mediaResource, String keyField,
                               String timestampField) {
    }
}
