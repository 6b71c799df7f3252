package com.realtycrm.mlssync.service.provider;

import com.realtycrm.mlssync.exception.AuthenticationException;
import com.realtycrm.mlssync.exception.ConnectivityException;

import java.time.Instant;
import java.util.List;

/**
 * Uniform capability contract over one external MLS data source. An adapter instance serves a single run
 * and holds whatever connection state its protocol needs.
 */
public interface MlsProviderAdapter {

    /**
     * Establishes and validates the connection. Calling it again on a connected adapter does nothing.
     *
     * @throws AuthenticationException when the provider rejects the credentials.
     * @throws ConnectivityException   when the provider cannot be reached.
     */
    void connect();

    /**
     * Fetches one page of provider-native records.
     *
     * @param since  {@code null} for a full extraction, otherwise only records modified at or after this instant.
     * @param cursor {@code null} for the first page, otherwise the {@link RecordPage#nextCursor()} of the
     *               previous page.
     *
     * @return the page; {@link RecordPage#nextCursor()} is {@code null} once the sequence is exhausted.
     */
    RecordPage fetchChangedRecords(Instant since, String cursor);

    /**
     * Lists the media attached to one listing.
     *
     * @param recordId The provider's listing key.
     */
    List<MediaReference> fetchMediaReferences(String recordId);

    /**
     * Cheap liveness check. Never throws; failures are reported in the returned value.
     */
    ProviderHealth healthCheck();

    /**
     * Releases connection state. Safe to call at any time, including before {@link #connect()}.
     */
    void disconnect();
}
