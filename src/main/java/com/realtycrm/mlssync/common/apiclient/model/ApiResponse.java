package com.realtycrm.mlssync.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Raw result of a successful outbound call; the body is left as bytes for the caller's parser.
 */
@Builder
@Getter
public class ApiResponse {

    @Nullable
    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    private final Instant timestamp;
}
