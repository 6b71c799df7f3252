package com.realtycrm.mlssync.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Everything needed to send one request through an {@link com.realtycrm.mlssync.common.apiclient.ApiClient}.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * Path relative to the client's base URL; may contain {@code {placeholders}} filled from
     * {@link #pathVariables}.
     */
    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    @Nullable
    private final Map<String, Object> pathVariables;

    private final Map<String, String> headers = new HashMap<>();

    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;
}
