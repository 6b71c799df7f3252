package com.realtycrm.mlssync.model;

/**
 * The protocol family of an MLS data source. Each type is served by one adapter implementation.
 */
public enum ProviderType {
    /**
     * A RESO Web API (OData) endpoint.
     */
    RESO_WEB_API,
    /**
     * A JSON document of listings, loaded from the classpath or the filesystem.
     */
    STATIC_FIXTURE
}
