package com.realtycrm.mlssync.service.storage;

import com.realtycrm.mlssync.exception.StorageException;

/**
 * Durable key-addressed blob store for processed media.
 */
public interface ObjectStorage {

    /**
     * Writes {@code content} under {@code key}, replacing any existing object.
     *
     * @throws StorageException when the write fails.
     */
    void put(String key, byte[] content, String contentType);

    /**
     * @return the URL consumers use to fetch the object stored under {@code key}.
     */
    String publicUrl(String key);
}
