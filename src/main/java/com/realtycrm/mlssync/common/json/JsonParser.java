package com.realtycrm.mlssync.common.json;

/**
 * Parses JSON payloads into typed objects.
 */
public interface JsonParser {

    /**
     * @throws com.realtycrm.mlssync.exception.json.JsonParsingException if the JSON is malformed or does not
     *                                                                   fit {@code valueType}.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * @throws com.realtycrm.mlssync.exception.json.JsonParsingException if the JSON is malformed or does not
     *                                                                   fit {@code valueType}.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
