package com.realtycrm.mlssync.service.media;

/**
 * One encoded variant, ready to be stored.
 */
public record RenderedVariant(String name, byte[] content, int width, int height) {
}
