package com.realtycrm.mlssync.service.media;

import java.awt.image.BufferedImage;

/**
 * A decoded source image that passed validation.
 */
public record SourceImage(BufferedImage image, String format, int width, int height, long byteSize) {
}
