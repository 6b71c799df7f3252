package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import com.realtycrm.mlssync.exception.MediaProcessingException;
import com.realtycrm.mlssync.model.MediaStage;
import lombok.extern.slf4j.Slf4j;
import net.coobird.thumbnailator.Thumbnails;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Validates source images and renders the configured size variants as JPEG. Variants are scaled down to fit
 * their bounding box with the aspect ratio kept; images are never enlarged.
 */
@Slf4j
@Component
public class ImageVariantGenerator {

    static final String OUTPUT_FORMAT = "jpg";
    static final String CONTENT_TYPE = "image/jpeg";

    private final MlsSyncProperties.Media config;

    public ImageVariantGenerator(final MlsSyncProperties properties) {
        this.config = properties.getMedia();
    }

    /**
     * Decodes and validates {@code content}.
     *
     * @throws MediaProcessingException at stage {@link MediaStage#VALIDATE} for oversized, undecodable or
     *                                  degenerate images.
     */
    public SourceImage inspect(final byte[] content) {
        if (content.length > config.getMaxSourceBytes()) {
            throw new MediaProcessingException(MediaStage.VALIDATE,
                                               "Image of " + content.length + " bytes exceeds the limit of "
                                               + config.getMaxSourceBytes());
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            final Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new MediaProcessingException(MediaStage.VALIDATE, "Unrecognized image format");
            }
            final ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                final String format = reader.getFormatName().toLowerCase(Locale.ROOT);
                final BufferedImage image = reader.read(0);
                final int width = image.getWidth();
                final int height = image.getHeight();
                if (width < config.getMinDimension() || height < config.getMinDimension()) {
                    throw new MediaProcessingException(MediaStage.VALIDATE,
                                                       String.format("Image of %dx%d is below the minimum of %dpx",
                                                                     width, height, config.getMinDimension()));
                }
                return new SourceImage(image, format, width, height, content.length);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof MediaProcessingException mediaException) {
                throw mediaException;
            }
            throw new MediaProcessingException(MediaStage.VALIDATE, "Image could not be decoded: " + e.getMessage(),
                                               e);
        }
    }

    /**
     * Renders every configured variant, in configuration order.
     *
     * @throws MediaProcessingException at stage {@link MediaStage#PROCESS} when encoding fails.
     */
    public List<RenderedVariant> render(final SourceImage source) {
        final BufferedImage rgb = toRgb(source.image());
        final List<RenderedVariant> variants = new ArrayList<>();
        for (MlsSyncProperties.Variant variant : config.getVariants()) {
            final int boxWidth = Math.min(variant.getWidth(), source.width());
            final int boxHeight = Math.min(variant.getHeight(), source.height());
            try {
                final BufferedImage resized = Thumbnails.of(rgb)
                                                        .size(boxWidth, boxHeight)
                                                        .keepAspectRatio(true)
                                                        .asBufferedImage();
                final ByteArrayOutputStream out = new ByteArrayOutputStream();
                Thumbnails.of(resized)
                          .scale(1.0)
                          .outputFormat(OUTPUT_FORMAT)
                          .outputQuality(config.getQuality())
                          .toOutputStream(out);
                variants.add(new RenderedVariant(variant.getName(), out.toByteArray(), resized.getWidth(),
                                                 resized.getHeight()));
            } catch (IOException e) {
                throw new MediaProcessingException(MediaStage.PROCESS,
                                                   "Failed to render variant '" + variant.getName() + "'", e);
            }
        }
        log.debug("Rendered {} variants from a {}x{} {} image", variants.size(), source.width(), source.height(),
                  source.format());
        return variants;
    }

    // JPEG has no alpha channel; transparent pixels are flattened onto white.
    private static BufferedImage toRgb(final BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        final BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        final Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }
}
