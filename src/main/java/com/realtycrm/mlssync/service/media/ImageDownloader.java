package com.realtycrm.mlssync.service.media;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import com.realtycrm.mlssync.exception.MediaProcessingException;
import com.realtycrm.mlssync.model.MediaStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Fetches source images into memory. The whole body is buffered, bounded by the media WebClient's codec
 * limit, and the request is abandoned after the configured timeout.
 */
@Slf4j
@Component
public class ImageDownloader {

    private final WebClient webClient;
    private final Duration timeout;

    public ImageDownloader(@Qualifier("mediaWebClient") final WebClient webClient,
                           final MlsSyncProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(properties.getMedia().getDownloadTimeoutSeconds());
    }

    /**
     * @throws MediaProcessingException at stage {@link MediaStage#DOWNLOAD} on any failure.
     */
    public byte[] download(final String sourceUrl) {
        log.debug("Downloading media from {}", sourceUrl);
        final byte[] body;
        try {
            body = webClient.get()
                            .uri(URI.create(sourceUrl))
                            .retrieve()
                            .bodyToMono(byte[].class)
                            .timeout(timeout)
                            .block();
        } catch (WebClientResponseException e) {
            throw new MediaProcessingException(MediaStage.DOWNLOAD,
                                               "Source responded with HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw translate(e);
        }
        if (body == null || body.length == 0) {
            throw new MediaProcessingException(MediaStage.DOWNLOAD, "Source returned an empty body");
        }
        return body;
    }

    private MediaProcessingException translate(final RuntimeException e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof TimeoutException) {
                return new MediaProcessingException(MediaStage.DOWNLOAD,
                                                    "Download timed out after " + timeout.toSeconds() + "s", e);
            }
            if (cause instanceof DataBufferLimitException) {
                return new MediaProcessingException(MediaStage.DOWNLOAD,
                                                    "Source exceeds the maximum image size", e);
            }
            cause = cause.getCause();
        }
        return new MediaProcessingException(MediaStage.DOWNLOAD, "Download failed: " + e.getMessage(), e);
    }
}
