package com.realtycrm.mlssync.service.storage;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import com.realtycrm.mlssync.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * {@link ObjectStorage} backed by an S3 bucket. Objects are served from the configured CDN base URL when
 * one is set, otherwise from the bucket's own URL.
 */
@Slf4j
@Service
public class S3ObjectStorage implements ObjectStorage {

    private final S3Client s3Client;
    private final String bucketName;
    private final String publicBaseUrl;

    public S3ObjectStorage(final S3Client s3Client, final MlsSyncProperties properties) {
        this.s3Client = s3Client;
        this.bucketName = properties.getStorage().getBucket();
        this.publicBaseUrl = properties.getStorage().getPublicBaseUrl();
        log.info("S3ObjectStorage initialized for bucket '{}'{}", bucketName,
                 StringUtils.hasText(publicBaseUrl) ? " served from " + publicBaseUrl : "");
    }

    @Override
    @Retryable(retryFor = {StorageException.class},
            maxAttemptsExpression = "#{${app.sync.media.upload-retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.sync.media.upload-retry.delay-ms:500}}"),
            listeners = {"storageRetryListener"})
    public void put(final String key, final byte[] content, final String contentType) {
        log.debug("Uploading {} bytes to S3 key: {}", content.length, key);
        final PutObjectRequest request = PutObjectRequest.builder()
                                                         .bucket(bucketName)
                                                         .key(key)
                                                         .contentType(contentType)
                                                         .contentLength((long) content.length)
                                                         .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new StorageException("Failed to upload object to S3 key " + key, e);
        }
    }

    @Override
    public String publicUrl(final String key) {
        if (StringUtils.hasText(publicBaseUrl)) {
            final String base = publicBaseUrl.endsWith("/") ? publicBaseUrl : publicBaseUrl + "/";
            return base + key;
        }
        return s3Client.utilities().getUrl(GetUrlRequest.builder().bucket(bucketName).key(key).build()).toString();
    }
}
