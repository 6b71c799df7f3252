package com.realtycrm.mlssync.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code app.sync} section of application.yaml.
 */
@Data
@ConfigurationProperties(prefix = "app.sync")
public class MlsSyncProperties {

    private int defaultBatchSize = 1000;
    private int providerTimeoutSeconds = 30;
    private RetryConfig fetchRetry = new RetryConfig(3, 1000);
    private Scheduler scheduler = new Scheduler();
    private Executor executor = new Executor();
    private Media media = new Media();
    private Storage storage = new Storage();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private String tickCron = "0 */5 * * * *";
        private long staleRunMinutes = 120;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 16;
    }

    @Data
    public static class Media {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 500;
        private long downloadTimeoutSeconds = 20;
        private long maxSourceBytes = 20L * 1024 * 1024;
        private int minDimension = 32;
        private float quality = 0.8f;
        private long claimTimeoutMinutes = 30;
        private String recoveryCron = "0 */10 * * * *";
        private int recoveryBatchSize = 500;
        private RetryConfig uploadRetry = new RetryConfig(2, 500);
        private List<Variant> variants = new ArrayList<>(List.of(
                new Variant("thumbnail", 150, 150),
                new Variant("medium", 600, 400),
                new Variant("large", 1200, 800)));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Variant {
        private String name;
        private int width;
        private int height;
    }

    @Data
    public static class Storage {
        private String bucket;
        private String keyPrefix = "properties";
        /**
         * CDN base URL for stored objects; the S3 object URL is used when blank.
         */
        private String publicBaseUrl;
    }
}
