package com.realtycrm.mlssync.config;

import com.realtycrm.mlssync.exception.ConnectivityException;
import com.realtycrm.mlssync.service.sync.ProviderFetchRetryListener;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for provider page fetches. Adapters are created per run rather than as Spring beans, so the
 * fetch is wrapped in a template instead of {@code @Retryable}.
 */
@Configuration
@RequiredArgsConstructor
public class SyncRetryConfig {

    private final MlsSyncProperties properties;

    @Bean("providerFetchRetryTemplate")
    public RetryTemplate providerFetchRetryTemplate(ProviderFetchRetryListener listener) {
        final MlsSyncProperties.RetryConfig retry = properties.getFetchRetry();
        return RetryTemplate.builder()
                            .maxAttempts(Math.max(1, retry.getAttempts() + 1))
                            .fixedBackoff(Math.max(1, retry.getDelayMs()))
                            .retryOn(ConnectivityException.class)
                            .withListener(listener)
                            .build();
    }
}
