package com.realtycrm.mlssync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient used to download listing images. The in-memory codec limit is the byte-size ceiling for a
 * single source image.
 */
@Slf4j
@Configuration
public class MediaWebClientConfig {

    @Bean("mediaWebClient")
    public WebClient mediaWebClient(MlsSyncProperties properties) {
        final int maxBytes = (int) Math.min(Integer.MAX_VALUE, properties.getMedia().getMaxSourceBytes());
        log.info("Initializing media WebClient with a {} byte download ceiling", maxBytes);
        return WebClient.builder()
                        .exchangeStrategies(ExchangeStrategies.builder()
                                                              .codecs(codecs -> codecs.defaultCodecs()
                                                                                      .maxInMemorySize(maxBytes))
                                                              .build())
                        .build();
    }
}
