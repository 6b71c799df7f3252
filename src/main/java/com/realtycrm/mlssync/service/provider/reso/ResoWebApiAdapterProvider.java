package com.realtycrm.mlssync.service.provider.reso;

import com.realtycrm.mlssync.common.apiclient.authentication.Authentication;
import com.realtycrm.mlssync.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.realtycrm.mlssync.common.apiclient.authentication.impl.BasicAuthentication;
import com.realtycrm.mlssync.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.realtycrm.mlssync.common.json.JsonParser;
import com.realtycrm.mlssync.config.MlsSyncProperties;
import com.realtycrm.mlssync.exception.AuthenticationException;
import com.realtycrm.mlssync.exception.InvalidRequestException;
import com.realtycrm.mlssync.model.ProviderConfiguration;
import com.realtycrm.mlssync.model.ProviderType;
import com.realtycrm.mlssync.service.provider.MlsProviderAdapter;
import com.realtycrm.mlssync.service.provider.ProviderAdapterProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Builds {@link ResoWebApiAdapter}s. Recognised connection parameters: {@code accessToken}, or
 * {@code apiKey} with optional {@code apiKeyHeader}, or {@code username}/{@code password}; plus the optional
 * {@code resource}, {@code mediaResource}, {@code keyField} and {@code timestampField}.
 */
@Slf4j
@Component
public class ResoWebApiAdapterProvider implements ProviderAdapterProvider {

    static final int MAX_PAGE_BYTES = 32 * 1024 * 1024;

    private final WebClient.Builder webClientBuilder;
    private final JsonParser jsonParser;
    private final MlsSyncProperties properties;

    public ResoWebApiAdapterProvider(final WebClient.Builder webClientBuilder,
                                     @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
                                     final MlsSyncProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.jsonParser = jsonParser;
        this.properties = properties;
    }

    @Override
    public boolean supports(final ProviderType providerType) {
        return providerType == ProviderType.RESO_WEB_API;
    }

    @Override
    public MlsProviderAdapter create(final ProviderConfiguration configuration,
                                     final Map<String, String> parameters, final int pageSize) {
        if (!StringUtils.hasText(configuration.getEndpoint())) {
            throw new InvalidRequestException(
                    "Provider '" + configuration.getProviderId() + "' has no endpoint configured");
        }
        final WebClient webClient = webClientBuilder.clone()
                                                    .baseUrl(configuration.getEndpoint())
                                                    .codecs(codecs -> codecs.defaultCodecs()
                                                                            .maxInMemorySize(MAX_PAGE_BYTES))
                                                    .build();
        final ResoWebApiAdapter.ResoSettings settings = new ResoWebApiAdapter.ResoSettings(
                configuration.getProviderId(),
                parameters.getOrDefault("resource", "Property"),
                parameters.getOrDefault("mediaResource", "Media"),
                parameters.getOrDefault("keyField", "ListingKey"),
                parameters.getOrDefault("timestampField", "ModificationTimestamp"));
        return new ResoWebApiAdapter(webClient, authenticationFor(configuration, parameters), jsonParser, settings,
                                     pageSize, Duration.ofSeconds(properties.getProviderTimeoutSeconds()));
    }

    static Authentication authenticationFor(final ProviderConfiguration configuration,
                                            final Map<String, String> parameters) {
        if (StringUtils.hasText(parameters.get("accessToken"))) {
            return new BearerTokenAuthentication(parameters.get("accessToken"));
        }
        if (StringUtils.hasText(parameters.get("apiKey"))) {
            return new APIKeyAuthentication(parameters.getOrDefault("apiKeyHeader", "X-Api-Key"),
                                            parameters.get("apiKey"));
        }
        final String username = parameters.get("username");
        if (StringUtils.hasText(username)) {
            final String password = parameters.get("password");
            if (!StringUtils.hasText(password)) {
                throw new AuthenticationException(
                        "Provider '" + configuration.getProviderId() + "' has a username but no password");
            }
            return new BasicAuthentication(username, password);
        }
        log.warn("Provider '{}' has no credentials configured; requests will be sent unauthenticated.",
                 configuration.getProviderId());
        return Authentication.none();
    }
}
