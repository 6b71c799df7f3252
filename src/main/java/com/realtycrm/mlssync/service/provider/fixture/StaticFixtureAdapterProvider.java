package com.realtycrm.mlssync.service.provider.fixture;

import com.realtycrm.mlssync.common.json.JsonParser;
import com.realtycrm.mlssync.exception.InvalidRequestException;
import com.realtycrm.mlssync.model.ProviderConfiguration;
import com.realtycrm.mlssync.model.ProviderType;
import com.realtycrm.mlssync.service.provider.MlsProviderAdapter;
import com.realtycrm.mlssync.service.provider.ProviderAdapterProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Builds {@link StaticFixtureAdapter}s. The fixture location is the {@code location} parameter or, failing
 * that, the configured endpoint; both accept Spring resource prefixes such as {@code classpath:}.
 */
@Component
public class StaticFixtureAdapterProvider implements ProviderAdapterProvider {

    private final ResourceLoader resourceLoader;
    private final JsonParser jsonParser;

    public StaticFixtureAdapterProvider(final ResourceLoader resourceLoader,
                                        @Qualifier("jacksonJsonParser") final JsonParser jsonParser) {
        this.resourceLoader = resourceLoader;
        this.jsonParser = jsonParser;
    }

    @Override
    public boolean supports(final ProviderType providerType) {
        return providerType == ProviderType.STATIC_FIXTURE;
    }

    @Override
    public MlsProviderAdapter create(final ProviderConfiguration configuration,
                                     final Map<String, String> parameters, final int pageSize) {
        final String location = StringUtils.hasText(parameters.get("location"))
                ? parameters.get("location")
                : configuration.getEndpoint();
        if (!StringUtils.hasText(location)) {
            throw new InvalidRequestException(
                    "Fixture provider '" + configuration.getProviderId() + "' has no location configured");
        }
        final StaticFixtureAdapter.FixtureSettings settings = new StaticFixtureAdapter.FixtureSettings(
                configuration.getProviderId(),
                parameters.getOrDefault("keyField", "ListingKey"),
                parameters.getOrDefault("timestampField", "ModificationTimestamp"),
                parameters.getOrDefault("mediaField", "Media"));
        return new StaticFixtureAdapter(resourceLoader.getResource(location), jsonParser, settings, pageSize);
    }
}
