package com.realtycrm.mlssync.service.provider;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import com.realtycrm.mlssync.exception.MlsSyncException;
import com.realtycrm.mlssync.model.ProviderConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Selects the {@link ProviderAdapterProvider} for a configuration's type and builds a fresh adapter.
 */
@Slf4j
@Service
public class ProviderAdapterFactory {

    private final List<ProviderAdapterProvider> providers;
    private final ProviderCredentialResolver credentialResolver;
    private final MlsSyncProperties properties;

    public ProviderAdapterFactory(final List<ProviderAdapterProvider> providers,
                                  final ProviderCredentialResolver credentialResolver,
                                  final MlsSyncProperties properties) {
        this.providers = providers;
        this.credentialResolver = credentialResolver;
        this.properties = properties;
        log.info("ProviderAdapterFactory initialized with {} adapter providers.", providers.size());
    }

    public MlsProviderAdapter create(final ProviderConfiguration configuration) {
        final ProviderAdapterProvider provider = providers.stream()
                                                          .filter(p -> p.supports(configuration.getProviderType()))
                                                          .findFirst()
                                                          .orElseThrow(() -> new MlsSyncException(
                                                                  "No adapter available for provider type "
                                                                  + configuration.getProviderType()));
        final Map<String, String> parameters = credentialResolver.resolve(configuration);
        log.debug("Creating {} adapter for provider '{}'", configuration.getProviderType(),
                  configuration.getProviderId());
        return provider.create(configuration, parameters, pageSize(configuration));
    }

    public int pageSize(final ProviderConfiguration configuration) {
        final Integer configured = configuration.getBatchSize();
        return configured != null && configured > 0 ? configured : properties.getDefaultBatchSize();
    }
}
