package com.realtycrm.mlssync.service.provider;

import com.realtycrm.mlssync.model.ProviderConfiguration;
import com.realtycrm.mlssync.model.ProviderType;

import java.util.Map;

/**
 * Creates adapters for one {@link ProviderType}. Implementations are Spring beans picked up by
 * {@link ProviderAdapterFactory}.
 */
public interface ProviderAdapterProvider {

    boolean supports(ProviderType providerType);

    /**
     * @param configuration      The provider configuration.
     * @param resolvedParameters Connection parameters with placeholders already resolved.
     * @param pageSize           Records to request per page.
     */
    MlsProviderAdapter create(ProviderConfiguration configuration, Map<String, String> resolvedParameters,
                              int pageSize);
}
