package com.realtycrm.mlssync.service.provider;

import com.realtycrm.mlssync.exception.AuthenticationException;
import com.realtycrm.mlssync.model.ProviderConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolves {@code ${...}} placeholders in connection parameters against the Spring {@link Environment},
 * so stored configurations reference secrets instead of containing them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderCredentialResolver {

    private final Environment environment;

    public Map<String, String> resolve(final ProviderConfiguration configuration) {
        final Map<String, String> resolved = new HashMap<>();
        configuration.getConnectionParameters().forEach((name, value) -> {
            try {
                resolved.put(name, value == null ? null : environment.resolveRequiredPlaceholders(value));
            } catch (IllegalArgumentException e) {
                log.error("Unresolvable connection parameter '{}' for provider '{}'", name,
                          configuration.getProviderId());
                throw new AuthenticationException(
                        "Connection parameter '" + name + "' references an undefined variable", e);
            }
        });
        return resolved;
    }
}
