package com.squadron.core.credentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves credentials from {@code SQUADRON_CREDENTIAL_<KEY>} environment variables,
 * falling back to statically configured values ({@code squadron.credentials.<key>}).
 */
public class EnvironmentCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentCredentialStore.class);

    static final String ENV_PREFIX = "SQUADRON_CREDENTIAL_";

    private final Function<String, String> environment;
    private final Map<String, String> configured;

    public EnvironmentCredentialStore(Map<String, String> configured) {
        this(System::getenv, configured);
    }

    EnvironmentCredentialStore(Function<String, String> environment, Map<String, String> configured) {
        this.environment = environment;
        this.configured = configured != null ? Map.copyOf(configured) : Map.of();
    }

    @Override
    public Optional<String> getCredential(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String envName = ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('-', '_');
        String fromEnv = environment.apply(envName);
        if (fromEnv != null && !fromEnv.isBlank()) {
            log.debug("Resolved credential '{}' from environment", key);
            return Optional.of(fromEnv);
        }
        String fromConfig = configured.get(key);
        if (fromConfig != null && !fromConfig.isBlank()) {
            log.debug("Resolved credential '{}' from configuration", key);
            return Optional.of(fromConfig);
        }
        return Optional.empty();
    }
}
