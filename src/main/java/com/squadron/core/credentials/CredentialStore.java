package com.squadron.core.credentials;

import java.util.Optional;

/**
 * Source of secrets such as the worker authentication token or the hosting API token.
 * Values are treated opaquely by callers.
 */
@FunctionalInterface
public interface CredentialStore {

    /**
     * @param key logical credential name, e.g. "anthropic" or "github"
     * @return the secret, or empty if none is configured
     */
    Optional<String> getCredential(String key);
}
