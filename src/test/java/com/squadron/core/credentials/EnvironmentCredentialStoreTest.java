package com.squadron.core.credentials;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentCredentialStoreTest {

    @Test
    void environmentTakesPrecedenceOverConfiguration() {
        var env = Map.of("SQUADRON_CREDENTIAL_GITHUB", "env-token");
        var store = new EnvironmentCredentialStore(env::get, Map.of("github", "config-token"));

        assertEquals(Optional.of("env-token"), store.getCredential("github"));
    }

    @Test
    void fallsBackToConfiguredValue() {
        var store = new EnvironmentCredentialStore(name -> null, Map.of("anthropic", "sk-config"));

        assertEquals(Optional.of("sk-config"), store.getCredential("anthropic"));
    }

    @Test
    void dashesBecomeUnderscoresInVariableName() {
        var env = Map.of("SQUADRON_CREDENTIAL_GITHUB_ENTERPRISE", "ghe");
        var store = new EnvironmentCredentialStore(env::get, Map.of());

        assertEquals(Optional.of("ghe"), store.getCredential("github-enterprise"));
    }

    @Test
    void blankAndMissingValuesAreEmpty() {
        var env = Map.of("SQUADRON_CREDENTIAL_GITHUB", "  ");
        var store = new EnvironmentCredentialStore(env::get, Map.of("github", ""));

        assertTrue(store.getCredential("github").isEmpty());
        assertTrue(store.getCredential("unknown").isEmpty());
        assertTrue(store.getCredential(null).isEmpty());
    }
}
