package com.squadron.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.squadron.agent.ProcessLauncher;
import com.squadron.core.credentials.CredentialStore;
import com.squadron.core.credentials.EnvironmentCredentialStore;
import com.squadron.workspace.git.GitService;
import com.squadron.workspace.multirepo.GitHubPullRequestClient;
import com.squadron.workspace.multirepo.PullRequestClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Spring configuration for the cross-cutting collaborators of the orchestrator and the
 * worktree allocator.
 */
@Configuration
public class SquadronConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Metrics stay in memory unless an actuator-backed registry is present. */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialStore credentialStore(SquadronProperties properties) {
        return new EnvironmentCredentialStore(properties.getCredentials());
    }

    @Bean
    public ProcessLauncher processLauncher() {
        return ProcessLauncher.system();
    }

    @Bean
    public GitService gitService() {
        return new GitService();
    }

    @Bean
    @ConditionalOnMissingBean
    public PullRequestClient pullRequestClient(ObjectMapper objectMapper, CredentialStore credentialStore,
                                               SquadronProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        return new GitHubPullRequestClient(httpClient, objectMapper, credentialStore, properties.getPr());
    }
}
