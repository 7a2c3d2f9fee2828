package com.squadron.core.config;

import com.squadron.agent.AgentSlotPool;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "squadron")
public class SquadronProperties {

    private Agent agent = new Agent();
    private Worktree worktree = new Worktree();
    private Pr pr = new Pr();

    /** Static credentials keyed by credential-store key; environment variables take precedence. */
    private Map<String, String> credentials = new HashMap<>();

    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Worktree getWorktree() { return worktree; }
    public void setWorktree(Worktree worktree) { this.worktree = worktree; }
    public Pr getPr() { return pr; }
    public void setPr(Pr pr) { this.pr = pr; }
    public Map<String, String> getCredentials() { return credentials; }
    public void setCredentials(Map<String, String> credentials) { this.credentials = credentials; }

    public static class Agent {
        private String binary = "claude";
        private int replayBufferSize = 100;
        private String defaultModel = "";
        private int defaultMaxTurns = 0;
        private String tokenEnvVar = "ANTHROPIC_API_KEY";
        private String credentialKey = "anthropic";
        private boolean detectInterventions = true;
        private int maxConcurrent = 5;
        private AgentSlotPool.QueueStrategy queueStrategy = AgentSlotPool.QueueStrategy.FIFO;

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public int getReplayBufferSize() { return replayBufferSize; }
        public void setReplayBufferSize(int replayBufferSize) { this.replayBufferSize = replayBufferSize; }
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
        public int getDefaultMaxTurns() { return defaultMaxTurns; }
        public void setDefaultMaxTurns(int defaultMaxTurns) { this.defaultMaxTurns = defaultMaxTurns; }
        public String getTokenEnvVar() { return tokenEnvVar; }
        public void setTokenEnvVar(String tokenEnvVar) { this.tokenEnvVar = tokenEnvVar; }
        public String getCredentialKey() { return credentialKey; }
        public void setCredentialKey(String credentialKey) { this.credentialKey = credentialKey; }
        public boolean isDetectInterventions() { return detectInterventions; }
        public void setDetectInterventions(boolean detectInterventions) { this.detectInterventions = detectInterventions; }
        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public AgentSlotPool.QueueStrategy getQueueStrategy() { return queueStrategy; }
        public void setQueueStrategy(AgentSlotPool.QueueStrategy queueStrategy) { this.queueStrategy = queueStrategy; }
    }

    public static class Worktree {
        private String baseDir = Path.of(System.getProperty("user.home"), ".squadron", "worktrees").toString();
        private int maxPerRepo = 10;
        private long staleHours = 24;
        private boolean autoCleanup = true;
        private boolean verifyCleanOnRelease = true;
        private boolean deleteBranchOnRelease = false;

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
        public int getMaxPerRepo() { return maxPerRepo; }
        public void setMaxPerRepo(int maxPerRepo) { this.maxPerRepo = maxPerRepo; }
        public long getStaleHours() { return staleHours; }
        public void setStaleHours(long staleHours) { this.staleHours = staleHours; }
        public boolean isAutoCleanup() { return autoCleanup; }
        public void setAutoCleanup(boolean autoCleanup) { this.autoCleanup = autoCleanup; }
        public boolean isVerifyCleanOnRelease() { return verifyCleanOnRelease; }
        public void setVerifyCleanOnRelease(boolean verifyCleanOnRelease) { this.verifyCleanOnRelease = verifyCleanOnRelease; }
        public boolean isDeleteBranchOnRelease() { return deleteBranchOnRelease; }
        public void setDeleteBranchOnRelease(boolean deleteBranchOnRelease) { this.deleteBranchOnRelease = deleteBranchOnRelease; }
    }

    public static class Pr {
        private String apiUrl = "https://api.github.com";
        private String credentialKey = "github";
        private int timeoutSeconds = 30;

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getCredentialKey() { return credentialKey; }
        public void setCredentialKey(String credentialKey) { this.credentialKey = credentialKey; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
