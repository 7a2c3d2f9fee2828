package com.squadron.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Squadron-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProcess(String processId, String agentId) {
        MDC.put("processId", processId);
        MDC.put("agentId", agentId);
    }

    public static void setFeature(String featureBranch) {
        MDC.put("featureBranch", featureBranch);
    }

    public static void setRepo(String featureBranch, String repo) {
        MDC.put("featureBranch", featureBranch);
        MDC.put("repo", repo);
    }

    public static void clear() {
        MDC.remove("processId");
        MDC.remove("agentId");
        MDC.remove("featureBranch");
        MDC.remove("repo");
    }
}
