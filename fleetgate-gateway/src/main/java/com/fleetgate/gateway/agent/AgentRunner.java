package com.fleetgate.gateway.agent;

/**
 * Executes one agent turn. The LLM loop itself lives behind this seam.
 */
public interface AgentRunner {

    /**
     * Run an agent against a work item and block until it produces its final response.
     */
    AgentRunResult runAgent(String agentId, String workItemId, AgentRunOptions options);
}
