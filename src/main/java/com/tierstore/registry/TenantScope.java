package com.tierstore.registry;

/**
 * Workspace plus optional agent. Data written without an agent is shared by the whole workspace.
 */
public record TenantScope(String workspace, String agent) {

    public TenantScope {
        if (workspace == null || workspace.isBlank()) {
            throw new IllegalArgumentException("workspace must not be blank");
        }
        workspace = workspace.strip();
        agent = agent == null || agent.isBlank() ? null : agent.strip();
    }

    public static TenantScope workspace(String workspace) {
        return new TenantScope(workspace, null);
    }

    public static TenantScope of(String workspace, String agent) {
        return new TenantScope(workspace, agent);
    }

    /** Value stored in the {@code agent} field; empty for workspace-shared data. */
    public String agentKey() {
        return agent == null ? "" : agent;
    }

    @Override
    public String toString() {
        return agent == null ? workspace : workspace + "/" + agent;
    }
}
