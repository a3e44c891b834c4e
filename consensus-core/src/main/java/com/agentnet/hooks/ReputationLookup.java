package com.agentnet.hooks;

@FunctionalInterface
public interface ReputationLookup {
    double getReputation(String nodeId);
}
