package com.agentnet.proposal;

/**
 * Lifecycle of a proposal. Voting is a single round, so a proposal goes straight from
 * {@link #PENDING} to one of the terminal phases and never leaves it.
 */
public enum ConsensusPhase {
    PENDING,
    FINALIZED,
    REJECTED,
    TIMEOUT;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
