package com.agentnet.sweeper;

import java.time.Clock;
import java.time.Duration;

import com.agentnet.proposal.ProposalStore;

/**
 * Drops terminal proposals created before the retention window. Open proposals are
 * left for the timeout sweep no matter how old.
 */
public class RetentionSweeper {
    private final ProposalStore proposalStore;
    private final Clock clock;

    public RetentionSweeper(ProposalStore proposalStore, Clock clock) {
        this.proposalStore = proposalStore;
        this.clock = clock;
    }

    /**
     * @return the number of proposals removed
     */
    public int cleanupOldProposals(Duration maxAge) {
        long cutoff = clock.millis() - maxAge.toMillis();
        return proposalStore.removeIf(p -> p.isTerminal() && p.getCreatedAt() < cutoff);
    }
}
