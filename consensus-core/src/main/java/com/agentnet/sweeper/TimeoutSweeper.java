package com.agentnet.sweeper;

import java.time.Clock;

import com.agentnet.proposal.Proposal;
import com.agentnet.proposal.ProposalStore;
import com.agentnet.voting.VotingEngine;

/**
 * Moves open proposals whose deadline has passed to TIMEOUT. Runs only when invoked.
 */
public class TimeoutSweeper {
    private final ProposalStore proposalStore;
    private final VotingEngine votingEngine;
    private final Clock clock;

    public TimeoutSweeper(ProposalStore proposalStore, VotingEngine votingEngine, Clock clock) {
        this.proposalStore = proposalStore;
        this.votingEngine = votingEngine;
        this.clock = clock;
    }

    /**
     * @return the number of proposals moved to TIMEOUT by this call
     */
    public int checkTimeouts() {
        long now = clock.millis();
        int count = 0;
        for (Proposal proposal : proposalStore.pending()) {
            if (proposal.getDeadline() < now) {
                votingEngine.expire(proposal);
                count++;
            }
        }
        return count;
    }
}
