package com.agentnet.node;

import com.agentnet.proposal.Proposal;

public interface ConsensusListener {
    /**
     * Called once when a proposal reaches a terminal phase, after the manager's lock
     * has been released
     *
     * @param proposal snapshot of the proposal, result attached
     */
    void onProposalResolved(Proposal proposal);
}
