package com.agentnet.exception;

public class ProposalClosedException extends ConsensusException {

    public ProposalClosedException(String proposalId, Object phase) {
        super("proposal " + proposalId + " is already " + phase);
    }
}
