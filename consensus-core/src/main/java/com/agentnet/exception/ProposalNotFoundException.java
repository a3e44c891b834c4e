package com.agentnet.exception;

public class ProposalNotFoundException extends ConsensusException {

    public ProposalNotFoundException(String proposalId) {
        super("proposal not found: " + proposalId);
    }
}
