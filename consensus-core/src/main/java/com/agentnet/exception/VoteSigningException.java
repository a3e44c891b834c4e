package com.agentnet.exception;

public class VoteSigningException extends ConsensusException {

    public VoteSigningException(String proposalId, Throwable cause) {
        super("failed to sign vote for proposal " + proposalId, cause);
    }
}
