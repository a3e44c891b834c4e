package com.agentnet.exception;

public class DuplicateVoteException extends ConsensusException {

    public DuplicateVoteException(String proposalId, String voterId) {
        super(voterId + " already voted on proposal " + proposalId);
    }
}
