package com.agentnet.exception;

public class TooManyPendingProposalsException extends ConsensusException {

    public TooManyPendingProposalsException(int pendingCount) {
        super("too many pending proposals (" + pendingCount + ")");
    }
}
