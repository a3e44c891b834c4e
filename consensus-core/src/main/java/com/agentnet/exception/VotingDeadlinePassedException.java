package com.agentnet.exception;

/**
 * Raised for a vote arriving after the proposal deadline. The proposal has already been
 * moved to the timeout phase when this is thrown.
 */
public class VotingDeadlinePassedException extends ConsensusException {

    public VotingDeadlinePassedException(String proposalId) {
        super("voting deadline passed for proposal " + proposalId);
    }
}
