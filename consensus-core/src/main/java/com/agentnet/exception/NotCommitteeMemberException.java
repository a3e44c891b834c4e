package com.agentnet.exception;

public class NotCommitteeMemberException extends ConsensusException {

    public NotCommitteeMemberException(String nodeId) {
        super("not a committee member: " + nodeId);
    }
}
