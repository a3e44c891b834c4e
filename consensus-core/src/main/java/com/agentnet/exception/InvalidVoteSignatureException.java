package com.agentnet.exception;

public class InvalidVoteSignatureException extends ConsensusException {

    public InvalidVoteSignatureException(String message) {
        super(message);
    }
}
