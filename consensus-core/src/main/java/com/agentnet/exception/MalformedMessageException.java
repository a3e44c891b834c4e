package com.agentnet.exception;

public class MalformedMessageException extends ConsensusException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
