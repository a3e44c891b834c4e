package com.agentnet.exception;

/**
 * Base class for every refusal raised by the consensus core. None of these are fatal;
 * state is unchanged unless the subclass documents a side effect.
 */
public class ConsensusException extends Exception {

    public ConsensusException(String message) {
        super(message);
    }

    public ConsensusException(String message, Throwable cause) {
        super(message, cause);
    }
}
