package com.agentnet.hooks;

import com.agentnet.message.ConsensusMessage;

@FunctionalInterface
public interface Broadcaster {
    /**
     * Sends a consensus message to the other committee members. Delivery is best
     * effort.
     *
     * @param message message to propagate
     * @throws BroadcastException if the message could not be handed to the transport
     */
    void broadcast(ConsensusMessage message) throws BroadcastException;
}
