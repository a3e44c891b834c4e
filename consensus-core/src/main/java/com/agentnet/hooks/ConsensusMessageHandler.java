package com.agentnet.hooks;

import com.agentnet.exception.ConsensusException;
import com.agentnet.message.ConsensusMessage;

/**
 * Receiving side of a broadcast: applies a peer's message to the local view.
 */
@FunctionalInterface
public interface ConsensusMessageHandler {
    void onMessage(ConsensusMessage message) throws ConsensusException;
}
