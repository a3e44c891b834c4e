package com.agentnet.hooks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.agentnet.message.ConsensusMessage;

/**
 * Broadcaster for a node with no transport attached: records each outgoing message
 * in the log and drops it.
 */
public class LoggingBroadcaster implements Broadcaster {

    private final Logger logger;

    public LoggingBroadcaster() {
        this(LoggerFactory.getLogger(LoggingBroadcaster.class));
    }

    // constructor with injectable logger for testing
    LoggingBroadcaster(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void broadcast(ConsensusMessage message) {
        logger.info("Consensus message: {}, proposal: {}, sender: {}, sequence: {}, view: {}",
                message.getType(),
                message.getProposalId(),
                message.getSenderId(),
                message.getSequence(),
                message.getView());
    }
}
