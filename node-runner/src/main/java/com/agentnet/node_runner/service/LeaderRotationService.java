package com.agentnet.node_runner.service;

import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Service;

import com.agentnet.node.ConsensusListener;
import com.agentnet.node.ConsensusManager;
import com.agentnet.proposal.Proposal;

import lombok.extern.slf4j.Slf4j;

/**
 * Rotates the committee leader after every {@code rotationInterval} resolved
 * proposals.
 */
@Service
@Slf4j
public class LeaderRotationService implements ConsensusListener {
    private final ConsensusManager consensusManager;
    private final int rotationInterval;
    private final AtomicLong resolvedCount = new AtomicLong();

    public LeaderRotationService(ConsensusManager consensusManager) {
        this.consensusManager = consensusManager;
        this.rotationInterval = consensusManager.getConfig().getRotationInterval();
    }

    @Override
    public void onProposalResolved(Proposal proposal) {
        long count = resolvedCount.incrementAndGet();
        if (count % rotationInterval == 0) {
            log.info("{}: {} proposals resolved, rotating leader", consensusManager.getNodeId(), count);
            consensusManager.rotateLeader();
        }
    }

    public long getResolvedCount() {
        return resolvedCount.get();
    }
}
