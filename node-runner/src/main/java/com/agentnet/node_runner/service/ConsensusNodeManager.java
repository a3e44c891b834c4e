package com.agentnet.node_runner.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.agentnet.committee.CommitteeMember;
import com.agentnet.node.ConsensusManager;
import com.agentnet.node_runner.config.NodeConfig;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class ConsensusNodeManager {

    private final NodeConfig config;
    private final LeaderRotationService leaderRotationService;
    private final Clock clock;

    @Getter
    private final ConsensusManager consensusManager;

    public ConsensusNodeManager(NodeConfig config, ConsensusManager consensusManager,
            LeaderRotationService leaderRotationService, Clock clock) {
        this.config = config;
        this.consensusManager = consensusManager;
        this.leaderRotationService = leaderRotationService;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        log.info("ConsensusNodeManager starting node: {}", config.getNodeId());
        consensusManager.setCommittee(initialCommittee());
        consensusManager.addListener(leaderRotationService);
        consensusManager.start();
    }

    @PreDestroy
    public void stop() {
        consensusManager.removeListener(leaderRotationService);
        consensusManager.stop();
    }

    private List<CommitteeMember> initialCommittee() {
        List<CommitteeMember> members = new ArrayList<>();
        long now = clock.millis();
        for (NodeConfig.Member member : config.getCommittee()) {
            members.add(new CommitteeMember(member.getNodeId(), member.getPublicKey(), member.getReputation(), now));
        }
        return members;
    }

    public String getNodeId() {
        return config.getNodeId();
    }

    public boolean isLeader() {
        return consensusManager.isLeader();
    }

    public boolean isCommitteeMember() {
        return consensusManager.isCommitteeMember();
    }

    public int getPendingProposalCount() {
        return consensusManager.getPendingProposals().size();
    }
}
