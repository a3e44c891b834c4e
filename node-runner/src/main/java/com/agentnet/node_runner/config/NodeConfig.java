package com.agentnet.node_runner.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.agentnet.config.ConsensusConfig;

import lombok.Data;

@Configuration
@ConfigurationProperties(prefix = "consensus")
@Data
public class NodeConfig {
    private String nodeId;
    // initial committee; the first entry starts as leader
    private List<Member> committee = new ArrayList<>();

    private int minCommitteeSize = ConsensusConfig.DEFAULT_MIN_COMMITTEE_SIZE;
    private int defaultCommitteeSize = ConsensusConfig.DEFAULT_COMMITTEE_SIZE;
    private int maxCommitteeSize = ConsensusConfig.DEFAULT_MAX_COMMITTEE_SIZE;
    private double quorumFraction = ConsensusConfig.DEFAULT_QUORUM_FRACTION;
    private Duration votingTimeout = ConsensusConfig.DEFAULT_VOTING_TIMEOUT;
    private int maxPendingProposals = ConsensusConfig.DEFAULT_MAX_PENDING_PROPOSALS;
    private int rotationInterval = ConsensusConfig.DEFAULT_ROTATION_INTERVAL;
    private Duration retention = Duration.ofHours(1);
    private Duration sweepInterval = Duration.ofSeconds(1);

    @Data
    public static class Member {
        private String nodeId;
        private String publicKey;
        private double reputation;
    }

    public ConsensusConfig toConsensusConfig() {
        return ConsensusConfig.builder()
                .minCommitteeSize(minCommitteeSize)
                .defaultCommitteeSize(defaultCommitteeSize)
                .maxCommitteeSize(maxCommitteeSize)
                .quorumFraction(quorumFraction)
                .votingTimeout(votingTimeout)
                .maxPendingProposals(maxPendingProposals)
                .rotationInterval(rotationInterval)
                .retention(retention)
                .sweepInterval(sweepInterval)
                .build()
                .validate();
    }
}
