package com.agentnet.committee;

import java.time.Clock;
import java.util.List;

import com.agentnet.config.ConsensusConfig;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns the local node's view of the committee. Not thread safe on its own; callers
 * hold the consensus manager's lock.
 */
@Slf4j
public class CommitteeManager {
    private final String nodeId;
    private final ConsensusConfig config;
    private final Clock clock;
    private Committee committee;

    public CommitteeManager(String nodeId, ConsensusConfig config, Clock clock) {
        this.nodeId = nodeId;
        this.config = config;
        this.clock = clock;
        this.committee = Committee.empty(clock.millis());
    }

    /**
     * Replaces the committee wholesale. The first member becomes leader. Proposals
     * already in flight evaluate quorum against the new membership from now on.
     *
     * @throws IllegalArgumentException if a node id is missing or repeated; the
     *                                  current committee is kept
     */
    public void setCommittee(List<CommitteeMember> members) {
        Committee replacement = new Committee(members, clock.millis());
        int size = replacement.size();
        if (size < config.getMinCommitteeSize() || size > config.getMaxCommitteeSize()) {
            log.warn("{}: Committee size {} is outside the configured range [{}, {}]", nodeId, size,
                    config.getMinCommitteeSize(), config.getMaxCommitteeSize());
        }
        this.committee = replacement;
        CommitteeMember leader = committee.getLeader();
        log.info("{}: Committee set to {} members, leader {}", nodeId, size,
                leader != null ? leader.getNodeId() : "none");
    }

    /**
     * Advances leadership to the next member. No-op on an empty committee.
     *
     * @return true if the leader changed
     */
    public boolean rotateLeader() {
        if (!committee.advanceLeader(clock.millis())) {
            log.debug("{}: Ignoring leader rotation on empty committee", nodeId);
            return false;
        }
        log.info("{}: Leader rotated to {} (rotation {})", nodeId, committee.getLeader().getNodeId(),
                committee.getRotationSequence());
        return true;
    }

    public boolean isMember(String candidateId) {
        return committee.isMember(candidateId);
    }

    public boolean isLocalMember() {
        return committee.isMember(nodeId);
    }

    public boolean isLocalLeader() {
        CommitteeMember leader = committee.getLeader();
        return leader != null && nodeId.equals(leader.getNodeId());
    }

    public CommitteeMember getLeader() {
        CommitteeMember leader = committee.getLeader();
        return leader != null ? leader.copy() : null;
    }

    public int quorumSize() {
        return committee.quorumSize(config.getQuorumFraction());
    }

    public int size() {
        return committee.size();
    }

    public long getView() {
        return committee.getRotationSequence();
    }

    public Committee snapshot() {
        return committee.copy();
    }
}
