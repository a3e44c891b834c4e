package com.agentnet.committee;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.Getter;

/**
 * The ordered set of nodes currently empowered to vote, and which of them leads.
 * If the committee is non-empty, exactly the member at {@code leaderIndex} has its
 * leader flag set.
 */
@Getter
public class Committee {
    private final List<CommitteeMember> members;
    private int leaderIndex;
    private long rotationSequence;
    private long updatedAt;

    /**
     * @throws IllegalArgumentException if a member has no node id or a node id
     *                                  appears twice
     */
    public Committee(List<CommitteeMember> members, long updatedAt) {
        this.members = new ArrayList<>();
        if (members != null) {
            Set<String> seen = new HashSet<>();
            for (CommitteeMember member : members) {
                if (member == null || member.getNodeId() == null) {
                    throw new IllegalArgumentException("Committee member without a node id");
                }
                if (!seen.add(member.getNodeId())) {
                    throw new IllegalArgumentException("Duplicate committee member: " + member.getNodeId());
                }
                CommitteeMember copy = member.copy();
                copy.setLeader(false);
                this.members.add(copy);
            }
        }
        this.leaderIndex = 0;
        this.rotationSequence = 0;
        this.updatedAt = updatedAt;
        if (!this.members.isEmpty()) {
            this.members.get(0).setLeader(true);
        }
    }

    private Committee(Committee other) {
        this.members = new ArrayList<>();
        for (CommitteeMember member : other.members) {
            this.members.add(member.copy());
        }
        this.leaderIndex = other.leaderIndex;
        this.rotationSequence = other.rotationSequence;
        this.updatedAt = other.updatedAt;
    }

    public static Committee empty(long updatedAt) {
        return new Committee(List.of(), updatedAt);
    }

    /**
     * Computes the number of agreeing votes needed to pass a proposal:
     * {@code max(1, floor(size * fraction))}. Note this is a floor, so a committee of
     * three needs two votes.
     */
    public static int quorumSize(int size, double fraction) {
        int quorum = (int) Math.floor(size * fraction);
        return Math.max(1, quorum);
    }

    public int quorumSize(double fraction) {
        return quorumSize(members.size(), fraction);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * @return the current leader, or null if the committee is empty
     */
    public CommitteeMember getLeader() {
        if (members.isEmpty() || leaderIndex < 0 || leaderIndex >= members.size()) {
            return null;
        }
        return members.get(leaderIndex);
    }

    public boolean isMember(String nodeId) {
        if (nodeId == null) {
            return false;
        }
        for (CommitteeMember member : members) {
            if (nodeId.equals(member.getNodeId())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Moves the leader flag to the next member, wrapping around at the end.
     *
     * @return false if the committee is empty and nothing changed
     */
    boolean advanceLeader(long now) {
        if (members.isEmpty()) {
            return false;
        }
        if (leaderIndex < members.size()) {
            members.get(leaderIndex).setLeader(false);
        }
        leaderIndex = (leaderIndex + 1) % members.size();
        members.get(leaderIndex).setLeader(true);
        rotationSequence++;
        updatedAt = now;
        return true;
    }

    public Committee copy() {
        return new Committee(this);
    }

    @Override
    public String toString() {
        List<String> ids = new ArrayList<>();
        for (CommitteeMember member : members) {
            ids.add(member.getNodeId());
        }
        return "Committee [members=" + ids + ", leaderIndex=" + leaderIndex + ", rotationSequence="
                + rotationSequence + ", updatedAt=" + updatedAt + "]";
    }
}
