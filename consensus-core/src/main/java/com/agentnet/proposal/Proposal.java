package com.agentnet.proposal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A unit of decision put to the committee. Holds at most one vote per voter, and once
 * its phase is terminal it is never changed again. State only changes through
 * {@link #recordVote(Vote)} and {@link #complete(ConsensusPhase, ConsensusResult)};
 * the package-private setters exist for JSON binding.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString
@EqualsAndHashCode
@NoArgsConstructor
public class Proposal {
    private String id;
    private ProposalType type;
    private Object data; // opaque to the core
    private String proposerId;
    private long createdAt;
    private long deadline;

    private ConsensusPhase phase = ConsensusPhase.PENDING;
    private Map<String, Vote> votes = new LinkedHashMap<>(); // voterId -> vote, in arrival order

    private ConsensusResult result;

    public Proposal(String id, ProposalType type, Object data, String proposerId, long createdAt, long deadline) {
        this.id = id;
        this.type = type;
        this.data = data;
        this.proposerId = proposerId;
        this.createdAt = createdAt;
        this.deadline = deadline;
    }

    /**
     * @return a read-only view of the votes, keyed by voter id
     */
    public Map<String, Vote> getVotes() {
        return Collections.unmodifiableMap(votes);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return phase != null && phase.isTerminal();
    }

    public boolean hasVoted(String voterId) {
        return votes.containsKey(voterId);
    }

    /**
     * Stores a vote. Uniqueness is checked here rather than left to the map.
     *
     * @throws IllegalStateException if the voter already voted or the proposal is
     *                               terminal
     */
    public void recordVote(Vote vote) {
        if (isTerminal()) {
            throw new IllegalStateException("Proposal " + id + " is already " + phase);
        }
        if (votes.containsKey(vote.getVoterId())) {
            throw new IllegalStateException(vote.getVoterId() + " already voted on proposal " + id);
        }
        votes.put(vote.getVoterId(), vote);
    }

    public int countVotes(boolean decision) {
        int count = 0;
        for (Vote vote : votes.values()) {
            if (vote.isDecision() == decision) {
                count++;
            }
        }
        return count;
    }

    /**
     * Builds a result from the votes recorded so far.
     */
    public ConsensusResult tally(boolean passed, int totalVoters, double quorumFraction, long now,
            String reason) {
        return new ConsensusResult(id, passed, countVotes(true), countVotes(false), totalVoters, quorumFraction,
                now, reason);
    }

    /**
     * Moves the proposal to a terminal phase and attaches its result.
     *
     * @throws IllegalStateException if the proposal is already terminal or the phase
     *                               is not terminal
     */
    public void complete(ConsensusPhase terminalPhase, ConsensusResult consensusResult) {
        if (!terminalPhase.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal phase: " + terminalPhase);
        }
        if (isTerminal()) {
            throw new IllegalStateException("Proposal " + id + " is already " + phase);
        }
        this.phase = terminalPhase;
        this.result = consensusResult;
    }

    public boolean isExpired(long now) {
        return now > deadline;
    }

    public Proposal copy() {
        Proposal copy = new Proposal(id, type, data, proposerId, createdAt, deadline);
        copy.phase = phase;
        copy.votes = new LinkedHashMap<>(votes);
        copy.result = result;
        return copy;
    }
}
