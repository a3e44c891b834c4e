package com.agentnet.proposal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome attached to a proposal at the moment it becomes terminal. The counts are a
 * snapshot of the votes recorded at that moment.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ConsensusResult {
    public static final String REASON_QUORUM_REACHED = "quorum reached";
    public static final String REASON_CANNOT_REACH_QUORUM = "cannot reach quorum";
    public static final String REASON_TIMEOUT = "timeout";

    private final String proposalId;
    private final boolean passed;
    private final int agreeCount;
    private final int disagreeCount;
    private final int totalVoters;
    private final double quorumFraction;
    private final long finalizedAt;
    private final String reason;

    @JsonCreator
    public ConsensusResult(
            @JsonProperty("proposalId") String proposalId,
            @JsonProperty("passed") boolean passed,
            @JsonProperty("agreeCount") int agreeCount,
            @JsonProperty("disagreeCount") int disagreeCount,
            @JsonProperty("totalVoters") int totalVoters,
            @JsonProperty("quorumFraction") double quorumFraction,
            @JsonProperty("finalizedAt") long finalizedAt,
            @JsonProperty("reason") String reason) {
        this.proposalId = proposalId;
        this.passed = passed;
        this.agreeCount = agreeCount;
        this.disagreeCount = disagreeCount;
        this.totalVoters = totalVoters;
        this.quorumFraction = quorumFraction;
        this.finalizedAt = finalizedAt;
        this.reason = reason;
    }
}
