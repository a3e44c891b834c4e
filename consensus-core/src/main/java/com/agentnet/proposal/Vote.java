package com.agentnet.proposal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One committee member's decision on one proposal. Never mutated once created.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Vote {
    private final String voterId;
    private final boolean decision; // true = agree
    private final String reason;
    private final long timestamp;
    private final String signature; // empty when no signer is configured

    @JsonCreator
    public Vote(
            @JsonProperty("voterId") String voterId,
            @JsonProperty("decision") boolean decision,
            @JsonProperty("reason") String reason,
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("signature") String signature) {
        this.voterId = voterId;
        this.decision = decision;
        this.reason = reason != null ? reason : "";
        this.timestamp = timestamp;
        this.signature = signature != null ? signature : "";
    }

    /**
     * The canonical bytes a vote signature covers: {@code proposalId:voterId:decision}.
     */
    public static String signingPayload(String proposalId, String voterId, boolean decision) {
        return proposalId + ":" + voterId + ":" + decision;
    }
}
