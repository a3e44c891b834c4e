package com.agentnet.committee;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class CommitteeMember {
    private String nodeId;
    private String publicKey;
    private double reputation;
    private long joinedAt; // epoch millis when the node entered the committee
    private boolean leader;

    public CommitteeMember(String nodeId, String publicKey, double reputation, long joinedAt) {
        this(nodeId, publicKey, reputation, joinedAt, false);
    }

    public CommitteeMember copy() {
        return new CommitteeMember(nodeId, publicKey, reputation, joinedAt, leader);
    }
}
