package com.agentnet.proposal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class JoinProposalData {
    private String newNodeId;
    private String newNodePublicKey;
    private String sponsorId;
    private String guaranteeId;
    private double initialReputation;
}
