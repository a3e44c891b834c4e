package com.agentnet.proposal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class KickProposalData {
    private String nodeId;
    private String reason;
    private String evidence;
    private String reporterId;
}
