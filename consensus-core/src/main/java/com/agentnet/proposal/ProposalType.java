package com.agentnet.proposal;

public enum ProposalType {
    JOIN, // admit a node
    KICK, // expel a node
    SUSPEND,
    PARAMETER, // change a network parameter
    EMERGENCY
}
