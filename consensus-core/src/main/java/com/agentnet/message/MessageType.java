package com.agentnet.message;

public enum MessageType {
    PRE_PREPARE, // a new proposal, payload is the proposal
    PREPARE, // a vote, payload is the vote
    COMMIT, // a proposal turned terminal, payload is the result
    REPLY,
    VIEW_CHANGE // leader rotated, no payload
}
