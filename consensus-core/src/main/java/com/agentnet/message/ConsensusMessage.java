package com.agentnet.message;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One message a node broadcasts to its peers. The payload is copied in and out.
 */
@Data
@NoArgsConstructor
public class ConsensusMessage {
    private MessageType type;
    private String proposalId;
    private long sequence; // per sender, increases with every message
    private long view; // sender's leader rotation count
    private String senderId;
    private long timestamp;
    private byte[] payload; // JSON, see ConsensusMessageCodec

    @Builder
    public ConsensusMessage(MessageType type, String proposalId, long sequence, long view, String senderId,
            long timestamp, byte[] payload) {
        this.type = type;
        this.proposalId = proposalId;
        this.sequence = sequence;
        this.view = view;
        this.senderId = senderId;
        this.timestamp = timestamp;
        this.payload = payload != null ? payload.clone() : null;
    }

    public byte[] getPayload() {
        return payload != null ? payload.clone() : null;
    }

    public void setPayload(byte[] payload) {
        this.payload = payload != null ? payload.clone() : null;
    }

    @Override
    public String toString() {
        return "ConsensusMessage [type=" + type + ", proposalId=" + proposalId + ", sequence=" + sequence
                + ", view=" + view + ", senderId=" + senderId + ", timestamp=" + timestamp + ", payload="
                + (payload != null ? payload.length + " bytes" : "none") + "]";
    }
}
