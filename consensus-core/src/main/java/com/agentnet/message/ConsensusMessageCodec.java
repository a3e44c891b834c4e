package com.agentnet.message;

import java.io.IOException;

import com.agentnet.exception.MalformedMessageException;
import com.agentnet.proposal.ConsensusResult;
import com.agentnet.proposal.Proposal;
import com.agentnet.proposal.Vote;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds consensus messages and reads their JSON payloads back.
 */
public class ConsensusMessageCodec {
    private final ObjectMapper mapper;

    public ConsensusMessageCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ConsensusMessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ConsensusMessage prePrepare(Proposal proposal, long sequence, long view, String senderId,
            long timestamp) {
        return message(MessageType.PRE_PREPARE, proposal.getId(), sequence, view, senderId, timestamp,
                toJson(proposal));
    }

    public ConsensusMessage prepare(String proposalId, Vote vote, long sequence, long view, String senderId,
            long timestamp) {
        return message(MessageType.PREPARE, proposalId, sequence, view, senderId, timestamp, toJson(vote));
    }

    public ConsensusMessage commit(ConsensusResult result, long sequence, long view, String senderId,
            long timestamp) {
        return message(MessageType.COMMIT, result.getProposalId(), sequence, view, senderId, timestamp,
                toJson(result));
    }

    public ConsensusMessage viewChange(long sequence, long view, String senderId, long timestamp) {
        return message(MessageType.VIEW_CHANGE, null, sequence, view, senderId, timestamp, null);
    }

    public Proposal readProposal(ConsensusMessage message) throws MalformedMessageException {
        return read(message, MessageType.PRE_PREPARE, Proposal.class);
    }

    public Vote readVote(ConsensusMessage message) throws MalformedMessageException {
        return read(message, MessageType.PREPARE, Vote.class);
    }

    public ConsensusResult readResult(ConsensusMessage message) throws MalformedMessageException {
        return read(message, MessageType.COMMIT, ConsensusResult.class);
    }

    private <T> T read(ConsensusMessage message, MessageType expected, Class<T> payloadType)
            throws MalformedMessageException {
        if (message.getType() != expected) {
            throw new MalformedMessageException(
                    "expected " + expected + " message but got " + message.getType());
        }
        byte[] payload = message.getPayload();
        if (payload == null || payload.length == 0) {
            throw new MalformedMessageException(expected + " message from " + message.getSenderId()
                    + " has no payload");
        }
        try {
            return mapper.readValue(payload, payloadType);
        } catch (IOException e) {
            throw new MalformedMessageException("unreadable " + expected + " payload from "
                    + message.getSenderId(), e);
        }
    }

    private byte[] toJson(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            // only reachable with a payload Jackson cannot serialize
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static ConsensusMessage message(MessageType type, String proposalId, long sequence, long view,
            String senderId, long timestamp, byte[] payload) {
        return ConsensusMessage.builder()
                .type(type)
                .proposalId(proposalId)
                .sequence(sequence)
                .view(view)
                .senderId(senderId)
                .timestamp(timestamp)
                .payload(payload)
                .build();
    }
}
