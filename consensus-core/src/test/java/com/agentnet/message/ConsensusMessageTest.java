package com.agentnet.message;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

public class ConsensusMessageTest {

    @Test
    public void testPayloadIsCopiedOnBuild() {
        byte[] payload = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
        ConsensusMessage message = ConsensusMessage.builder().type(MessageType.PREPARE).payload(payload).build();

        payload[0] = 'X';

        assertEquals('{', message.getPayload()[0]);
    }

    @Test
    public void testPayloadIsCopiedOnRead() {
        ConsensusMessage message = ConsensusMessage.builder().type(MessageType.PREPARE)
                .payload("{}".getBytes(StandardCharsets.UTF_8)).build();

        message.getPayload()[0] = 'X';

        assertArrayEquals("{}".getBytes(StandardCharsets.UTF_8), message.getPayload());
    }

    @Test
    public void testPayloadIsCopiedOnSet() {
        byte[] payload = "{}".getBytes(StandardCharsets.UTF_8);
        ConsensusMessage message = new ConsensusMessage();
        message.setPayload(payload);

        payload[1] = 'X';

        assertEquals('}', message.getPayload()[1]);
        message.setPayload(null);
        assertNull(message.getPayload());
    }

    @Test
    public void testEqualityComparesPayloadContent() {
        ConsensusMessage first = ConsensusMessage.builder().type(MessageType.COMMIT).senderId("A")
                .payload(new byte[] { 1, 2 }).build();
        ConsensusMessage second = ConsensusMessage.builder().type(MessageType.COMMIT).senderId("A")
                .payload(new byte[] { 1, 2 }).build();
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }
}
