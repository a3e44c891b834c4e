package com.agentnet.hooks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import com.agentnet.exception.ConsensusException;
import com.agentnet.message.ConsensusMessage;

import lombok.extern.slf4j.Slf4j;

/**
 * Broadcaster that delivers messages to other nodes in the same JVM. Each instance
 * belongs to one node and sends on a single worker thread, so the messages one node
 * emits reach each peer in emission order.
 */
@Slf4j
public class InMemoryBroadcaster implements Broadcaster {
    private final String nodeId;
    private final ExecutorService executor;
    private final Map<String, InMemoryBroadcaster> peers = new ConcurrentHashMap<>();
    private volatile ConsensusMessageHandler messageHandler;

    /**
     * Creates a broadcaster for the specified node
     *
     * @param nodeId id of the node this broadcaster sends for
     */
    public InMemoryBroadcaster(String nodeId) {
        this.nodeId = nodeId;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "broadcast-" + nodeId);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Links every broadcaster to every other one
     */
    public static void connectAll(Iterable<InMemoryBroadcaster> broadcasters) {
        for (InMemoryBroadcaster from : broadcasters) {
            for (InMemoryBroadcaster to : broadcasters) {
                if (from != to) {
                    from.registerPeer(to.getNodeId(), to);
                }
            }
        }
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * Registers another node to receive this node's broadcasts
     *
     * @param peerId      id of the node to register
     * @param broadcaster that node's broadcaster
     */
    public void registerPeer(String peerId, InMemoryBroadcaster broadcaster) {
        peers.put(peerId, broadcaster);
    }

    public boolean unregisterPeer(String peerId) {
        InMemoryBroadcaster removed = peers.remove(peerId);
        if (removed == null) {
            log.debug("{}: Peer {} already unregistered", nodeId, peerId);
            return false;
        }
        log.debug("{}: Unregistered peer {}", nodeId, peerId);
        return true;
    }

    /**
     * Sets the handler that applies messages from peers to this node
     */
    public void setMessageHandler(ConsensusMessageHandler handler) {
        this.messageHandler = handler;
    }

    @Override
    public void broadcast(ConsensusMessage message) throws BroadcastException {
        try {
            for (InMemoryBroadcaster peer : peers.values()) {
                executor.execute(() -> peer.deliver(message));
            }
        } catch (RejectedExecutionException e) {
            throw new BroadcastException(nodeId + ": broadcaster is stopped", e);
        }
    }

    public void stop() {
        executor.shutdown();
    }

    private void deliver(ConsensusMessage message) {
        ConsensusMessageHandler handler = messageHandler;
        if (handler == null) {
            log.warn("{}: No message handler registered, dropping {} from {}", nodeId, message.getType(),
                    message.getSenderId());
            return;
        }
        try {
            handler.onMessage(message);
        } catch (ConsensusException e) {
            log.warn("{}: Refused {} for proposal {} from {}: {}", nodeId, message.getType(),
                    message.getProposalId(), message.getSenderId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("{}: Failed to handle {} from {}", nodeId, message.getType(), message.getSenderId(), e);
        }
    }
}
