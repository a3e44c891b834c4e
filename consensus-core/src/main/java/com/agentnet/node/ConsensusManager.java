package com.agentnet.node;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.agentnet.committee.Committee;
import com.agentnet.committee.CommitteeManager;
import com.agentnet.committee.CommitteeMember;
import com.agentnet.config.ConsensusConfig;
import com.agentnet.exception.ConsensusException;
import com.agentnet.exception.DuplicateVoteException;
import com.agentnet.exception.InvalidVoteSignatureException;
import com.agentnet.exception.NotCommitteeMemberException;
import com.agentnet.exception.ProposalNotFoundException;
import com.agentnet.exception.TooManyPendingProposalsException;
import com.agentnet.hooks.BroadcastException;
import com.agentnet.hooks.Broadcaster;
import com.agentnet.hooks.ConsensusHooks;
import com.agentnet.hooks.ReputationLookup;
import com.agentnet.message.ConsensusMessage;
import com.agentnet.message.ConsensusMessageCodec;
import com.agentnet.proposal.ConsensusResult;
import com.agentnet.proposal.JoinProposalData;
import com.agentnet.proposal.KickProposalData;
import com.agentnet.proposal.Proposal;
import com.agentnet.proposal.ProposalStore;
import com.agentnet.proposal.ProposalType;
import com.agentnet.proposal.Vote;
import com.agentnet.sweeper.RetentionSweeper;
import com.agentnet.sweeper.SweepTimer;
import com.agentnet.sweeper.TimeoutSweeper;
import com.agentnet.voting.EarlyVoteBuffer;
import com.agentnet.voting.VotingEngine;

import lombok.extern.slf4j.Slf4j;

/**
 * One node's view of committee consensus: the committee, the open and recently
 * resolved proposals, and the votes on them.
 * <p>
 * Every mutating call holds an exclusive lock over the whole state for its duration,
 * so recording a vote and evaluating quorum happen atomically; queries share a read
 * lock and return copies. Broadcasts and listener callbacks run after the lock is
 * released, and their failures are logged rather than returned.
 */
@Slf4j
public class ConsensusManager {
    private final String nodeId;
    private final ConsensusConfig config;
    private final Clock clock;

    private final CommitteeManager committeeManager;
    private final ProposalStore proposalStore;
    private final VotingEngine votingEngine;
    private final TimeoutSweeper timeoutSweeper;
    private final RetentionSweeper retentionSweeper;
    private final EarlyVoteBuffer earlyVotes;

    private final Broadcaster broadcaster;
    private final ReputationLookup reputationLookup;
    private final ConsensusMessageCodec codec = new ConsensusMessageCodec();
    private final SweepTimer sweepTimer;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong sequence = new AtomicLong();
    private final Set<ConsensusListener> listeners = new CopyOnWriteArraySet<>();

    public ConsensusManager(String nodeId) {
        this(nodeId, ConsensusConfig.defaults(), ConsensusHooks.none());
    }

    public ConsensusManager(String nodeId, ConsensusConfig config, ConsensusHooks hooks) {
        this(nodeId, config, hooks, Clock.systemUTC(), null);
    }

    public ConsensusManager(String nodeId, ConsensusConfig config, ConsensusHooks hooks, Clock clock,
            SweepTimer sweepTimer) {
        this.nodeId = nodeId;
        this.config = config.validate();
        this.clock = clock;
        this.broadcaster = hooks.getBroadcaster();
        this.reputationLookup = hooks.getReputationLookup();

        this.committeeManager = new CommitteeManager(nodeId, config, clock);
        this.proposalStore = new ProposalStore(config.getMaxPendingProposals(), config.getVotingTimeout(), clock);
        this.votingEngine = new VotingEngine(nodeId, committeeManager, proposalStore, hooks.getSigner(),
                hooks.getVerifier(), config.getQuorumFraction(), clock);
        this.timeoutSweeper = new TimeoutSweeper(proposalStore, votingEngine, clock);
        this.retentionSweeper = new RetentionSweeper(proposalStore, clock);
        this.earlyVotes = new EarlyVoteBuffer(config.getMaxPendingProposals(), config.getVotingTimeout());

        this.sweepTimer = sweepTimer;
        if (sweepTimer != null) {
            sweepTimer.setSweepHandler(this::runSweeps);
        }
    }

    public String getNodeId() {
        return nodeId;
    }

    public ConsensusConfig getConfig() {
        return config;
    }

    /**
     * Starts the periodic sweeps, if a sweep timer was supplied
     */
    public void start() {
        log.info("{}: Starting consensus manager", nodeId);
        if (sweepTimer != null) {
            sweepTimer.start();
        }
    }

    public void stop() {
        log.info("{}: Stopping consensus manager", nodeId);
        if (sweepTimer != null) {
            sweepTimer.stop();
        }
    }

    public void addListener(ConsensusListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(ConsensusListener listener) {
        if (listener != null) {
            listeners.remove(listener);
        }
    }

    // ---- committee ----

    /**
     * Replaces the committee; the first member becomes leader
     */
    public void setCommittee(List<CommitteeMember> members) {
        lock.writeLock().lock();
        try {
            committeeManager.setCommittee(members);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Hands leadership to the next member, wrapping around. No-op on an empty
     * committee.
     */
    public void rotateLeader() {
        ConsensusMessage viewChange = null;
        lock.writeLock().lock();
        try {
            if (committeeManager.rotateLeader()) {
                viewChange = codec.viewChange(sequence.incrementAndGet(), committeeManager.getView(), nodeId,
                        clock.millis());
            }
        } finally {
            lock.writeLock().unlock();
        }
        publish(viewChange);
    }

    public Committee getCommittee() {
        lock.readLock().lock();
        try {
            return committeeManager.snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isCommitteeMember() {
        lock.readLock().lock();
        try {
            return committeeManager.isLocalMember();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isLeader() {
        lock.readLock().lock();
        try {
            return committeeManager.isLocalLeader();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CommitteeMember getLeader() {
        lock.readLock().lock();
        try {
            return committeeManager.getLeader();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int quorumSize() {
        lock.readLock().lock();
        try {
            return committeeManager.quorumSize();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reputation of a node from the configured lookup, falling back to the value
     * recorded on its committee entry, or 0 for an unknown node. Not used by quorum
     * arithmetic, which counts one vote per member.
     */
    public double getReputation(String candidateId) {
        if (reputationLookup != null) {
            return reputationLookup.getReputation(candidateId);
        }
        for (CommitteeMember member : getCommittee().getMembers()) {
            if (member.getNodeId().equals(candidateId)) {
                return member.getReputation();
            }
        }
        return 0.0;
    }

    // ---- proposals ----

    public Proposal proposeJoin(JoinProposalData data) throws TooManyPendingProposalsException {
        return createProposal(ProposalType.JOIN, data);
    }

    public Proposal proposeKick(KickProposalData data) throws TooManyPendingProposalsException {
        return createProposal(ProposalType.KICK, data);
    }

    /**
     * Opens a new proposal for the committee to vote on and announces it to peers
     *
     * @throws TooManyPendingProposalsException if the pending ceiling is reached
     */
    public Proposal createProposal(ProposalType type, Object data) throws TooManyPendingProposalsException {
        Proposal created;
        long announcementSequence = 0;
        long view = 0;
        lock.writeLock().lock();
        try {
            created = proposalStore.create(type, data, nodeId).copy();
            if (broadcaster != null) {
                announcementSequence = sequence.incrementAndGet();
                view = committeeManager.getView();
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("{}: Created {} proposal {}, deadline {}", nodeId, type, created.getId(), created.getDeadline());
        if (broadcaster != null) {
            publish(announce(created, announcementSequence, view));
        }
        return created;
    }

    // an unserializable payload fails the announcement, never the proposal
    private ConsensusMessage announce(Proposal proposal, long announcementSequence, long view) {
        try {
            return codec.prePrepare(proposal, announcementSequence, view, nodeId, clock.millis());
        } catch (IllegalArgumentException e) {
            log.warn("{}: Cannot announce proposal {}: {}", nodeId, proposal.getId(), e.getMessage());
            return null;
        }
    }

    /**
     * Casts the local node's vote. A vote arriving after the deadline moves the
     * proposal to TIMEOUT before the error is raised.
     *
     * @throws ConsensusException if the vote is refused; see the subclasses in
     *                            {@code com.agentnet.exception}
     */
    public void vote(String proposalId, boolean decision, String reason) throws ConsensusException {
        List<ConsensusMessage> outgoing = new ArrayList<>();
        Proposal resolved = null;
        lock.writeLock().lock();
        try {
            Proposal before = proposalStore.get(proposalId);
            boolean wasOpen = before != null && !before.isTerminal();
            try {
                Proposal proposal = votingEngine.castVote(proposalId, decision, reason);
                if (broadcaster != null) {
                    Vote vote = proposal.getVotes().get(nodeId);
                    long view = committeeManager.getView();
                    outgoing.add(codec.prepare(proposalId, vote, sequence.incrementAndGet(), view, nodeId,
                            clock.millis()));
                    if (proposal.isTerminal()) {
                        outgoing.add(codec.commit(proposal.getResult(), sequence.incrementAndGet(), view, nodeId,
                                clock.millis()));
                    }
                }
            } finally {
                if (wasOpen && before.isTerminal()) {
                    resolved = before.copy();
                }
            }
        } finally {
            lock.writeLock().unlock();
            notifyResolved(resolved);
            publish(outgoing);
        }
    }

    /**
     * Applies a message broadcast by a peer: indexes announced proposals, counts
     * peers' votes after verifying their signatures, and logs everything else. A vote
     * that arrives before its proposal's announcement is held until the announcement
     * arrives or the voting timeout passes. Messages sent by this node are ignored.
     *
     * @throws ConsensusException if the message is malformed or its vote is refused
     */
    public void handleMessage(ConsensusMessage message) throws ConsensusException {
        if (nodeId.equals(message.getSenderId())) {
            return;
        }
        switch (message.getType()) {
            case PRE_PREPARE:
                handleProposalAnnouncement(message);
                break;
            case PREPARE:
                handleRemoteVote(message);
                break;
            case COMMIT:
                handleCommit(message);
                break;
            default:
                log.debug("{}: Received {} from {} (view {})", nodeId, message.getType(), message.getSenderId(),
                        message.getView());
                break;
        }
    }

    private void handleProposalAnnouncement(ConsensusMessage message) throws ConsensusException {
        Proposal announced = codec.readProposal(message);
        Proposal resolved = null;
        lock.writeLock().lock();
        try {
            Proposal indexed = proposalStore.index(announced);
            if (indexed == null) {
                log.debug("{}: Ignoring duplicate announcement of {} from {}", nodeId, announced.getId(),
                        message.getSenderId());
                return;
            }
            log.debug("{}: Indexed {} proposal {} from {}", nodeId, indexed.getType(), indexed.getId(),
                    message.getSenderId());
            replayEarlyVotes(indexed);
            if (indexed.isTerminal()) {
                resolved = indexed.copy();
            }
        } finally {
            lock.writeLock().unlock();
            notifyResolved(resolved);
        }
    }

    // caller holds the write lock
    private void replayEarlyVotes(Proposal proposal) {
        for (Vote vote : earlyVotes.release(proposal.getId())) {
            try {
                votingEngine.acceptRemoteVote(proposal.getId(), vote);
            } catch (ConsensusException e) {
                log.warn("{}: Dropped early vote from {} on {}: {}", nodeId, vote.getVoterId(), proposal.getId(),
                        e.getMessage());
            }
        }
    }

    private void handleRemoteVote(ConsensusMessage message) throws ConsensusException {
        Vote vote = codec.readVote(message);
        if (!message.getSenderId().equals(vote.getVoterId())) {
            throw new InvalidVoteSignatureException(
                    "vote by " + vote.getVoterId() + " relayed by " + message.getSenderId());
        }
        Proposal resolved = null;
        lock.writeLock().lock();
        try {
            Proposal before = proposalStore.get(message.getProposalId());
            if (before == null) {
                holdEarlyVote(message.getProposalId(), vote);
                return;
            }
            boolean wasOpen = !before.isTerminal();
            try {
                votingEngine.acceptRemoteVote(message.getProposalId(), vote);
            } finally {
                if (wasOpen && before.isTerminal()) {
                    resolved = before.copy();
                }
            }
        } finally {
            lock.writeLock().unlock();
            notifyResolved(resolved);
        }
    }

    // a peer's vote can overtake the announcement of its proposal; caller holds the write lock
    private void holdEarlyVote(String proposalId, Vote vote) throws ConsensusException {
        if (!committeeManager.isMember(vote.getVoterId())) {
            throw new NotCommitteeMemberException(vote.getVoterId());
        }
        if (earlyVotes.isHeld(proposalId, vote.getVoterId())) {
            throw new DuplicateVoteException(proposalId, vote.getVoterId());
        }
        if (!earlyVotes.hold(proposalId, vote, clock.millis())) {
            throw new ProposalNotFoundException(proposalId);
        }
        log.debug("{}: Holding vote from {} until proposal {} is announced", nodeId, vote.getVoterId(),
                proposalId);
    }

    private void handleCommit(ConsensusMessage message) throws ConsensusException {
        ConsensusResult remote = codec.readResult(message);
        ConsensusResult local = getProposalResult(remote.getProposalId());
        if (local != null && local.isPassed() != remote.isPassed()) {
            log.warn("{}: Proposal {} resolved as passed={} locally but passed={} by {}", nodeId,
                    remote.getProposalId(), local.isPassed(), remote.isPassed(), message.getSenderId());
        } else {
            log.debug("{}: {} reports proposal {} passed={}", nodeId, message.getSenderId(),
                    remote.getProposalId(), remote.isPassed());
        }
    }

    public Proposal getProposal(String proposalId) {
        lock.readLock().lock();
        try {
            Proposal proposal = proposalStore.get(proposalId);
            return proposal != null ? proposal.copy() : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the result, or null if the proposal is unknown or still pending
     */
    public ConsensusResult getProposalResult(String proposalId) {
        lock.readLock().lock();
        try {
            Proposal proposal = proposalStore.get(proposalId);
            return proposal != null ? proposal.getResult() : null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Proposal> getPendingProposals() {
        lock.readLock().lock();
        try {
            List<Proposal> result = new ArrayList<>();
            for (Proposal proposal : proposalStore.pending()) {
                result.add(proposal.copy());
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int proposalCount() {
        lock.readLock().lock();
        try {
            return proposalStore.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---- sweeps ----

    /**
     * Moves every open proposal past its deadline to TIMEOUT
     *
     * @return the number of proposals timed out by this call
     */
    public int checkTimeouts() {
        List<Proposal> resolved = new ArrayList<>();
        int count;
        lock.writeLock().lock();
        try {
            List<Proposal> open = proposalStore.pending();
            count = timeoutSweeper.checkTimeouts();
            earlyVotes.purge(clock.millis());
            for (Proposal proposal : open) {
                if (proposal.isTerminal()) {
                    resolved.add(proposal.copy());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        for (Proposal proposal : resolved) {
            notifyResolved(proposal);
        }
        return count;
    }

    /**
     * Removes terminal proposals created more than {@code maxAge} ago
     *
     * @return the number removed
     */
    public int cleanupOldProposals(Duration maxAge) {
        lock.writeLock().lock();
        try {
            return retentionSweeper.cleanupOldProposals(maxAge);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops every proposal regardless of phase
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            proposalStore.clear();
            earlyVotes.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("{}: All proposals cleared", nodeId);
    }

    void runSweeps() {
        int timedOut = checkTimeouts();
        int removed = cleanupOldProposals(config.getRetention());
        if (timedOut > 0 || removed > 0) {
            log.info("{}: Sweep timed out {} and removed {} proposals", nodeId, timedOut, removed);
        }
    }

    // ---- outside the lock ----

    private void publish(ConsensusMessage message) {
        if (message != null) {
            publish(Collections.singletonList(message));
        }
    }

    private void publish(List<ConsensusMessage> messages) {
        if (broadcaster == null) {
            return;
        }
        for (ConsensusMessage message : messages) {
            try {
                broadcaster.broadcast(message);
            } catch (BroadcastException | RuntimeException e) {
                log.warn("{}: Failed to broadcast {} for proposal {}: {}", nodeId, message.getType(),
                        message.getProposalId(), e.getMessage());
            }
        }
    }

    private void notifyResolved(Proposal proposal) {
        if (proposal == null) {
            return;
        }
        for (ConsensusListener listener : listeners) {
            try {
                listener.onProposalResolved(proposal);
            } catch (RuntimeException e) {
                log.error("{}: Error notifying listener of proposal {}", nodeId, proposal.getId(), e);
            }
        }
    }
}
