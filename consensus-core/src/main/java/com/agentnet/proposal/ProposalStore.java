package com.agentnet.proposal;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import com.agentnet.exception.TooManyPendingProposalsException;

import lombok.extern.slf4j.Slf4j;

/**
 * Creates and indexes proposals by id, refusing new ones while too many are still
 * open. Not thread safe on its own; callers hold the consensus manager's lock.
 */
@Slf4j
public class ProposalStore {
    private static final int ID_BYTES = 16;

    private final Map<String, Proposal> proposals = new LinkedHashMap<>();
    private final int maxPendingProposals;
    private final Duration votingTimeout;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public ProposalStore(int maxPendingProposals, Duration votingTimeout, Clock clock) {
        this.maxPendingProposals = maxPendingProposals;
        this.votingTimeout = votingTimeout;
        this.clock = clock;
    }

    /**
     * Creates a pending proposal with a fresh random id and a deadline one voting
     * timeout from now.
     *
     * @throws TooManyPendingProposalsException if the pending ceiling is reached;
     *                                          nothing is created
     */
    public Proposal create(ProposalType type, Object data, String proposerId)
            throws TooManyPendingProposalsException {
        ensureCapacity();
        long now = clock.millis();
        Proposal proposal = new Proposal(generateId(), type, data, proposerId, now,
                now + votingTimeout.toMillis());
        proposals.put(proposal.getId(), proposal);
        return proposal;
    }

    /**
     * Indexes a proposal announced by a peer, keeping its id, timestamps and payload but
     * none of its votes.
     *
     * @return the indexed proposal, or null if the id is already known
     * @throws TooManyPendingProposalsException if the pending ceiling is reached
     */
    public Proposal index(Proposal announced) throws TooManyPendingProposalsException {
        if (proposals.containsKey(announced.getId())) {
            return null;
        }
        ensureCapacity();
        Proposal proposal = new Proposal(announced.getId(), announced.getType(), announced.getData(),
                announced.getProposerId(), announced.getCreatedAt(), announced.getDeadline());
        proposals.put(proposal.getId(), proposal);
        return proposal;
    }

    public Proposal get(String proposalId) {
        return proposals.get(proposalId);
    }

    public boolean contains(String proposalId) {
        return proposals.containsKey(proposalId);
    }

    public List<Proposal> pending() {
        List<Proposal> result = new ArrayList<>();
        for (Proposal proposal : proposals.values()) {
            if (!proposal.isTerminal()) {
                result.add(proposal);
            }
        }
        return result;
    }

    public int pendingCount() {
        int count = 0;
        for (Proposal proposal : proposals.values()) {
            if (!proposal.isTerminal()) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return proposals.size();
    }

    /**
     * Removes every proposal matching the filter.
     *
     * @return the number removed
     */
    public int removeIf(Predicate<Proposal> filter) {
        int removed = 0;
        Iterator<Proposal> it = proposals.values().iterator();
        while (it.hasNext()) {
            if (filter.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public void clear() {
        proposals.clear();
    }

    private void ensureCapacity() throws TooManyPendingProposalsException {
        int pendingCount = pendingCount();
        if (pendingCount >= maxPendingProposals) {
            log.warn("Refusing proposal, {} pending of at most {}", pendingCount, maxPendingProposals);
            throw new TooManyPendingProposalsException(pendingCount);
        }
    }

    private String generateId() {
        byte[] bytes = new byte[ID_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
