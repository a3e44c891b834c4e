package com.agentnet.voting;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.agentnet.proposal.Vote;

/**
 * Holds peers' votes that arrive before the announcement of their proposal, so they
 * can be counted once the proposal is known. At most one vote per voter is held for
 * each proposal, at most {@code maxProposals} proposals are tracked, and anything
 * held longer than {@code maxAge} is dropped. Not thread safe on its own; callers
 * hold the consensus manager's lock.
 */
public class EarlyVoteBuffer {
    private final int maxProposals;
    private final Duration maxAge;
    private final Map<String, HeldVotes> held = new LinkedHashMap<>();

    private static class HeldVotes {
        private final long firstSeen;
        private final Map<String, Vote> votes = new LinkedHashMap<>();

        HeldVotes(long firstSeen) {
            this.firstSeen = firstSeen;
        }
    }

    public EarlyVoteBuffer(int maxProposals, Duration maxAge) {
        this.maxProposals = maxProposals;
        this.maxAge = maxAge;
    }

    public boolean isHeld(String proposalId, String voterId) {
        HeldVotes entry = held.get(proposalId);
        return entry != null && entry.votes.containsKey(voterId);
    }

    /**
     * @return false if the vote was not held: the voter already has a vote held for
     *         this proposal, or the buffer tracks too many proposals
     */
    public boolean hold(String proposalId, Vote vote, long now) {
        purge(now);
        HeldVotes entry = held.get(proposalId);
        if (entry == null) {
            if (held.size() >= maxProposals) {
                return false;
            }
            entry = new HeldVotes(now);
            held.put(proposalId, entry);
        }
        if (entry.votes.containsKey(vote.getVoterId())) {
            return false;
        }
        entry.votes.put(vote.getVoterId(), vote);
        return true;
    }

    /**
     * Removes and returns the votes held for a proposal, in arrival order
     */
    public List<Vote> release(String proposalId) {
        HeldVotes entry = held.remove(proposalId);
        return entry != null ? new ArrayList<>(entry.votes.values()) : new ArrayList<>();
    }

    /**
     * Drops proposals whose first held vote arrived more than {@code maxAge} ago
     *
     * @return the number of votes dropped
     */
    public int purge(long now) {
        long cutoff = now - maxAge.toMillis();
        int dropped = 0;
        Iterator<HeldVotes> it = held.values().iterator();
        while (it.hasNext()) {
            HeldVotes entry = it.next();
            if (entry.firstSeen < cutoff) {
                dropped += entry.votes.size();
                it.remove();
            }
        }
        return dropped;
    }

    public int size() {
        int count = 0;
        for (HeldVotes entry : held.values()) {
            count += entry.votes.size();
        }
        return count;
    }

    public void clear() {
        held.clear();
    }
}
