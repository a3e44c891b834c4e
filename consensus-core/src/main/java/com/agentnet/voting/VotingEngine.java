package com.agentnet.voting;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

import com.agentnet.committee.CommitteeManager;
import com.agentnet.exception.ConsensusException;
import com.agentnet.exception.DuplicateVoteException;
import com.agentnet.exception.InvalidVoteSignatureException;
import com.agentnet.exception.NotCommitteeMemberException;
import com.agentnet.exception.ProposalClosedException;
import com.agentnet.exception.ProposalNotFoundException;
import com.agentnet.exception.VoteSigningException;
import com.agentnet.exception.VotingDeadlinePassedException;
import com.agentnet.hooks.SignatureVerifier;
import com.agentnet.hooks.SigningException;
import com.agentnet.hooks.VoteSigner;
import com.agentnet.proposal.ConsensusPhase;
import com.agentnet.proposal.ConsensusResult;
import com.agentnet.proposal.Proposal;
import com.agentnet.proposal.ProposalStore;
import com.agentnet.proposal.Vote;

import lombok.extern.slf4j.Slf4j;

/**
 * Records votes, one per member per proposal, and re-evaluates quorum after each one.
 * Recording and evaluation must run under the same lock; the consensus manager
 * provides it.
 */
@Slf4j
public class VotingEngine {
    private final String nodeId;
    private final CommitteeManager committeeManager;
    private final ProposalStore proposalStore;
    private final VoteSigner signer;
    private final SignatureVerifier verifier;
    private final double quorumFraction;
    private final Clock clock;

    public VotingEngine(String nodeId, CommitteeManager committeeManager, ProposalStore proposalStore,
            VoteSigner signer, SignatureVerifier verifier, double quorumFraction, Clock clock) {
        this.nodeId = nodeId;
        this.committeeManager = committeeManager;
        this.proposalStore = proposalStore;
        this.signer = signer;
        this.verifier = verifier;
        this.quorumFraction = quorumFraction;
        this.clock = clock;
    }

    /**
     * Casts the local node's vote.
     *
     * @return the proposal after the vote has been recorded and quorum evaluated
     * @throws VotingDeadlinePassedException after moving the proposal to TIMEOUT
     * @throws VoteSigningException          if the signer fails; nothing is recorded
     */
    public Proposal castVote(String proposalId, boolean decision, String reason) throws ConsensusException {
        Proposal proposal = admit(nodeId, proposalId);

        String signature = "";
        if (signer != null) {
            byte[] payload = Vote.signingPayload(proposalId, nodeId, decision).getBytes(StandardCharsets.UTF_8);
            try {
                signature = signer.sign(payload);
            } catch (SigningException e) {
                throw new VoteSigningException(proposalId, e);
            }
        }

        Vote vote = new Vote(nodeId, decision, reason, clock.millis(), signature);
        record(proposal, vote);
        return proposal;
    }

    /**
     * Applies a vote cast by a peer. Goes through the same checks as a local vote,
     * then checks the vote's signature when a verifier is configured.
     *
     * @throws InvalidVoteSignatureException if the verifier rejects the signature
     */
    public Proposal acceptRemoteVote(String proposalId, Vote vote) throws ConsensusException {
        Proposal proposal = admit(vote.getVoterId(), proposalId);

        if (verifier != null) {
            byte[] payload = Vote.signingPayload(proposalId, vote.getVoterId(), vote.isDecision())
                    .getBytes(StandardCharsets.UTF_8);
            if (!verifier.verify(vote.getVoterId(), payload, vote.getSignature())) {
                log.warn("{}: Rejecting vote from {} on {}: bad signature", nodeId, vote.getVoterId(), proposalId);
                throw new InvalidVoteSignatureException(
                        "invalid signature on vote from " + vote.getVoterId() + " for proposal " + proposalId);
            }
        }

        record(proposal, vote);
        return proposal;
    }

    /**
     * Decides whether the votes so far settle the proposal. Passes once agreeing
     * votes reach quorum; rejects as soon as quorum is out of reach even if every
     * remaining member agreed; otherwise leaves it pending.
     *
     * @return the proposal's phase after evaluation
     */
    public ConsensusPhase checkConsensus(Proposal proposal) {
        if (proposal.isTerminal()) {
            return proposal.getPhase();
        }
        int agree = proposal.countVotes(true);
        int totalVoters = committeeManager.size();
        int quorum = committeeManager.quorumSize();
        int remaining = totalVoters - proposal.getVotes().size();

        if (agree >= quorum) {
            finish(proposal, ConsensusPhase.FINALIZED, true, ConsensusResult.REASON_QUORUM_REACHED);
        } else if (agree + remaining < quorum) {
            finish(proposal, ConsensusPhase.REJECTED, false, ConsensusResult.REASON_CANNOT_REACH_QUORUM);
        }
        return proposal.getPhase();
    }

    /**
     * Moves an open proposal to TIMEOUT with a failing result built from its votes.
     */
    public void expire(Proposal proposal) {
        finish(proposal, ConsensusPhase.TIMEOUT, false, ConsensusResult.REASON_TIMEOUT);
    }

    private Proposal admit(String voterId, String proposalId) throws ConsensusException {
        if (!committeeManager.isMember(voterId)) {
            throw new NotCommitteeMemberException(voterId);
        }
        Proposal proposal = proposalStore.get(proposalId);
        if (proposal == null) {
            throw new ProposalNotFoundException(proposalId);
        }
        if (proposal.hasVoted(voterId)) {
            throw new DuplicateVoteException(proposalId, voterId);
        }
        if (proposal.isTerminal()) {
            throw new ProposalClosedException(proposalId, proposal.getPhase());
        }
        if (proposal.isExpired(clock.millis())) {
            expire(proposal);
            throw new VotingDeadlinePassedException(proposalId);
        }
        return proposal;
    }

    private void record(Proposal proposal, Vote vote) {
        proposal.recordVote(vote);
        log.debug("{}: Recorded {} vote from {} on {} ({} of {} cast)", nodeId,
                vote.isDecision() ? "agree" : "disagree", vote.getVoterId(), proposal.getId(),
                proposal.getVotes().size(), committeeManager.size());
        checkConsensus(proposal);
    }

    private void finish(Proposal proposal, ConsensusPhase phase, boolean passed, String reason) {
        ConsensusResult result = proposal.tally(passed, committeeManager.size(), quorumFraction, clock.millis(),
                reason);
        proposal.complete(phase, result);
        log.info("{}: Proposal {} {} ({} agree, {} disagree, {} voters): {}", nodeId, proposal.getId(), phase,
                result.getAgreeCount(), result.getDisagreeCount(), result.getTotalVoters(), reason);
    }
}
