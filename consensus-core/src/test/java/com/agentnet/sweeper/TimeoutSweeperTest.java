package com.agentnet.sweeper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.agentnet.TestClock;
import com.agentnet.committee.CommitteeManager;
import com.agentnet.committee.CommitteeMember;
import com.agentnet.config.ConsensusConfig;
import com.agentnet.proposal.ConsensusPhase;
import com.agentnet.proposal.ConsensusResult;
import com.agentnet.proposal.Proposal;
import com.agentnet.proposal.ProposalStore;
import com.agentnet.proposal.ProposalType;
import com.agentnet.voting.VotingEngine;

public class TimeoutSweeperTest {
    private TestClock clock;
    private ProposalStore store;
    private VotingEngine engine;
    private TimeoutSweeper sweeper;

    @BeforeEach
    public void setup() {
        clock = new TestClock();
        CommitteeManager committeeManager = new CommitteeManager("A", ConsensusConfig.defaults(), clock);
        committeeManager.setCommittee(List.of(new CommitteeMember("A", "", 1.0, 0L),
                new CommitteeMember("B", "", 1.0, 0L), new CommitteeMember("C", "", 1.0, 0L)));
        store = new ProposalStore(100, Duration.ofSeconds(30), clock);
        engine = new VotingEngine("A", committeeManager, store, null, null, 0.67, clock);
        sweeper = new TimeoutSweeper(store, engine, clock);
    }

    @Test
    public void testOnlyOverdueProposalsTimeOut() throws Exception {
        Proposal old = store.create(ProposalType.JOIN, null, "A");
        clock.advance(Duration.ofSeconds(20));
        Proposal recent = store.create(ProposalType.JOIN, null, "A");
        clock.advance(Duration.ofSeconds(11));

        assertEquals(1, sweeper.checkTimeouts());
        assertEquals(ConsensusPhase.TIMEOUT, old.getPhase());
        assertEquals(ConsensusPhase.PENDING, recent.getPhase());
    }

    @Test
    public void testTimeoutNeverPassesEvenWithAgreeVotes() throws Exception {
        Proposal proposal = store.create(ProposalType.PARAMETER, null, "A");
        engine.castVote(proposal.getId(), true, "");
        clock.advance(Duration.ofMinutes(1));

        sweeper.checkTimeouts();
        ConsensusResult result = proposal.getResult();
        assertFalse(result.isPassed());
        assertEquals(1, result.getAgreeCount());
        assertEquals(3, result.getTotalVoters());
        assertEquals("timeout", result.getReason());
        assertEquals(clock.millis(), result.getFinalizedAt());
    }

    @Test
    public void testSecondSweepChangesNothing() throws Exception {
        Proposal proposal = store.create(ProposalType.JOIN, null, "A");
        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, sweeper.checkTimeouts());
        ConsensusResult first = proposal.getResult();

        clock.advance(Duration.ofMinutes(1));
        assertEquals(0, sweeper.checkTimeouts());
        assertSame(first, proposal.getResult());
    }

    @Test
    public void testResolvedProposalsAreSkipped() throws Exception {
        Proposal proposal = store.create(ProposalType.JOIN, null, "A");
        engine.castVote(proposal.getId(), false, "");
        clock.advance(Duration.ofMinutes(1));
        proposal.complete(ConsensusPhase.REJECTED, proposal.tally(false, 3, 0.67, 0L, "cannot reach quorum"));

        assertEquals(0, sweeper.checkTimeouts());
        assertEquals(ConsensusPhase.REJECTED, proposal.getPhase());
    }
}
