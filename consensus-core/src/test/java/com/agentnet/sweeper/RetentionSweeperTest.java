package com.agentnet.sweeper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.agentnet.TestClock;
import com.agentnet.proposal.ConsensusPhase;
import com.agentnet.proposal.Proposal;
import com.agentnet.proposal.ProposalStore;
import com.agentnet.proposal.ProposalType;

public class RetentionSweeperTest {
    private TestClock clock;
    private ProposalStore store;
    private RetentionSweeper sweeper;

    @BeforeEach
    public void setup() {
        clock = new TestClock();
        store = new ProposalStore(100, Duration.ofSeconds(30), clock);
        sweeper = new RetentionSweeper(store, clock);
    }

    private static void finish(Proposal proposal) {
        proposal.complete(ConsensusPhase.FINALIZED, proposal.tally(true, 1, 0.67, 0L, "quorum reached"));
    }

    @Test
    public void testRemovesOnlyOldTerminalProposals() throws Exception {
        Proposal oldTerminal = store.create(ProposalType.JOIN, null, "A");
        finish(oldTerminal);
        Proposal oldPending = store.create(ProposalType.JOIN, null, "A");
        clock.advance(Duration.ofMinutes(50));
        Proposal recentTerminal = store.create(ProposalType.KICK, null, "A");
        finish(recentTerminal);
        clock.advance(Duration.ofMinutes(20));

        assertEquals(1, sweeper.cleanupOldProposals(Duration.ofHours(1)));
        assertNull(store.get(oldTerminal.getId()));
        assertNotNull(store.get(oldPending.getId()), "pending proposals survive regardless of age");
        assertNotNull(store.get(recentTerminal.getId()));
    }

    @Test
    public void testNothingToRemove() throws Exception {
        store.create(ProposalType.JOIN, null, "A");
        assertEquals(0, sweeper.cleanupOldProposals(Duration.ZERO));
        assertEquals(1, store.size());
    }
}
