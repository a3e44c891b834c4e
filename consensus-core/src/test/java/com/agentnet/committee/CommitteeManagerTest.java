package com.agentnet.committee;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.agentnet.TestClock;
import com.agentnet.config.ConsensusConfig;

public class CommitteeManagerTest {
    private TestClock clock;
    private CommitteeManager manager;

    @BeforeEach
    public void setup() {
        clock = new TestClock();
        manager = new CommitteeManager("A", ConsensusConfig.defaults(), clock);
    }

    private static List<CommitteeMember> members(String... ids) {
        List<CommitteeMember> members = new ArrayList<>();
        for (String id : ids) {
            members.add(new CommitteeMember(id, "pk-" + id, 1.0, 0L));
        }
        return members;
    }

    @Test
    @DisplayName("Set committee resets leader to first member")
    public void testSetCommittee() {
        manager.setCommittee(members("A", "B", "C", "D", "E"));
        manager.rotateLeader();
        manager.setCommittee(members("C", "D", "E", "F"));

        assertEquals("C", manager.getLeader().getNodeId());
        assertEquals(0, manager.snapshot().getLeaderIndex());
        assertEquals(0, manager.getView());
        assertEquals(4, manager.size());
        assertFalse(manager.isLocalMember());
    }

    @Test
    @DisplayName("Rotation is cyclic with period equal to committee size")
    public void testRotationPeriod() {
        manager.setCommittee(members("A", "B", "C", "D", "E"));
        List<String> leaders = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            assertTrue(manager.rotateLeader());
            leaders.add(manager.getLeader().getNodeId());
        }
        assertEquals(List.of("B", "C", "D", "E", "A"), leaders);
        assertTrue(manager.isLocalLeader());
        assertEquals(5, manager.getView());

        long leaderFlags = manager.snapshot().getMembers().stream().filter(CommitteeMember::isLeader).count();
        assertEquals(1, leaderFlags);
    }

    @Test
    public void testRotationStampsUpdatedAt() {
        manager.setCommittee(members("A", "B", "C", "D"));
        long before = manager.snapshot().getUpdatedAt();
        clock.advance(Duration.ofSeconds(5));
        manager.rotateLeader();
        assertEquals(before + 5000, manager.snapshot().getUpdatedAt());
    }

    @Test
    public void testRotateOnEmptyCommitteeIsNoOp() {
        assertFalse(manager.rotateLeader());
        assertNull(manager.getLeader());
        assertEquals(0, manager.getView());
    }

    @Test
    public void testMembershipAndQuorum() {
        manager.setCommittee(members("A", "B", "C"));
        assertTrue(manager.isLocalMember());
        assertTrue(manager.isMember("B"));
        assertFalse(manager.isMember("Z"));
        assertEquals(2, manager.quorumSize());
    }

    @Test
    public void testOutOfRangeSizeIsStillApplied() {
        manager.setCommittee(members("A", "B"));
        assertEquals(2, manager.size());
        assertEquals(1, manager.quorumSize());
    }

    @Test
    public void testDuplicateMembersAreRejected() {
        manager.setCommittee(members("A", "B", "C"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> manager.setCommittee(members("A", "A", "A")));
        assertTrue(e.getMessage().contains("A"), e.getMessage());

        // the previous committee stays in force
        assertEquals(3, manager.size());
        assertTrue(manager.isMember("B"));
        assertEquals(2, manager.quorumSize());
    }

    @Test
    public void testMemberWithoutNodeIdIsRejected() {
        List<CommitteeMember> members = members("A", "B");
        members.add(new CommitteeMember(null, "pk", 1.0, 0L));
        assertThrows(IllegalArgumentException.class, () -> manager.setCommittee(members));
        assertEquals(0, manager.size());
    }
}
