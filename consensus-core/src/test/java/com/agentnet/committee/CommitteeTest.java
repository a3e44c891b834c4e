package com.agentnet.committee;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class CommitteeTest {
    private static final double FRACTION = 0.67;

    @ParameterizedTest
    @CsvSource({ "0,1", "1,1", "2,1", "3,2", "4,2", "5,3", "6,4", "7,4", "9,6", "10,6", "11,7" })
    public void testQuorumSizeIsFlooredWithMinimumOfOne(int size, int expected) {
        assertEquals(expected, Committee.quorumSize(size, FRACTION));
    }

    @Test
    public void testFirstMemberLeadsAndOthersDoNot() {
        CommitteeMember a = new CommitteeMember("A", "pkA", 1.0, 0, false);
        CommitteeMember b = new CommitteeMember("B", "pkB", 1.0, 0, true);
        Committee committee = new Committee(Arrays.asList(a, b), 100L);

        assertEquals("A", committee.getLeader().getNodeId());
        assertTrue(committee.getMembers().get(0).isLeader());
        assertFalse(committee.getMembers().get(1).isLeader(), "incoming leader flags are cleared");
        assertEquals(0, committee.getLeaderIndex());
        assertEquals(100L, committee.getUpdatedAt());
    }

    @Test
    public void testInputMembersAreCopied() {
        CommitteeMember a = new CommitteeMember("A", "pkA", 1.0, 0);
        Committee committee = new Committee(List.of(a), 0L);
        assertFalse(a.isLeader(), "caller's member object is untouched");
        assertTrue(committee.getLeader().isLeader());
    }

    @Test
    public void testEmptyCommitteeHasNoLeader() {
        Committee committee = Committee.empty(0L);
        assertNull(committee.getLeader());
        assertEquals(0, committee.size());
        assertEquals(1, committee.quorumSize(FRACTION));
        assertFalse(committee.isMember("A"));
        assertFalse(committee.isMember(null));
    }

    @Test
    public void testAdvanceLeaderWrapsAround() {
        Committee committee = new Committee(List.of(new CommitteeMember("A", "", 0, 0),
                new CommitteeMember("B", "", 0, 0)), 0L);
        assertTrue(committee.advanceLeader(5L));
        assertEquals("B", committee.getLeader().getNodeId());
        assertTrue(committee.advanceLeader(6L));
        assertEquals("A", committee.getLeader().getNodeId());
        assertEquals(2, committee.getRotationSequence());
        assertEquals(6L, committee.getUpdatedAt());
        assertFalse(Committee.empty(0L).advanceLeader(1L));
    }

    @Test
    public void testCopyIsIndependent() {
        Committee committee = new Committee(List.of(new CommitteeMember("A", "", 0, 0),
                new CommitteeMember("B", "", 0, 0)), 0L);
        Committee copy = committee.copy();
        copy.advanceLeader(1L);
        assertEquals("A", committee.getLeader().getNodeId());
        assertEquals("B", copy.getLeader().getNodeId());
    }
}
