package com.agentnet.node_runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;

import com.agentnet.node.ConsensusManager;

@SpringBootTest
@TestPropertySource(properties = {
		"consensus.nodeId=test-node",
		"consensus.committee[0].nodeId=test-node",
		"consensus.committee[1].nodeId=node2",
		"consensus.committee[2].nodeId=node3",
		"consensus.sweepInterval=100ms"
})
class NodeRunnerApplicationTests {

	@Autowired
	private ApplicationContext context;

	@Test
	void contextLoads() {
		assertNotNull(context, "Application context should load");
		assertTrue(context.containsBean("consensusNodeManager"), "ConsensusNodeManager Bean should exist");
		assertTrue(context.containsBean("consensusManager"), "ConsensusManager should exist");
		assertTrue(context.containsBean("leaderRotationService"), "LeaderRotationService should exist");
	}

	@Test
	void committeeIsInstalledOnStartup() {
		ConsensusManager manager = context.getBean(ConsensusManager.class);
		assertEquals("test-node", manager.getNodeId());
		assertEquals(3, manager.getCommittee().size());
		assertTrue(manager.isLeader(), "first configured member should lead");
		assertEquals(2, manager.quorumSize());
	}

}
