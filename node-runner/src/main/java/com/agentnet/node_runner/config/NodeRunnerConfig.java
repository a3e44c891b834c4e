package com.agentnet.node_runner.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.agentnet.config.ConsensusConfig;
import com.agentnet.hooks.Broadcaster;
import com.agentnet.hooks.ConsensusHooks;
import com.agentnet.hooks.LoggingBroadcaster;
import com.agentnet.node.ConsensusManager;
import com.agentnet.sweeper.SweepTimer;
import com.agentnet.sweeper.SweepTimerImpl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class NodeRunnerConfig {
    private final NodeConfig nodeConfig;

    @Bean
    public ConsensusConfig consensusConfig() {
        ConsensusConfig config = nodeConfig.toConsensusConfig();
        log.info("{}: Consensus settings {}", nodeConfig.getNodeId(), config);
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public SweepTimer sweepTimer(ConsensusConfig consensusConfig) {
        return new SweepTimerImpl(consensusConfig.getSweepInterval());
    }

    // no transport is wired in this process, outgoing messages are only logged
    @Bean
    public Broadcaster broadcaster() {
        return new LoggingBroadcaster();
    }

    @Bean
    public ConsensusManager consensusManager(
            ConsensusConfig consensusConfig,
            Broadcaster broadcaster,
            Clock clock,
            SweepTimer sweepTimer) {
        ConsensusHooks hooks = ConsensusHooks.builder().broadcaster(broadcaster).build();
        return new ConsensusManager(nodeConfig.getNodeId(), consensusConfig, hooks, clock, sweepTimer);
    }
}
