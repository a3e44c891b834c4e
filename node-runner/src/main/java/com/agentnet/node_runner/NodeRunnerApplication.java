package com.agentnet.node_runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class NodeRunnerApplication {

	public static void main(String[] args) {
		SpringApplication.run(NodeRunnerApplication.class, args);
	}

}
