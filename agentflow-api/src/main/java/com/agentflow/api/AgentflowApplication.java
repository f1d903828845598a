package com.agentflow.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application entry point for the agentflow workflow engine.
 * Engine and recovery components are wired explicitly by {@link com.agentflow.api.config.EngineConfiguration}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.agentflow.api.config")
public class AgentflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentflowApplication.class, args);
    }
}
