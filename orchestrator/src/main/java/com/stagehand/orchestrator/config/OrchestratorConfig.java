package com.stagehand.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StagehandProperties.class)
public class OrchestratorConfig {
}
